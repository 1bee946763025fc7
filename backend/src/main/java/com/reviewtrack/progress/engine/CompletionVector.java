package com.reviewtrack.progress.engine;

import java.math.BigDecimal;

/**
 * Word-weighted completion percentages of a group (scale 2). pending includes LOADED items.
 */
public record CompletionVector(BigDecimal pending, BigDecimal annotated, BigDecimal validated,
                               BigDecimal published, BigDecimal publishFailed) {
}
