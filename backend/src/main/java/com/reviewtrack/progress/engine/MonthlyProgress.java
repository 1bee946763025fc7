package com.reviewtrack.progress.engine;

import java.time.YearMonth;

/**
 * Number of items that reached each stage within one UTC calendar month.
 */
public record MonthlyProgress(YearMonth month, long annotated, long validated, long published, long publishFailed) {
}
