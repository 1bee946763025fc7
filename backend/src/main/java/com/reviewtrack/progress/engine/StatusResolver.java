package com.reviewtrack.progress.engine;

import com.reviewtrack.common.CompletionMath;

import java.math.BigDecimal;
import java.util.List;
import java.util.function.Predicate;

/**
 * Maps a completion vector to one {@link ResolvedStatus}. Rules are evaluated in list order and the first match wins;
 * a nonzero publish failure dominates every full-stage threshold.
 */
public final class StatusResolver {

    record Rule(ResolvedStatus status, Predicate<CompletionVector> matches) {
    }

    static final List<Rule> RULES = List.of(
            new Rule(ResolvedStatus.PUBLISH_FAILED, v -> CompletionMath.isPositive(v.publishFailed())),
            new Rule(ResolvedStatus.PENDING, v -> CompletionMath.isFull(v.pending())),
            new Rule(ResolvedStatus.ANNOTATED, v -> CompletionMath.isFull(v.annotated())),
            new Rule(ResolvedStatus.VALIDATED, v -> CompletionMath.isFull(v.validated())),
            new Rule(ResolvedStatus.PUBLISHED, v -> CompletionMath.isFull(v.published()))
    );

    private StatusResolver() {
    }

    public static ResolvedStatus resolve(CompletionVector vector) {
        for (Rule rule : RULES) {
            if (rule.matches().test(vector)) {
                return rule.status();
            }
        }
        return ResolvedStatus.WIP;
    }

    public static ResolvedStatus resolve(BigDecimal pending, BigDecimal annotated, BigDecimal validated,
                                         BigDecimal published, BigDecimal publishFailed) {
        return resolve(new CompletionVector(pending, annotated, validated, published, publishFailed));
    }
}
