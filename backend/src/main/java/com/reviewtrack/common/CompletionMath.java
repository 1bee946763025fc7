package com.reviewtrack.common;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Percentage helpers: part / total × 100, scale 2, HALF_UP. Zero total yields 0.00.
 * Rounding never crosses the 0 and 100 boundaries: a nonzero part is at least 0.01 and a part short of the
 * total is at most 99.99, so zero and full shares stay exact.
 */
public final class CompletionMath {

    public static final BigDecimal HUNDRED = new BigDecimal("100");
    private static final int SCALE = 2;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    private static final BigDecimal SMALLEST = new BigDecimal("0.01");
    private static final BigDecimal LARGEST_PARTIAL = new BigDecimal("99.99");

    private CompletionMath() {
    }

    public static BigDecimal percentage(long part, long total) {
        if (total <= 0) {
            return BigDecimal.ZERO.setScale(SCALE);
        }
        BigDecimal pct = BigDecimal.valueOf(part)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(total), SCALE, ROUNDING);
        if (part > 0 && pct.signum() == 0) {
            return SMALLEST;
        }
        if (part < total && pct.compareTo(HUNDRED) >= 0) {
            return LARGEST_PARTIAL;
        }
        return pct;
    }

    public static boolean isFull(BigDecimal pct) {
        return pct != null && pct.compareTo(HUNDRED) == 0;
    }

    public static boolean isPositive(BigDecimal pct) {
        return pct != null && pct.signum() > 0;
    }
}
