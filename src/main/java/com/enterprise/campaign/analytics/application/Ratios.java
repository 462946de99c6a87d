package com.enterprise.campaign.analytics.application;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Shared return and rate formulas. Where zero is the right "no signal" answer
 * the denominator is floored at 1 and a zero true denominator yields zero.
 */
final class Ratios {

    static final MathContext MC = MathContext.DECIMAL64;
    static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private Ratios() {}

    /** {@code (revenue - cost) / max(cost, 1) * 100}, or 0 without cost. */
    static BigDecimal roi(BigDecimal revenue, BigDecimal cost) {
        if (cost.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return revenue.subtract(cost).divide(cost.max(BigDecimal.ONE), MC).multiply(HUNDRED);
    }

    /** {@code revenue / max(cost, 1)}, or 0 without cost. */
    static BigDecimal roas(BigDecimal revenue, BigDecimal cost) {
        if (cost.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return revenue.divide(cost.max(BigDecimal.ONE), MC);
    }

    /** {@code (likes + comments) / reach * 100}, or 0 without reach. */
    static BigDecimal engagementRate(long engagement, long reach) {
        if (reach <= 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(engagement).multiply(HUNDRED).divide(BigDecimal.valueOf(reach), MC);
    }

    /** Plain quotient, {@code null} when the denominator is absent or zero. */
    static BigDecimal ratioOrNull(BigDecimal numerator, Long denominator) {
        if (denominator == null || denominator == 0L) {
            return null;
        }
        return numerator.divide(BigDecimal.valueOf(denominator), MC);
    }

    /** Quotient that treats a zero denominator as no signal. */
    static BigDecimal ratioOrZero(BigDecimal numerator, long denominator) {
        if (denominator == 0L) {
            return BigDecimal.ZERO;
        }
        return numerator.divide(BigDecimal.valueOf(denominator), MC);
    }
}
