package com.enterprise.campaign.analytics.domain;

import java.math.BigDecimal;

/**
 * Why an influencer sits below the ROI benchmark. Rules are checked in
 * declaration order and the first match wins.
 */
public enum PoorPerformanceReason {

    LOW_REVENUE("Low revenue generation"),
    LOW_CONVERSION("Low order conversion"),
    VERY_LOW_ROI("Very low ROI"),
    BELOW_BENCHMARK("Below benchmark ROI");

    private static final BigDecimal LOW_REVENUE_THRESHOLD = new BigDecimal("1000");
    private static final long LOW_ORDERS_THRESHOLD = 10L;
    private static final BigDecimal VERY_LOW_ROI_THRESHOLD = new BigDecimal("50");

    private final String label;

    PoorPerformanceReason(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static PoorPerformanceReason classify(BigDecimal revenue, long orders, BigDecimal roi) {
        if (revenue.compareTo(LOW_REVENUE_THRESHOLD) < 0) {
            return LOW_REVENUE;
        }
        if (orders < LOW_ORDERS_THRESHOLD) {
            return LOW_CONVERSION;
        }
        if (roi.compareTo(VERY_LOW_ROI_THRESHOLD) < 0) {
            return VERY_LOW_ROI;
        }
        return BELOW_BENCHMARK;
    }

    @Override
    public String toString() {
        return label;
    }
}
