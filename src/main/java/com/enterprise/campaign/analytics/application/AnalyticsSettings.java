package com.enterprise.campaign.analytics.application;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Immutable configuration shared by the engine components.
 *
 * @param benchmarkRoi  target ROI in percent; deltas are reported against it
 * @param benchmarkRoas target revenue multiple
 * @param costRatio     share of revenue assumed as cost when no payout data applies
 * @param topLimit      default size of ranked lists
 * @param baselineDays  length of the recent window for incremental ROAS
 */
public record AnalyticsSettings(
    BigDecimal benchmarkRoi,
    BigDecimal benchmarkRoas,
    BigDecimal costRatio,
    int topLimit,
    int baselineDays
) {

    public static final BigDecimal DEFAULT_BENCHMARK_ROI = new BigDecimal("200");
    public static final BigDecimal DEFAULT_BENCHMARK_ROAS = new BigDecimal("4.0");
    public static final BigDecimal DEFAULT_COST_RATIO = new BigDecimal("0.25");
    public static final int DEFAULT_TOP_LIMIT = 10;
    public static final int DEFAULT_BASELINE_DAYS = 30;

    public AnalyticsSettings {
        Objects.requireNonNull(benchmarkRoi, "benchmarkRoi");
        Objects.requireNonNull(benchmarkRoas, "benchmarkRoas");
        Objects.requireNonNull(costRatio, "costRatio");
        if (costRatio.signum() < 0) {
            throw new IllegalArgumentException("costRatio must not be negative: " + costRatio);
        }
        if (topLimit < 1) {
            throw new IllegalArgumentException("topLimit must be positive: " + topLimit);
        }
        if (baselineDays < 0) {
            throw new IllegalArgumentException("baselineDays must not be negative: " + baselineDays);
        }
    }

    public static AnalyticsSettings defaults() {
        return new AnalyticsSettings(DEFAULT_BENCHMARK_ROI, DEFAULT_BENCHMARK_ROAS,
                DEFAULT_COST_RATIO, DEFAULT_TOP_LIMIT, DEFAULT_BASELINE_DAYS);
    }

    public AnalyticsSettings withCostRatio(BigDecimal ratio) {
        return new AnalyticsSettings(benchmarkRoi, benchmarkRoas, ratio, topLimit, baselineDays);
    }

    public FixedRatioCost fixedRatioCost() {
        return new FixedRatioCost(costRatio);
    }
}
