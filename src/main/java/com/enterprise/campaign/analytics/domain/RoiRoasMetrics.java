package com.enterprise.campaign.analytics.domain;

import java.math.BigDecimal;

/**
 * Headline return figures for a snapshot. {@code avgRoi} is a percentage,
 * {@code avgRoas} a revenue multiple; the change fields are deltas against the
 * configured benchmarks.
 */
public record RoiRoasMetrics(
    BigDecimal avgRoi,
    BigDecimal avgRoas,
    BigDecimal roiChange,
    BigDecimal roasChange,
    BigDecimal totalRevenue,
    BigDecimal totalCost,
    CostBasis costBasis
) {}
