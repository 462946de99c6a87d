package com.enterprise.campaign.analytics.domain;

import java.math.BigDecimal;

public record KpiSummary(
    BigDecimal totalRevenue,
    long totalOrders,
    long totalReach,
    long totalEngagement
) {}
