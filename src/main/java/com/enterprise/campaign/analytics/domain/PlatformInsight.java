package com.enterprise.campaign.analytics.domain;

import java.math.BigDecimal;

public record PlatformInsight(
    Platform platform,
    BigDecimal totalRevenue,
    long totalOrders,
    long influencerCount,
    BigDecimal avgRevenuePerInfluencer,
    BigDecimal avgEngagementRate,
    BigDecimal estimatedCost,
    BigDecimal avgRoi
) {}
