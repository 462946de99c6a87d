package com.enterprise.campaign.analytics.domain;

import java.math.BigDecimal;

/**
 * Rollup of one influencer category. Revenue figures are zero when no
 * tracking rows reach the category.
 */
public record CategoryInsight(
    String category,
    long influencerCount,
    BigDecimal avgFollowerCount,
    long totalFollowers,
    long totalPosts,
    BigDecimal revenue,
    long orders,
    BigDecimal avgRevenuePerPost,
    BigDecimal estimatedCost,
    BigDecimal avgRoi
) {}
