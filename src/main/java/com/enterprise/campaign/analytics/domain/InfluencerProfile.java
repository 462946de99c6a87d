package com.enterprise.campaign.analytics.domain;

import java.math.BigDecimal;
import java.util.List;

/**
 * Drill-down for a single influencer. Post fields are {@code null} when the
 * influencer has no posts; payout fields are {@code null} without a payout row.
 */
public record InfluencerProfile(
    Long influencerId,
    BigDecimal totalRevenue,
    long totalOrders,
    BigDecimal avgOrderValue,
    long activeDays,
    List<String> campaigns,
    List<String> products,
    Integer totalPosts,
    Long totalReach,
    Long totalEngagement,
    BigDecimal avgEngagementRate,
    PayoutBasis payoutBasis,
    BigDecimal payoutRate,
    BigDecimal totalPayout
) {}
