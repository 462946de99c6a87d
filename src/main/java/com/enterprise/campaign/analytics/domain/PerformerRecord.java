package com.enterprise.campaign.analytics.domain;

import java.math.BigDecimal;

/**
 * One ranked influencer. Influencer attributes are {@code null} when the
 * tracking rows reference an unknown influencer. Post metrics are {@code null}
 * when the influencer has no posts in scope. {@code revenuePerFollower} and
 * {@code ordersPerPost} are {@code null} when their denominator is zero or
 * missing, never a substitute zero.
 */
public record PerformerRecord(
    Long influencerId,
    String name,
    Platform platform,
    String category,
    Long followerCount,
    BigDecimal revenue,
    long orders,
    Long reach,
    Long likes,
    Long comments,
    BigDecimal engagementRate,
    BigDecimal revenuePerFollower,
    BigDecimal ordersPerPost
) {}
