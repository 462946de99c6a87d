package com.enterprise.campaign.analytics.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Row counts and headline totals of a snapshot. Post dates are {@code null}
 * when there are no posts.
 */
public record DataSummary(
    int influencerCount,
    List<Platform> platforms,
    List<String> categories,
    int postCount,
    LocalDate firstPostDate,
    LocalDate lastPostDate,
    long totalReach,
    int trackingCount,
    BigDecimal totalRevenue,
    long totalOrders,
    int payoutCount,
    BigDecimal totalPayoutAmount
) {}
