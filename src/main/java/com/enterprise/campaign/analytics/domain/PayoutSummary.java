package com.enterprise.campaign.analytics.domain;

import java.math.BigDecimal;
import java.util.List;

/**
 * Payout totals. {@code activeInfluencers} counts rows with a positive payout.
 */
public record PayoutSummary(
    BigDecimal totalPayout,
    long activeInfluencers,
    BigDecimal averagePayout,
    List<BasisTotals> byBasis
) {}
