package com.enterprise.campaign.analytics.domain;

/**
 * Which cost model produced a cost figure.
 */
public enum CostBasis {
    /** Sum of recorded payouts for the influencers in scope. */
    PAYOUT,
    /** Fixed share of attributed revenue. */
    FIXED_RATIO
}
