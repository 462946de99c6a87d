package com.enterprise.campaign.analytics.application;

import com.enterprise.campaign.analytics.domain.CostBasis;

import java.math.BigDecimal;
import java.util.Collection;

/**
 * Strategy that prices the revenue attributed to a set of influencers.
 * Callers pick the model explicitly: {@link PayoutBasedCost} when recorded
 * payouts cover the influencers, {@link FixedRatioCost} otherwise.
 */
public interface CostModel {

    /**
     * @param revenue       revenue attributed to {@code influencerIds}
     * @param influencerIds influencers whose cost is wanted
     * @return cost, never negative
     */
    BigDecimal costOf(BigDecimal revenue, Collection<Long> influencerIds);

    CostBasis basis();
}
