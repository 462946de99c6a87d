package com.enterprise.campaign.analytics.application;

import com.enterprise.campaign.analytics.domain.CostBasis;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Objects;

/**
 * Cost as a fixed share of revenue.
 */
public record FixedRatioCost(BigDecimal ratio) implements CostModel {

    public FixedRatioCost {
        Objects.requireNonNull(ratio, "ratio");
    }

    /** Cost of revenue that is not tied to particular influencers. */
    public BigDecimal costOf(BigDecimal revenue) {
        return revenue.multiply(ratio);
    }

    @Override
    public BigDecimal costOf(BigDecimal revenue, Collection<Long> influencerIds) {
        return costOf(revenue);
    }

    @Override
    public CostBasis basis() {
        return CostBasis.FIXED_RATIO;
    }
}
