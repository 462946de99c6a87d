package com.enterprise.campaign.analytics.application;

import com.enterprise.campaign.analytics.domain.CostBasis;
import com.enterprise.campaign.analytics.domain.PayoutRecord;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Cost as the sum of recorded payouts of the influencers in scope. Revenue
 * does not enter the figure.
 */
public final class PayoutBasedCost implements CostModel {

    private final List<PayoutRecord> payouts;

    public PayoutBasedCost(List<PayoutRecord> payouts) {
        this.payouts = List.copyOf(payouts);
    }

    /**
     * Returns a payout-based model when at least one payout row belongs to one
     * of {@code influencerIds}, empty otherwise.
     */
    public static Optional<PayoutBasedCost> covering(List<PayoutRecord> payouts, Collection<Long> influencerIds) {
        Set<Long> ids = new HashSet<>(influencerIds);
        boolean covered = payouts.stream().anyMatch(p -> ids.contains(p.influencerId()));
        return covered ? Optional.of(new PayoutBasedCost(payouts)) : Optional.empty();
    }

    @Override
    public BigDecimal costOf(BigDecimal revenue, Collection<Long> influencerIds) {
        Set<Long> ids = new HashSet<>(influencerIds);
        return payouts.stream()
                .filter(p -> ids.contains(p.influencerId()))
                .map(PayoutRecord::totalPayout)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @Override
    public CostBasis basis() {
        return CostBasis.PAYOUT;
    }
}
