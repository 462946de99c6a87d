package com.enterprise.campaign.analytics.application;

import com.enterprise.campaign.analytics.domain.CampaignSnapshot;
import com.enterprise.campaign.analytics.domain.InfluencerProfile;
import com.enterprise.campaign.analytics.domain.PayoutRecord;
import com.enterprise.campaign.analytics.domain.Post;
import com.enterprise.campaign.analytics.domain.TrackingRecord;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-influencer drill-down.
 */
public class InfluencerProfiler {

    /**
     * Empty when the influencer has no tracking rows. Average order value and
     * engagement rate floor their denominators at 1.
     */
    public Optional<InfluencerProfile> profile(CampaignSnapshot snapshot, Long influencerId) {
        List<TrackingRecord> tracking = snapshot.tracking().stream()
                .filter(row -> Objects.equals(row.influencerId(), influencerId))
                .toList();
        if (tracking.isEmpty()) {
            return Optional.empty();
        }

        RevenueTotals totals = RevenueTotals.of(tracking);
        BigDecimal avgOrderValue = totals.revenue()
                .divide(BigDecimal.valueOf(Math.max(totals.orders(), 1L)), Ratios.MC);
        long activeDays = tracking.stream().map(TrackingRecord::date).filter(Objects::nonNull).distinct().count();
        List<String> campaigns = tracking.stream().map(TrackingRecord::campaign).distinct().toList();
        List<String> products = tracking.stream().map(TrackingRecord::product).distinct().toList();

        List<Post> posts = snapshot.posts().stream()
                .filter(row -> Objects.equals(row.influencerId(), influencerId))
                .toList();
        EngagementTotals engagement = posts.isEmpty() ? null : EngagementTotals.of(posts);

        Optional<PayoutRecord> payout = snapshot.payouts().stream()
                .filter(row -> Objects.equals(row.influencerId(), influencerId))
                .findFirst();

        return Optional.of(new InfluencerProfile(
            influencerId,
            totals.revenue(),
            totals.orders(),
            avgOrderValue,
            activeDays,
            campaigns,
            products,
            engagement == null ? null : engagement.posts(),
            engagement == null ? null : engagement.reach(),
            engagement == null ? null : engagement.engagement(),
            engagement == null ? null : Ratios.engagementRate(engagement.engagement(), Math.max(engagement.reach(), 1L)),
            payout.map(PayoutRecord::basis).orElse(null),
            payout.map(PayoutRecord::rate).orElse(null),
            payout.map(PayoutRecord::totalPayout).orElse(null)));
    }
}
