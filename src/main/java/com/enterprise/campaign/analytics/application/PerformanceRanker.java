package com.enterprise.campaign.analytics.application;

import com.enterprise.campaign.analytics.domain.CampaignSnapshot;
import com.enterprise.campaign.analytics.domain.Influencer;
import com.enterprise.campaign.analytics.domain.InfluencerRoi;
import com.enterprise.campaign.analytics.domain.PerformerRecord;
import com.enterprise.campaign.analytics.domain.PoorPerformanceReason;
import com.enterprise.campaign.analytics.domain.PoorPerformerRecord;
import com.enterprise.campaign.analytics.domain.Post;
import com.enterprise.campaign.analytics.domain.TrackingRecord;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ranks influencers by attributed revenue and flags those below the ROI
 * benchmark.
 *
 * <p>Tracking rows whose influencer is unknown still rank; their attribute
 * fields are {@code null}.
 */
public class PerformanceRanker {

    static final Comparator<Long> BY_ID = Comparator.nullsLast(Comparator.naturalOrder());

    private final AnalyticsSettings settings;

    public PerformanceRanker(AnalyticsSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public List<PerformerRecord> topPerformers(CampaignSnapshot snapshot) {
        return topPerformers(snapshot, settings.topLimit());
    }

    /**
     * Influencers sorted by revenue descending, ties by ascending id, cut to
     * {@code limit}. Empty when tracking or influencer data is empty.
     */
    public List<PerformerRecord> topPerformers(CampaignSnapshot snapshot, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        if (snapshot.tracking().isEmpty() || snapshot.influencers().isEmpty()) {
            return List.of();
        }

        InfluencerIndex index = new InfluencerIndex(snapshot.influencers());
        Map<Long, RevenueTotals> revenue = RevenueTotals.groupBy(snapshot.tracking(), TrackingRecord::influencerId);
        Map<Long, EngagementTotals> engagement = EngagementTotals.groupBy(snapshot.posts(), Post::influencerId);

        List<PerformerRecord> rows = new ArrayList<>(revenue.size());
        revenue.forEach((id, totals) -> {
            Influencer influencer = index.get(id);
            EngagementTotals posts = engagement.get(id);
            Long followers = influencer == null ? null : influencer.followerCount();
            Long reach = posts == null ? null : posts.reach();

            rows.add(new PerformerRecord(
                id,
                influencer == null ? null : influencer.name(),
                influencer == null ? null : influencer.platform(),
                influencer == null ? null : influencer.category(),
                followers,
                totals.revenue(),
                totals.orders(),
                reach,
                posts == null ? null : posts.likes(),
                posts == null ? null : posts.comments(),
                posts == null ? null : Ratios.engagementRate(posts.engagement(), posts.reach()),
                Ratios.ratioOrNull(totals.revenue(), followers),
                // reach stands in for post volume
                Ratios.ratioOrNull(BigDecimal.valueOf(totals.orders()), reach)));
        });

        return rows.stream()
                .sorted(Comparator.comparing(PerformerRecord::revenue).reversed()
                        .thenComparing(PerformerRecord::influencerId, BY_ID))
                .limit(limit)
                .toList();
    }

    /**
     * Revenue, orders, fixed-ratio cost and ROI per influencer, in first-seen
     * order. Cost is always the fixed share of revenue here, whatever payout
     * data the snapshot holds.
     */
    public List<InfluencerRoi> influencerReturns(CampaignSnapshot snapshot) {
        if (snapshot.tracking().isEmpty()) {
            return List.of();
        }
        InfluencerIndex index = new InfluencerIndex(snapshot.influencers());
        FixedRatioCost costModel = settings.fixedRatioCost();

        List<InfluencerRoi> rows = new ArrayList<>();
        RevenueTotals.groupBy(snapshot.tracking(), TrackingRecord::influencerId).forEach((id, totals) -> {
            Influencer influencer = index.get(id);
            BigDecimal cost = costModel.costOf(totals.revenue());
            rows.add(new InfluencerRoi(
                id,
                influencer == null ? null : influencer.name(),
                influencer == null ? null : influencer.platform(),
                totals.revenue(),
                totals.orders(),
                cost,
                Ratios.roi(totals.revenue(), cost)));
        });
        return rows;
    }

    /**
     * Influencers whose fixed-ratio ROI is below the benchmark, worst first
     * (ties by ascending id), each with the first matching
     * {@link PoorPerformanceReason}.
     */
    public List<PoorPerformerRecord> poorPerformers(CampaignSnapshot snapshot) {
        if (snapshot.tracking().isEmpty() || snapshot.influencers().isEmpty()) {
            return List.of();
        }
        return influencerReturns(snapshot).stream()
                .filter(row -> row.roi().compareTo(settings.benchmarkRoi()) < 0)
                .map(row -> new PoorPerformerRecord(
                        row.influencerId(), row.name(), row.platform(),
                        row.revenue(), row.orders(), row.cost(), row.roi(),
                        PoorPerformanceReason.classify(row.revenue(), row.orders(), row.roi())))
                .sorted(Comparator.comparing(PoorPerformerRecord::roi)
                        .thenComparing(PoorPerformerRecord::influencerId, BY_ID))
                .toList();
    }
}
