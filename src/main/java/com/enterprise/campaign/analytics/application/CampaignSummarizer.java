package com.enterprise.campaign.analytics.application;

import com.enterprise.campaign.analytics.domain.BasisTotals;
import com.enterprise.campaign.analytics.domain.CampaignSnapshot;
import com.enterprise.campaign.analytics.domain.CampaignTotals;
import com.enterprise.campaign.analytics.domain.DataSummary;
import com.enterprise.campaign.analytics.domain.Influencer;
import com.enterprise.campaign.analytics.domain.PayoutBasis;
import com.enterprise.campaign.analytics.domain.PayoutRecord;
import com.enterprise.campaign.analytics.domain.PayoutSummary;
import com.enterprise.campaign.analytics.domain.Platform;
import com.enterprise.campaign.analytics.domain.Post;
import com.enterprise.campaign.analytics.domain.TrackingRecord;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Descriptive summaries of a snapshot: table sizes, per-campaign totals and
 * payout structure.
 */
public class CampaignSummarizer {

    public DataSummary dataSummary(CampaignSnapshot snapshot) {
        List<Platform> platforms = snapshot.influencers().stream()
                .map(Influencer::platform).filter(Objects::nonNull).distinct().toList();
        List<String> categories = snapshot.influencers().stream()
                .map(Influencer::category).filter(Objects::nonNull).distinct().toList();
        LocalDate firstPost = snapshot.posts().stream()
                .map(Post::date).filter(Objects::nonNull).min(LocalDate::compareTo).orElse(null);
        LocalDate lastPost = snapshot.posts().stream()
                .map(Post::date).filter(Objects::nonNull).max(LocalDate::compareTo).orElse(null);
        RevenueTotals revenue = RevenueTotals.of(snapshot.tracking());

        return new DataSummary(
            snapshot.influencers().size(),
            platforms,
            categories,
            snapshot.posts().size(),
            firstPost,
            lastPost,
            EngagementTotals.of(snapshot.posts()).reach(),
            snapshot.tracking().size(),
            revenue.revenue(),
            revenue.orders(),
            snapshot.payouts().size(),
            sumPayouts(snapshot.payouts()));
    }

    /** Revenue, orders and distinct influencers per campaign, by campaign name. */
    public List<CampaignTotals> campaignSummary(CampaignSnapshot snapshot) {
        Map<String, RevenueTotals> byCampaign = new TreeMap<>(
                RevenueTotals.groupBy(snapshot.tracking(), TrackingRecord::campaign));
        List<CampaignTotals> rows = new ArrayList<>(byCampaign.size());
        byCampaign.forEach((campaign, totals) ->
                rows.add(new CampaignTotals(campaign, totals.revenue(), totals.orders(), totals.influencerCount())));
        return rows;
    }

    public PayoutSummary payoutSummary(CampaignSnapshot snapshot) {
        List<PayoutRecord> payouts = snapshot.payouts();
        BigDecimal total = sumPayouts(payouts);
        long active = payouts.stream().filter(p -> p.totalPayout().signum() > 0).count();

        Map<PayoutBasis, List<PayoutRecord>> byBasis = new EnumMap<>(PayoutBasis.class);
        for (PayoutRecord payout : payouts) {
            byBasis.computeIfAbsent(payout.basis(), k -> new ArrayList<>()).add(payout);
        }
        List<BasisTotals> basisTotals = new ArrayList<>(byBasis.size());
        byBasis.forEach((basis, rows) -> basisTotals.add(new BasisTotals(basis, sumPayouts(rows), rows.size())));

        return new PayoutSummary(total, active, Ratios.ratioOrZero(total, payouts.size()), basisTotals);
    }

    private static BigDecimal sumPayouts(List<PayoutRecord> payouts) {
        return payouts.stream().map(PayoutRecord::totalPayout).reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
