package com.enterprise.campaign.analytics.application;

import com.enterprise.campaign.analytics.domain.CampaignSnapshot;
import com.enterprise.campaign.analytics.domain.KpiSummary;
import com.enterprise.campaign.analytics.domain.RoiRoasMetrics;
import com.enterprise.campaign.analytics.domain.TrackingRecord;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Derives ROI, ROAS and their benchmark deltas from a snapshot.
 *
 * <p>Cost comes from {@link #selectCostModel}: recorded payouts of the
 * influencers present in tracking when any exist, otherwise the configured
 * fixed share of revenue.
 */
public class MetricsCalculator {

    private static final Logger log = LoggerFactory.getLogger(MetricsCalculator.class);

    private final AnalyticsSettings settings;

    public MetricsCalculator(AnalyticsSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public RoiRoasMetrics calculateRoiRoas(CampaignSnapshot snapshot) {
        CostModel model = selectCostModel(snapshot);
        if (snapshot.tracking().isEmpty()) {
            return new RoiRoasMetrics(BigDecimal.ZERO, BigDecimal.ZERO,
                    settings.benchmarkRoi().negate(), settings.benchmarkRoas().negate(),
                    BigDecimal.ZERO, BigDecimal.ZERO, model.basis());
        }

        BigDecimal totalRevenue = RevenueTotals.of(snapshot.tracking()).revenue();
        BigDecimal totalCost = model.costOf(totalRevenue, trackedInfluencers(snapshot));
        BigDecimal roi = Ratios.roi(totalRevenue, totalCost);
        BigDecimal roas = Ratios.roas(totalRevenue, totalCost);

        log.debug("ROI/ROAS over {} tracking rows: revenue={} cost={} ({})",
                snapshot.tracking().size(), totalRevenue, totalCost, model.basis());
        return new RoiRoasMetrics(roi, roas,
                roi.subtract(settings.benchmarkRoi()),
                roas.subtract(settings.benchmarkRoas()),
                totalRevenue, totalCost, model.basis());
    }

    /**
     * Payout-based cost when at least one payout row belongs to an influencer
     * present in tracking, fixed-ratio cost otherwise.
     */
    public CostModel selectCostModel(CampaignSnapshot snapshot) {
        return PayoutBasedCost.covering(snapshot.payouts(), trackedInfluencers(snapshot))
                .<CostModel>map(model -> model)
                .orElseGet(settings::fixedRatioCost);
    }

    /** Dashboard totals: revenue, orders, reach and likes plus comments. */
    public KpiSummary summarizeKpis(CampaignSnapshot snapshot) {
        RevenueTotals revenue = RevenueTotals.of(snapshot.tracking());
        EngagementTotals engagement = EngagementTotals.of(snapshot.posts());
        return new KpiSummary(revenue.revenue(), revenue.orders(),
                engagement.reach(), engagement.engagement());
    }

    private static Set<Long> trackedInfluencers(CampaignSnapshot snapshot) {
        Set<Long> ids = new LinkedHashSet<>();
        for (TrackingRecord row : snapshot.tracking()) {
            ids.add(row.influencerId());
        }
        return ids;
    }
}
