package com.enterprise.campaign.analytics.application;

import com.enterprise.campaign.analytics.domain.CampaignSnapshot;
import com.enterprise.campaign.analytics.domain.Influencer;
import com.enterprise.campaign.analytics.domain.Platform;
import com.enterprise.campaign.analytics.domain.Post;
import com.enterprise.campaign.analytics.domain.TrackingRecord;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Turns a snapshot into short, actionable advice. At most
 * {@value #MAX_RECOMMENDATIONS} entries, most significant first.
 */
public class RecommendationEngine {

    static final int MAX_RECOMMENDATIONS = 6;

    static final String NO_DATA = "Upload campaign data to generate personalized recommendations.";
    static final List<String> DEFAULTS = List.of(
            "Continue monitoring campaign performance regularly",
            "Experiment with different content formats and posting schedules",
            "Consider A/B testing different influencer categories",
            "Set up automated alerts for significant performance changes");

    private static final BigDecimal LOW_ROI = new BigDecimal("150");
    private static final BigDecimal HIGH_ROI = new BigDecimal("300");
    private static final BigDecimal LOW_ENGAGEMENT = new BigDecimal("2");
    private static final BigDecimal HIGH_ENGAGEMENT = new BigDecimal("5");
    private static final BigDecimal LOW_ORDER_VALUE = new BigDecimal("500");
    private static final BigDecimal HIGH_ORDER_VALUE = new BigDecimal("2000");
    private static final int SEASONAL_MIN_ROWS = 30;
    private static final int MIN_CAMPAIGNS = 3;

    private final AnalyticsSettings settings;
    private final MetricsCalculator metrics;

    public RecommendationEngine(AnalyticsSettings settings, MetricsCalculator metrics) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public List<String> recommend(CampaignSnapshot snapshot) {
        if (snapshot.tracking().isEmpty()) {
            return List.of(NO_DATA);
        }
        List<String> advice = new ArrayList<>();

        topPlatform(snapshot).ifPresent(entry -> advice.add(String.format(Locale.ENGLISH,
                "Focus investment on %s as it generates the highest revenue (₹%,.0f)",
                entry.getKey().label(), entry.getValue())));

        BigDecimal roi = metrics.calculateRoiRoas(snapshot).avgRoi();
        if (roi.compareTo(LOW_ROI) < 0) {
            advice.add("Consider optimizing campaign costs as ROI is below industry standards (target: >"
                    + settings.benchmarkRoi().stripTrailingZeros().toPlainString() + "%)");
        } else if (roi.compareTo(HIGH_ROI) > 0) {
            advice.add("Excellent ROI performance! Consider scaling successful campaigns");
        }

        BigDecimal engagement = meanPostEngagement(snapshot.posts());
        if (engagement != null) {
            if (engagement.compareTo(LOW_ENGAGEMENT) < 0) {
                advice.add("Work on content strategy to improve engagement rates (currently below 2%)");
            } else if (engagement.compareTo(HIGH_ENGAGEMENT) > 0) {
                advice.add("High engagement rates detected! Leverage successful content formats");
            }
        }

        RevenueTotals totals = RevenueTotals.of(snapshot.tracking());
        if (totals.orders() > 0) {
            BigDecimal avgOrderValue = Ratios.ratioOrZero(totals.revenue(), totals.orders());
            if (avgOrderValue.compareTo(LOW_ORDER_VALUE) < 0) {
                advice.add("Focus on promoting higher-value products to increase average order value");
            } else if (avgOrderValue.compareTo(HIGH_ORDER_VALUE) > 0) {
                advice.add("Strong average order value! Consider expanding premium product campaigns");
            }
        }

        if (snapshot.tracking().size() > SEASONAL_MIN_ROWS) {
            Map<Integer, RevenueTotals> byMonth = new TreeMap<>(RevenueTotals.groupBy(snapshot.tracking(),
                    row -> row.date() == null ? null : row.date().getMonthValue()));
            if (byMonth.size() > 1) {
                Integer bestMonth = null;
                BigDecimal best = null;
                for (Map.Entry<Integer, RevenueTotals> entry : byMonth.entrySet()) {
                    if (best == null || entry.getValue().revenue().compareTo(best) > 0) {
                        bestMonth = entry.getKey();
                        best = entry.getValue().revenue();
                    }
                }
                advice.add("Month " + bestMonth
                        + " shows peak performance - plan major campaigns during similar periods");
            }
        }

        long campaigns = snapshot.tracking().stream().map(TrackingRecord::campaign).distinct().count();
        if (campaigns < MIN_CAMPAIGNS) {
            advice.add("Consider diversifying campaigns across more brands/products to reduce risk");
        }

        if (advice.isEmpty()) {
            return DEFAULTS;
        }
        return List.copyOf(advice.subList(0, Math.min(advice.size(), MAX_RECOMMENDATIONS)));
    }

    private static Optional<Map.Entry<Platform, BigDecimal>> topPlatform(CampaignSnapshot snapshot) {
        if (snapshot.influencers().isEmpty()) {
            return Optional.empty();
        }
        InfluencerIndex index = new InfluencerIndex(snapshot.influencers());
        return RevenueTotals.groupBy(snapshot.tracking(), row -> {
                    Influencer influencer = index.get(row.influencerId());
                    return influencer == null ? null : influencer.platform();
                }).entrySet().stream()
                .map(e -> Map.entry(e.getKey(), e.getValue().revenue()))
                .max(Map.Entry.comparingByValue());
    }

    /** Mean of per-post engagement rates; posts without reach are left out. */
    private static BigDecimal meanPostEngagement(List<Post> posts) {
        List<BigDecimal> rates = posts.stream()
                .filter(p -> p.reach() > 0)
                .map(p -> Ratios.engagementRate(p.engagement(), p.reach()))
                .toList();
        if (rates.isEmpty()) {
            return null;
        }
        return Ratios.ratioOrZero(rates.stream().reduce(BigDecimal.ZERO, BigDecimal::add), rates.size());
    }
}
