package com.enterprise.campaign.analytics.application;

import com.enterprise.campaign.analytics.domain.CampaignSnapshot;
import com.enterprise.campaign.analytics.domain.Platform;
import com.enterprise.campaign.analytics.domain.TrackingRecord;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static com.enterprise.campaign.analytics.CampaignFixtures.*;
import static org.assertj.core.api.Assertions.*;

class RecommendationEngineTest {

    private static RecommendationEngine engine(AnalyticsSettings settings) {
        return new RecommendationEngine(settings, new MetricsCalculator(settings));
    }

    private final RecommendationEngine engine = engine(AnalyticsSettings.defaults());

    @Test
    void noTrackingAsksForData() {
        assertThat(engine.recommend(CampaignSnapshot.empty())).containsExactly(RecommendationEngine.NO_DATA);
    }

    @Test
    void adviceForTwoInfluencerCampaign() {
        assertThat(engine.recommend(twoInfluencers())).containsExactly(
                "Focus investment on Instagram as it generates the highest revenue (₹5,000)",
                "Focus on promoting higher-value products to increase average order value",
                "Consider diversifying campaigns across more brands/products to reduce risk");
    }

    @Test
    void lowRoiNamesTheBenchmark() {
        List<String> advice = engine(AnalyticsSettings.defaults().withCostRatio(new BigDecimal("0.5")))
                .recommend(twoInfluencers());

        assertThat(advice).contains(
                "Consider optimizing campaign costs as ROI is below industry standards (target: >200%)");
    }

    @Test
    void lowEngagementIsFlagged() {
        CampaignSnapshot base = twoInfluencers();
        CampaignSnapshot snapshot = new CampaignSnapshot(base.influencers(),
                List.of(post(1, Platform.INSTAGRAM, JAN_5, 10000, 10, 0),
                        post(2, Platform.YOUTUBE, JAN_6, 0, 500, 500)),
                base.tracking(), List.of());

        assertThat(engine.recommend(snapshot))
                .contains("Work on content strategy to improve engagement rates (currently below 2%)");
    }

    @Test
    void peakMonthNeedsEnoughRows() {
        List<TrackingRecord> tracking = new ArrayList<>();
        for (int day = 1; day <= 20; day++) {
            tracking.add(sale(1L, "Glow", LocalDate.of(2025, 1, day), 1, "10"));
        }
        for (int day = 1; day <= 11; day++) {
            tracking.add(sale(2L, "Glow", LocalDate.of(2025, 2, day), 1, "100"));
        }
        CampaignSnapshot snapshot = new CampaignSnapshot(twoInfluencers().influencers(), List.of(), tracking,
                List.of());

        List<String> advice = engine.recommend(snapshot);

        assertThat(advice).contains("Month 2 shows peak performance - plan major campaigns during similar periods");
        assertThat(advice).hasSizeLessThanOrEqualTo(RecommendationEngine.MAX_RECOMMENDATIONS);
    }

    @Test
    void defaultsWhenNothingStandsOut() {
        CampaignSnapshot snapshot = new CampaignSnapshot(List.of(), List.of(),
                List.of(sale(1L, "Glow", JAN_5, 1, "1000"),
                        sale(1L, "Gadget", JAN_5, 1, "1000"),
                        sale(1L, "Trail", JAN_6, 1, "1000")),
                List.of());

        assertThat(engine.recommend(snapshot)).isEqualTo(RecommendationEngine.DEFAULTS);
    }
}
