package com.enterprise.campaign.analytics.domain;

import java.util.List;

/**
 * Aggregate of every insight computed over one snapshot.
 */
public record InsightReport(
    TopInfluencers topInfluencers,
    List<PlatformInsight> platformAnalysis,
    List<CategoryInsight> categoryAnalysis,
    List<PoorPerformerRecord> poorPerformers,
    TrendReport trends
) {

    public InsightReport {
        platformAnalysis = List.copyOf(platformAnalysis);
        categoryAnalysis = List.copyOf(categoryAnalysis);
        poorPerformers = List.copyOf(poorPerformers);
    }
}
