package com.enterprise.campaign.analytics.infrastructure;

import com.enterprise.campaign.analytics.domain.PerformerRecord;
import com.enterprise.campaign.analytics.domain.PoorPerformerRecord;

import java.util.List;

/**
 * Performer tables handed from the insight step to the export steps of one
 * {@code campaignInsightsJob} run.
 */
public class CampaignRunContext {

    private List<PerformerRecord> topPerformers = List.of();
    private List<PoorPerformerRecord> poorPerformers = List.of();

    public void setPerformers(List<PerformerRecord> topPerformers,
            List<PoorPerformerRecord> poorPerformers) {
        this.topPerformers = List.copyOf(topPerformers);
        this.poorPerformers = List.copyOf(poorPerformers);
    }

    public List<PerformerRecord> topPerformers() {
        return topPerformers;
    }

    public List<PoorPerformerRecord> poorPerformers() {
        return poorPerformers;
    }
}
