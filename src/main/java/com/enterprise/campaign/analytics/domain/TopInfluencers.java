package com.enterprise.campaign.analytics.domain;

import java.util.List;

public record TopInfluencers(List<InfluencerRoi> byRevenue, List<InfluencerRoi> byRoi) {

    public TopInfluencers {
        byRevenue = List.copyOf(byRevenue);
        byRoi = List.copyOf(byRoi);
    }

    public static TopInfluencers empty() {
        return new TopInfluencers(List.of(), List.of());
    }
}
