package com.enterprise.campaign.analytics.application;

import com.enterprise.campaign.analytics.domain.Influencer;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Key lookup used for the influencer side of every join. The first row wins
 * when an id is duplicated; unknown ids resolve to {@code null}.
 */
final class InfluencerIndex {

    private final Map<Long, Influencer> byId = new HashMap<>();

    InfluencerIndex(List<Influencer> influencers) {
        for (Influencer influencer : influencers) {
            byId.putIfAbsent(influencer.id(), influencer);
        }
    }

    Influencer get(Long id) {
        return byId.get(id);
    }
}
