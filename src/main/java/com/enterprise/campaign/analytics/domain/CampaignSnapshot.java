package com.enterprise.campaign.analytics.domain;

import java.util.List;

/**
 * Immutable view of the four campaign tables handed between engine components.
 * Every list is an unmodifiable copy, so a snapshot never aliases caller data.
 */
public record CampaignSnapshot(
    List<Influencer> influencers,
    List<Post> posts,
    List<TrackingRecord> tracking,
    List<PayoutRecord> payouts
) {

    public CampaignSnapshot {
        influencers = influencers == null ? List.of() : List.copyOf(influencers);
        posts = posts == null ? List.of() : List.copyOf(posts);
        tracking = tracking == null ? List.of() : List.copyOf(tracking);
        payouts = payouts == null ? List.of() : List.copyOf(payouts);
    }

    public static CampaignSnapshot empty() {
        return new CampaignSnapshot(List.of(), List.of(), List.of(), List.of());
    }

    public boolean isEmpty() {
        return influencers.isEmpty() && posts.isEmpty() && tracking.isEmpty() && payouts.isEmpty();
    }

    public int totalRows() {
        return influencers.size() + posts.size() + tracking.size() + payouts.size();
    }
}
