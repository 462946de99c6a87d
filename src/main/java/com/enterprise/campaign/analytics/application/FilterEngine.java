package com.enterprise.campaign.analytics.application;

import com.enterprise.campaign.analytics.domain.CampaignSnapshot;
import com.enterprise.campaign.analytics.domain.DateRange;
import com.enterprise.campaign.analytics.domain.FilterCriteria;
import com.enterprise.campaign.analytics.domain.Influencer;
import com.enterprise.campaign.analytics.domain.PayoutRecord;
import com.enterprise.campaign.analytics.domain.Post;
import com.enterprise.campaign.analytics.domain.TrackingRecord;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Narrows a snapshot to a consistent subset. Stages run in a fixed order and
 * each narrows the result of the previous one:
 * <ol>
 *   <li>platform: influencer ids on the platform restrict all four tables</li>
 *   <li>category: ids are recomputed from the platform-filtered influencers,
 *       so category is conjunctive with platform</li>
 *   <li>brand: tracking rows only, exact campaign match</li>
 *   <li>date range: posts and tracking rows only, both ends inclusive</li>
 * </ol>
 * The input snapshot is never modified; applying the same criteria twice
 * gives the same result as applying them once.
 */
public class FilterEngine {

    private static final Logger log = LoggerFactory.getLogger(FilterEngine.class);

    public CampaignSnapshot apply(CampaignSnapshot snapshot, FilterCriteria criteria) {
        List<Influencer> influencers = snapshot.influencers();
        List<Post> posts = snapshot.posts();
        List<TrackingRecord> tracking = snapshot.tracking();
        List<PayoutRecord> payouts = snapshot.payouts();

        if (criteria.platform() != null) {
            Set<Long> ids = idsOf(influencers, i -> i.platform() == criteria.platform());
            influencers = keep(influencers, i -> ids.contains(i.id()));
            posts = keep(posts, p -> ids.contains(p.influencerId()));
            tracking = keep(tracking, t -> ids.contains(t.influencerId()));
            payouts = keep(payouts, p -> ids.contains(p.influencerId()));
        }

        if (criteria.category() != null) {
            Set<Long> ids = idsOf(influencers, i -> Objects.equals(i.category(), criteria.category()));
            influencers = keep(influencers, i -> ids.contains(i.id()));
            posts = keep(posts, p -> ids.contains(p.influencerId()));
            tracking = keep(tracking, t -> ids.contains(t.influencerId()));
            payouts = keep(payouts, p -> ids.contains(p.influencerId()));
        }

        if (criteria.brand() != null) {
            tracking = keep(tracking, t -> Objects.equals(t.campaign(), criteria.brand()));
        }

        DateRange range = criteria.dateRange();
        if (range != null) {
            posts = keep(posts, p -> range.contains(p.date()));
            tracking = keep(tracking, t -> range.contains(t.date()));
        }

        CampaignSnapshot filtered = new CampaignSnapshot(influencers, posts, tracking, payouts);
        log.debug("Filter {} kept {} of {} rows", criteria, filtered.totalRows(), snapshot.totalRows());
        return filtered;
    }

    private static Set<Long> idsOf(List<Influencer> influencers, Predicate<Influencer> predicate) {
        return influencers.stream()
                .filter(predicate)
                .map(Influencer::id)
                .collect(Collectors.toSet());
    }

    private static <T> List<T> keep(List<T> rows, Predicate<T> predicate) {
        return rows.stream().filter(predicate).toList();
    }
}
