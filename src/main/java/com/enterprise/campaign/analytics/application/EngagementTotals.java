package com.enterprise.campaign.analytics.application;

import com.enterprise.campaign.analytics.domain.Post;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Mutable accumulator of post metrics.
 */
final class EngagementTotals {

    private long reach;
    private long likes;
    private long comments;
    private int posts;

    void add(Post post) {
        reach += post.reach();
        likes += post.likes();
        comments += post.comments();
        posts++;
    }

    long reach() { return reach; }
    long likes() { return likes; }
    long comments() { return comments; }
    long engagement() { return likes + comments; }
    int posts() { return posts; }

    static <K> Map<K, EngagementTotals> groupBy(List<Post> rows, Function<Post, K> key) {
        Map<K, EngagementTotals> groups = new LinkedHashMap<>();
        for (Post row : rows) {
            K k = key.apply(row);
            if (k != null) {
                groups.computeIfAbsent(k, x -> new EngagementTotals()).add(row);
            }
        }
        return groups;
    }

    static EngagementTotals of(List<Post> rows) {
        EngagementTotals totals = new EngagementTotals();
        rows.forEach(totals::add);
        return totals;
    }
}
