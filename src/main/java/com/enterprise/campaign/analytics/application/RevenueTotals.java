package com.enterprise.campaign.analytics.application;

import com.enterprise.campaign.analytics.domain.TrackingRecord;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Mutable accumulator of tracking rows: revenue, orders and the distinct
 * influencers seen. Used as the value side of hash-backed groupings.
 */
final class RevenueTotals {

    private BigDecimal revenue = BigDecimal.ZERO;
    private long orders;
    private int rows;
    private final Set<Long> influencerIds = new HashSet<>();

    void add(TrackingRecord row) {
        revenue = revenue.add(row.revenue());
        orders += row.orders();
        rows++;
        influencerIds.add(row.influencerId());
    }

    BigDecimal revenue() { return revenue; }
    long orders() { return orders; }
    int rows() { return rows; }
    long influencerCount() { return influencerIds.size(); }

    /**
     * Groups rows by {@code key}, keeping first-seen key order. Rows whose key
     * is {@code null} are skipped.
     */
    static <K> Map<K, RevenueTotals> groupBy(List<TrackingRecord> rows, Function<TrackingRecord, K> key) {
        Map<K, RevenueTotals> groups = new LinkedHashMap<>();
        for (TrackingRecord row : rows) {
            K k = key.apply(row);
            if (k != null) {
                groups.computeIfAbsent(k, x -> new RevenueTotals()).add(row);
            }
        }
        return groups;
    }

    static RevenueTotals of(List<TrackingRecord> rows) {
        RevenueTotals totals = new RevenueTotals();
        rows.forEach(totals::add);
        return totals;
    }
}
