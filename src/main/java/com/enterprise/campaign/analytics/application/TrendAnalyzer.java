package com.enterprise.campaign.analytics.application;

import com.enterprise.campaign.analytics.domain.CampaignSnapshot;
import com.enterprise.campaign.analytics.domain.DailyTotals;
import com.enterprise.campaign.analytics.domain.IsoWeek;
import com.enterprise.campaign.analytics.domain.TrackingRecord;
import com.enterprise.campaign.analytics.domain.TrendReport;
import com.enterprise.campaign.analytics.domain.WeeklyTotals;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Time rollups of tracking data and the baseline-versus-recent incremental
 * ROAS comparison. Rows without a date are ignored.
 */
public class TrendAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(TrendAnalyzer.class);

    private final AnalyticsSettings settings;

    public TrendAnalyzer(AnalyticsSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public TrendReport trends(CampaignSnapshot snapshot) {
        if (snapshot.tracking().isEmpty()) {
            return TrendReport.empty();
        }
        return new TrendReport(daily(snapshot), weekly(snapshot));
    }

    /** Revenue and orders per calendar date, ascending. */
    public List<DailyTotals> daily(CampaignSnapshot snapshot) {
        Map<LocalDate, RevenueTotals> byDate = new TreeMap<>(
                RevenueTotals.groupBy(snapshot.tracking(), TrackingRecord::date));
        List<DailyTotals> rows = new ArrayList<>(byDate.size());
        byDate.forEach((date, totals) -> rows.add(new DailyTotals(date, totals.revenue(), totals.orders())));
        return rows;
    }

    /** Revenue and orders per ISO week (week-based year and week number), ascending. */
    public List<WeeklyTotals> weekly(CampaignSnapshot snapshot) {
        Map<IsoWeek, RevenueTotals> byWeek = new TreeMap<>(
                RevenueTotals.groupBy(snapshot.tracking(), row -> row.date() == null ? null : IsoWeek.of(row.date())));
        List<WeeklyTotals> rows = new ArrayList<>(byWeek.size());
        byWeek.forEach((week, totals) -> rows.add(new WeeklyTotals(week, totals.revenue(), totals.orders())));
        return rows;
    }

    public BigDecimal incrementalRoas(CampaignSnapshot snapshot) {
        return incrementalRoas(snapshot, settings.baselineDays());
    }

    /**
     * Lift of mean per-row revenue in the last {@code baselineDays} (counted
     * back from the latest date) over the rows before that cutoff, divided by
     * the estimated cost of the recent window. Never negative; zero when
     * either window is empty.
     */
    public BigDecimal incrementalRoas(CampaignSnapshot snapshot, int baselineDays) {
        if (baselineDays < 0) {
            throw new IllegalArgumentException("baselineDays must not be negative: " + baselineDays);
        }
        List<TrackingRecord> dated = snapshot.tracking().stream()
                .filter(row -> row.date() != null)
                .toList();
        if (dated.isEmpty()) {
            return BigDecimal.ZERO;
        }

        LocalDate latest = dated.stream().map(TrackingRecord::date).max(LocalDate::compareTo).orElseThrow();
        LocalDate cutoff = latest.minusDays(baselineDays);

        List<TrackingRecord> baseline = dated.stream().filter(row -> row.date().isBefore(cutoff)).toList();
        List<TrackingRecord> recent = dated.stream().filter(row -> !row.date().isBefore(cutoff)).toList();
        if (baseline.isEmpty() || recent.isEmpty()) {
            return BigDecimal.ZERO;
        }

        BigDecimal baselineMean = meanRevenue(baseline);
        BigDecimal recentMean = meanRevenue(recent);
        BigDecimal incrementalRevenue = recentMean.subtract(baselineMean);
        BigDecimal estimatedCost = settings.fixedRatioCost().costOf(recentMean);

        BigDecimal incremental = estimatedCost.signum() > 0
                ? incrementalRevenue.divide(estimatedCost.max(BigDecimal.ONE), Ratios.MC)
                : BigDecimal.ZERO;
        log.debug("Incremental ROAS cutoff={} baselineMean={} recentMean={} raw={}",
                cutoff, baselineMean, recentMean, incremental);
        return incremental.max(BigDecimal.ZERO);
    }

    private static BigDecimal meanRevenue(List<TrackingRecord> rows) {
        return Ratios.ratioOrZero(RevenueTotals.of(rows).revenue(), rows.size());
    }
}
