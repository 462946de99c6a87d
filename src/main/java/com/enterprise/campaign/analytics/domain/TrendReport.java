package com.enterprise.campaign.analytics.domain;

import java.util.List;

public record TrendReport(List<DailyTotals> daily, List<WeeklyTotals> weekly) {

    public TrendReport {
        daily = List.copyOf(daily);
        weekly = List.copyOf(weekly);
    }

    public static TrendReport empty() {
        return new TrendReport(List.of(), List.of());
    }

    public boolean isEmpty() {
        return daily.isEmpty() && weekly.isEmpty();
    }
}
