package com.enterprise.campaign.analytics.domain;

import java.time.LocalDate;
import java.util.List;

/**
 * Selection applied to a snapshot before analysis. A {@code null} component
 * means "All" (no narrowing on that dimension).
 */
public record FilterCriteria(
    Platform platform,
    String brand,
    String category,
    DateRange dateRange
) {

    public static final String ALL = "All";

    private static final FilterCriteria NONE = new FilterCriteria(null, null, null, null);

    public static FilterCriteria all() {
        return NONE;
    }

    /**
     * Builds criteria from raw selector values. {@code "All"} (any case), blank
     * or {@code null} disables a selector. The date list is honoured only when it
     * holds exactly two dates {@code [start, end]}; any other size means no date
     * filter, as a half-picked range does.
     */
    public static FilterCriteria of(String platform, String brand, String category, List<LocalDate> dateRange) {
        DateRange range = dateRange != null && dateRange.size() == 2
                ? new DateRange(dateRange.get(0), dateRange.get(1))
                : null;
        return new FilterCriteria(
                isAll(platform) ? null : Platform.fromLabel(platform),
                isAll(brand) ? null : brand,
                isAll(category) ? null : category,
                range);
    }

    public FilterCriteria withPlatform(Platform value) {
        return new FilterCriteria(value, brand, category, dateRange);
    }

    public FilterCriteria withBrand(String value) {
        return new FilterCriteria(platform, value, category, dateRange);
    }

    public FilterCriteria withCategory(String value) {
        return new FilterCriteria(platform, brand, value, dateRange);
    }

    public FilterCriteria withDateRange(LocalDate start, LocalDate end) {
        return new FilterCriteria(platform, brand, category, new DateRange(start, end));
    }

    private static boolean isAll(String value) {
        return value == null || value.isBlank() || ALL.equalsIgnoreCase(value.trim());
    }
}
