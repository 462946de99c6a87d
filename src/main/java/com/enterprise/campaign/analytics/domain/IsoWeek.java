package com.enterprise.campaign.analytics.domain;

import java.time.LocalDate;
import java.time.temporal.IsoFields;
import java.util.Comparator;

/**
 * ISO-8601 week, qualified by its week-based year so that week 1 of two
 * different years never share a bucket.
 */
public record IsoWeek(int year, int week) implements Comparable<IsoWeek> {

    private static final Comparator<IsoWeek> ORDER =
            Comparator.comparingInt(IsoWeek::year).thenComparingInt(IsoWeek::week);

    public static IsoWeek of(LocalDate date) {
        return new IsoWeek(
                date.get(IsoFields.WEEK_BASED_YEAR),
                date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
    }

    @Override
    public int compareTo(IsoWeek other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return String.format("%d-W%02d", year, week);
    }
}
