package com.enterprise.campaign.analytics.domain;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Closed date interval; both ends are inclusive.
 */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(start) && !date.isAfter(end);
    }
}
