package com.enterprise.campaign.analytics.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One attribution row: orders and revenue credited to an influencer for a
 * campaign on a given day.
 */
public record TrackingRecord(
    String source,
    String campaign,
    Long influencerId,
    String userId,
    String product,
    LocalDate date,
    long orders,
    BigDecimal revenue
) {}
