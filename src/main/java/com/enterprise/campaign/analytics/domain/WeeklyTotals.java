package com.enterprise.campaign.analytics.domain;

import java.math.BigDecimal;

public record WeeklyTotals(IsoWeek week, BigDecimal revenue, long orders) {}
