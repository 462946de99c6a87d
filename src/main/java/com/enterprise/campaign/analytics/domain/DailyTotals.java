package com.enterprise.campaign.analytics.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

public record DailyTotals(LocalDate date, BigDecimal revenue, long orders) {}
