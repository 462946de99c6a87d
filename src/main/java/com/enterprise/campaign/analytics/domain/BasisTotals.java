package com.enterprise.campaign.analytics.domain;

import java.math.BigDecimal;

public record BasisTotals(PayoutBasis basis, BigDecimal totalPayout, long count) {}
