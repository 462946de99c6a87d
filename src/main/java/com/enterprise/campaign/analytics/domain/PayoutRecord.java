package com.enterprise.campaign.analytics.domain;

import java.math.BigDecimal;

public record PayoutRecord(
    Long influencerId,
    PayoutBasis basis,
    BigDecimal rate,
    long orders,
    BigDecimal totalPayout
) {}
