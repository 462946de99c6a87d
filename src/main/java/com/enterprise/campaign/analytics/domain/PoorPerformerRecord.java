package com.enterprise.campaign.analytics.domain;

import java.math.BigDecimal;

public record PoorPerformerRecord(
    Long influencerId,
    String name,
    Platform platform,
    BigDecimal revenue,
    long orders,
    BigDecimal cost,
    BigDecimal roi,
    PoorPerformanceReason reason
) {}
