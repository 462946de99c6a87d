package com.enterprise.campaign.analytics.domain;

import java.math.BigDecimal;

public record CampaignTotals(String campaign, BigDecimal revenue, long orders, long influencerCount) {}
