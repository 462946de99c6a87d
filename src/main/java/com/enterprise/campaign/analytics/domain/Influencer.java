package com.enterprise.campaign.analytics.domain;

public record Influencer(
    Long id,
    String name,
    String category,
    String gender,
    long followerCount,
    Platform platform
) {}
