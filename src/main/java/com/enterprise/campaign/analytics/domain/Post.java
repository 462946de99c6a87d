package com.enterprise.campaign.analytics.domain;

import java.time.LocalDate;

public record Post(
    Long influencerId,
    Platform platform,
    LocalDate date,
    String url,
    String caption,
    long reach,
    long likes,
    long comments
) {

    public long engagement() {
        return likes + comments;
    }
}
