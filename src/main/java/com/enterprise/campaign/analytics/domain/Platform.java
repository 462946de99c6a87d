package com.enterprise.campaign.analytics.domain;

import java.util.Arrays;

/**
 * Social platforms an influencer can publish on. Input files carry the
 * display label ({@code "Instagram"}, {@code "YouTube"}, ...).
 */
public enum Platform {

    INSTAGRAM("Instagram"),
    YOUTUBE("YouTube"),
    TWITTER("Twitter"),
    FACEBOOK("Facebook"),
    TIKTOK("TikTok"),
    LINKEDIN("LinkedIn");

    private final String label;

    Platform(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Resolves a display label or enum name, ignoring case.
     *
     * @throws IllegalArgumentException when the value names no known platform
     */
    public static Platform fromLabel(String value) {
        if (value == null) {
            throw new IllegalArgumentException("platform must not be null");
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(p -> p.label.equalsIgnoreCase(trimmed) || p.name().equalsIgnoreCase(trimmed))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Invalid platform: '" + value + "'. Valid platforms: "
                                + Arrays.stream(values()).map(Platform::label).toList()));
    }

    @Override
    public String toString() {
        return label;
    }
}
