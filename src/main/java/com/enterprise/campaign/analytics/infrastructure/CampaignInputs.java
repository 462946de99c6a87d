package com.enterprise.campaign.analytics.infrastructure;

import org.springframework.core.io.Resource;

/**
 * Locations of the four campaign CSV files.
 */
public record CampaignInputs(
        Resource influencers,
        Resource posts,
        Resource tracking,
        Resource payouts) {
}
