package com.enterprise.campaign.analytics.domain;

import com.enterprise.campaign.shared.schema.Column;
import com.enterprise.campaign.shared.schema.Table;

public final class InfluencerTable extends Table {

    public static final InfluencerTable INFLUENCERS = new InfluencerTable();

    public final Column<Long>   ID;
    public final Column<String> NAME;
    public final Column<String> CATEGORY;
    public final Column<String> GENDER;
    public final Column<Long>   FOLLOWER_COUNT;
    public final Column<String> PLATFORM;

    private InfluencerTable() {
        super("influencers");
        this.ID             = column("ID", Long.class);
        this.NAME           = column("name", String.class);
        this.CATEGORY       = column("category", String.class);
        this.GENDER         = column("gender", String.class);
        this.FOLLOWER_COUNT = column("follower_count", Long.class);
        this.PLATFORM       = column("platform", String.class);
    }
}
