package com.enterprise.campaign.analytics.domain;

import com.enterprise.campaign.shared.schema.Column;
import com.enterprise.campaign.shared.schema.Table;

import java.time.LocalDate;

public final class PostTable extends Table {

    public static final PostTable POSTS = new PostTable();

    public final Column<Long>      INFLUENCER_ID;
    public final Column<String>    PLATFORM;
    public final Column<LocalDate> DATE;
    public final Column<String>    URL;
    public final Column<String>    CAPTION;
    public final Column<Long>      REACH;
    public final Column<Long>      LIKES;
    public final Column<Long>      COMMENTS;

    private PostTable() {
        super("posts");
        this.INFLUENCER_ID = column("influencer_id", Long.class);
        this.PLATFORM      = column("platform", String.class);
        this.DATE          = column("date", LocalDate.class);
        this.URL           = column("URL", String.class);
        this.CAPTION       = column("caption", String.class);
        this.REACH         = column("reach", Long.class);
        this.LIKES         = column("likes", Long.class);
        this.COMMENTS      = column("comments", Long.class);
    }
}
