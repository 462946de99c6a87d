package com.enterprise.campaign.analytics.domain;

import com.enterprise.campaign.shared.schema.Column;
import com.enterprise.campaign.shared.schema.Table;

import java.math.BigDecimal;
import java.time.LocalDate;

public final class TrackingTable extends Table {

    public static final TrackingTable TRACKING = new TrackingTable();

    public final Column<String>     SOURCE;
    public final Column<String>     CAMPAIGN;
    public final Column<Long>       INFLUENCER_ID;
    public final Column<String>     USER_ID;
    public final Column<String>     PRODUCT;
    public final Column<LocalDate>  DATE;
    public final Column<Long>       ORDERS;
    public final Column<BigDecimal> REVENUE;

    private TrackingTable() {
        super("tracking_data");
        this.SOURCE        = column("source", String.class);
        this.CAMPAIGN      = column("campaign", String.class);
        this.INFLUENCER_ID = column("influencer_id", Long.class);
        this.USER_ID       = column("user_id", String.class);
        this.PRODUCT       = column("product", String.class);
        this.DATE          = column("date", LocalDate.class);
        this.ORDERS        = column("orders", Long.class);
        this.REVENUE       = column("revenue", BigDecimal.class);
    }
}
