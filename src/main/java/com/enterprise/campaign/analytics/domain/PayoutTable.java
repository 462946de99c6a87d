package com.enterprise.campaign.analytics.domain;

import com.enterprise.campaign.shared.schema.Column;
import com.enterprise.campaign.shared.schema.Table;

import java.math.BigDecimal;

public final class PayoutTable extends Table {

    public static final PayoutTable PAYOUTS = new PayoutTable();

    public final Column<Long>       INFLUENCER_ID;
    public final Column<String>     BASIS;
    public final Column<BigDecimal> RATE;
    public final Column<Long>       ORDERS;
    public final Column<BigDecimal> TOTAL_PAYOUT;

    private PayoutTable() {
        super("payouts");
        this.INFLUENCER_ID = column("influencer_id", Long.class);
        this.BASIS         = column("basis", String.class);
        this.RATE          = column("rate", BigDecimal.class);
        this.ORDERS        = column("orders", Long.class);
        this.TOTAL_PAYOUT  = column("total_payout", BigDecimal.class);
    }
}
