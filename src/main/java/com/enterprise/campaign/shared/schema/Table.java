package com.enterprise.campaign.shared.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Base class for all table definitions. Each subclass represents one tabular
 * input and is the single source of truth for its column names and types,
 * shared by the CSV readers, the JDBC store and schema validation.
 *
 * <p>Example:
 * <pre>{@code
 * public final class PayoutTable extends Table {
 *     public static final PayoutTable PAYOUTS = new PayoutTable();
 *
 *     public final Column<Long> INFLUENCER_ID;
 *     public final Column<BigDecimal> TOTAL_PAYOUT;
 *
 *     private PayoutTable() {
 *         super("payouts");
 *         this.INFLUENCER_ID = column("influencer_id", Long.class);
 *         this.TOTAL_PAYOUT = column("total_payout", BigDecimal.class);
 *     }
 * }
 * }</pre>
 */
public abstract class Table {

    private final String tableName;
    private final List<Column<?>> columns = new ArrayList<>();

    protected Table(String tableName) {
        this.tableName = tableName;
    }

    /**
     * Creates a typed column bound to this table. Must be called in the
     * constructor; declaration order is the column order of the table.
     */
    protected <T> Column<T> column(String name, Class<T> type) {
        Column<T> col = new Column<>(this, name, type);
        columns.add(col);
        return col;
    }

    public String tableName() {
        return tableName;
    }

    /**
     * Returns all columns in declaration order. Every column is required.
     */
    public List<Column<?>> allColumns() {
        return Collections.unmodifiableList(columns);
    }

    /**
     * {@code INSERT} with one named parameter per column ({@code :column_name}).
     */
    public String insertTemplate() {
        String names = columns.stream().map(Column::name).collect(Collectors.joining(", "));
        String params = columns.stream().map(c -> ":" + c.name()).collect(Collectors.joining(", "));
        return "INSERT INTO " + tableName + " (" + names + ") VALUES (" + params + ")";
    }

    public String selectAll() {
        String names = columns.stream().map(Column::name).collect(Collectors.joining(", "));
        return "SELECT " + names + " FROM " + tableName;
    }

    @Override
    public String toString() {
        return tableName;
    }
}
