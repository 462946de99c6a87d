package com.enterprise.campaign.shared.schema;

public class Column<T> {

    private final Table table;
    private final String name;
    private final Class<T> type;

    public Column(Table table, String name, Class<T> type) {
        this.table = table;
        this.name = name;
        this.type = type;
    }

    public String name() { return name; }
    public Class<T> type() { return type; }

    @Override
    public String toString() {
        return table.tableName() + "." + name;
    }
}
