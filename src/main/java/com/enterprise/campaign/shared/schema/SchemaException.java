package com.enterprise.campaign.shared.schema;

import java.util.List;

/**
 * A table lacks one or more required columns. Fatal to the call that
 * detected it: no partial computation is attempted.
 */
public class SchemaException extends RuntimeException {

    private final String tableName;
    private final List<String> problems;

    public SchemaException(String tableName, List<String> problems) {
        super("Schema mismatch for '" + tableName + "': " + String.join("; ", problems));
        this.tableName = tableName;
        this.problems = List.copyOf(problems);
    }

    public String tableName() {
        return tableName;
    }

    public List<String> problems() {
        return problems;
    }
}
