package com.enterprise.campaign.shared.schema;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import javax.sql.DataSource;

/**
 * Validates {@link Table} definitions against what a source actually provides:
 * a CSV header line or live database metadata.
 */
public class SchemaValidator {

    /**
     * Lists the required columns absent from {@code header}. Names compare
     * exactly, as input files must use the documented column names.
     */
    public List<String> missingColumns(Table table, List<String> header) {
        Set<String> present = header.stream().map(String::trim).collect(Collectors.toSet());
        List<String> errors = new ArrayList<>();
        for (Column<?> col : table.allColumns()) {
            if (!present.contains(col.name())) {
                errors.add("Missing column '" + col.name() + "'");
            }
        }
        return errors;
    }

    /**
     * @throws SchemaException when {@code header} lacks a required column
     */
    public void requireColumns(Table table, List<String> header) {
        List<String> errors = missingColumns(table, header);
        if (!errors.isEmpty()) {
            throw new SchemaException(table.tableName(), errors);
        }
    }

    /**
     * Checks each table against database metadata. Connection failures are
     * reported as errors rather than thrown.
     */
    public List<String> validate(DataSource dataSource, Table... tables) {
        List<String> errors = new ArrayList<>();
        try (Connection conn = dataSource.getConnection()) {
            DatabaseMetaData meta = conn.getMetaData();
            for (Table table : tables) {
                validateTable(meta, table, errors);
            }
        } catch (Exception e) {
            errors.add("Failed to connect: " + e.getMessage());
        }
        return errors;
    }

    private void validateTable(DatabaseMetaData meta, Table table, List<String> errors) {
        List<String> dbColumns = new ArrayList<>();
        for (String candidate : List.of(table.tableName(), table.tableName().toUpperCase(Locale.ROOT))) {
            try (ResultSet rs = meta.getColumns(null, null, candidate, null)) {
                while (rs.next()) {
                    dbColumns.add(rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT));
                }
            } catch (Exception e) {
                errors.add("Error validating table '" + table.tableName() + "': " + e.getMessage());
                return;
            }
            if (!dbColumns.isEmpty()) {
                break;
            }
        }
        if (dbColumns.isEmpty()) {
            errors.add("Table '" + table.tableName() + "' not found in database");
            return;
        }
        for (Column<?> col : table.allColumns()) {
            if (!dbColumns.contains(col.name().toLowerCase(Locale.ROOT))) {
                errors.add("Column '" + col.name() + "' not found in table '"
                        + table.tableName() + "'");
            }
        }
    }
}
