package com.provesql.column;

import java.util.Objects;

/**
 * Reference to a table, optionally qualified by a schema (namespace).
 *
 * @param schema the schema name, or null for an unqualified table
 * @param table the table name
 */
public record TableRef(String schema, String table) {

    public TableRef {
        Objects.requireNonNull(table, "table must not be null");
    }

    /**
     * Parses a table reference of the form {@code table} or {@code schema.table}.
     *
     * @param qualifiedName the table name
     * @return the table reference
     * @throws IllegalArgumentException if the name has more than two parts
     */
    public static TableRef of(String qualifiedName) {
        Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
        String[] parts = qualifiedName.split("\\.");
        if (parts.length == 1) {
            return new TableRef(null, parts[0]);
        }
        if (parts.length == 2) {
            return new TableRef(parts[0], parts[1]);
        }
        throw new IllegalArgumentException("Catalog-qualified table names are not supported: " + qualifiedName);
    }

    @Override
    public String toString() {
        return schema != null ? schema + "." + table : table;
    }
}
