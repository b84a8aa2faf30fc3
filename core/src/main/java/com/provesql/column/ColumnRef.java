package com.provesql.column;

import java.util.Objects;

/**
 * Reference to a physical column of a table.
 *
 * <p>Two references denote the same column iff their table and column name
 * match; the column type is carried along for convenience and does not take
 * part in equality.
 */
public final class ColumnRef {

    private final TableRef table;
    private final String column;
    private final ColumnType columnType;

    /**
     * Creates a column reference.
     *
     * @param table the table the column belongs to
     * @param column the column name
     * @param columnType the column type
     */
    public ColumnRef(TableRef table, String column, ColumnType columnType) {
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.column = Objects.requireNonNull(column, "column must not be null");
        this.columnType = Objects.requireNonNull(columnType, "columnType must not be null");
    }

    public TableRef table() {
        return table;
    }

    public String column() {
        return column;
    }

    public ColumnType columnType() {
        return columnType;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ColumnRef)) return false;
        ColumnRef that = (ColumnRef) obj;
        return table.equals(that.table) && column.equals(that.column);
    }

    @Override
    public int hashCode() {
        return Objects.hash(table, column);
    }

    @Override
    public String toString() {
        return table + "." + column;
    }
}
