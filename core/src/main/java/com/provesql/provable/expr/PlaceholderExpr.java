package com.provesql.provable.expr;

import com.provesql.column.ColumnRef;
import com.provesql.column.ColumnType;
import com.provesql.exception.AnalyzeException;

import java.util.Objects;
import java.util.Set;

/**
 * Query parameter bound at proof time, identified by its 1-based position.
 */
public final class PlaceholderExpr implements ProvableExpression {

    private final int id;
    private final ColumnType columnType;

    private PlaceholderExpr(int id, ColumnType columnType) {
        this.id = id;
        this.columnType = columnType;
    }

    /**
     * Creates a placeholder.
     *
     * @param id the 1-based parameter position
     * @param columnType the parameter type
     * @return the placeholder
     * @throws AnalyzeException {@code INVALID_PLACEHOLDER_ID} if {@code id < 1}
     */
    public static PlaceholderExpr tryNew(int id, ColumnType columnType) {
        Objects.requireNonNull(columnType, "columnType must not be null");
        if (id < 1) {
            throw AnalyzeException.invalidPlaceholderId(id);
        }
        return new PlaceholderExpr(id, columnType);
    }

    public int id() {
        return id;
    }

    @Override
    public ColumnType dataType() {
        return columnType;
    }

    @Override
    public void collectColumnReferences(Set<ColumnRef> columns) {
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PlaceholderExpr)) return false;
        PlaceholderExpr that = (PlaceholderExpr) obj;
        return id == that.id && columnType.equals(that.columnType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, columnType);
    }

    @Override
    public String toString() {
        return "Placeholder($" + id + ": " + columnType + ")";
    }
}
