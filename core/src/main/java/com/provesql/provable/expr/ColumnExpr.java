package com.provesql.provable.expr;

import com.provesql.column.ColumnRef;
import com.provesql.column.ColumnType;

import java.util.Objects;
import java.util.Set;

/**
 * Reference to a stored column.
 */
public final class ColumnExpr implements ProvableExpression {

    private final ColumnRef columnRef;

    public ColumnExpr(ColumnRef columnRef) {
        this.columnRef = Objects.requireNonNull(columnRef, "columnRef must not be null");
    }

    public ColumnRef columnRef() {
        return columnRef;
    }

    public String columnName() {
        return columnRef.column();
    }

    @Override
    public ColumnType dataType() {
        return columnRef.columnType();
    }

    @Override
    public void collectColumnReferences(Set<ColumnRef> columns) {
        columns.add(columnRef);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ColumnExpr)) return false;
        ColumnExpr that = (ColumnExpr) obj;
        return columnRef.equals(that.columnRef) &&
               columnRef.columnType().equals(that.columnRef.columnType());
    }

    @Override
    public int hashCode() {
        return columnRef.hashCode();
    }

    @Override
    public String toString() {
        return "Column(" + columnRef + ")";
    }
}
