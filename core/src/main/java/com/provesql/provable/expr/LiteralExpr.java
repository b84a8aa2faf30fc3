package com.provesql.provable.expr;

import com.provesql.column.ColumnRef;
import com.provesql.column.ColumnType;
import com.provesql.column.LiteralValue;

import java.util.Objects;
import java.util.Set;

/**
 * Constant value.
 */
public final class LiteralExpr implements ProvableExpression {

    private final LiteralValue value;

    public LiteralExpr(LiteralValue value) {
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public LiteralValue value() {
        return value;
    }

    @Override
    public ColumnType dataType() {
        return value.columnType();
    }

    @Override
    public void collectColumnReferences(Set<ColumnRef> columns) {
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof LiteralExpr)) return false;
        return value.equals(((LiteralExpr) obj).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Literal(" + value + ")";
    }
}
