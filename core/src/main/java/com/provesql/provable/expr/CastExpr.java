package com.provesql.provable.expr;

import com.provesql.column.ColumnRef;
import com.provesql.column.ColumnType;
import com.provesql.column.ColumnTypeArithmetic;
import com.provesql.exception.ColumnOperationException;

import java.util.Objects;
import java.util.Set;

/**
 * Explicit type conversion that keeps the scale.
 */
public final class CastExpr implements ProvableExpression {

    private final ProvableExpression fromExpr;
    private final ColumnType toType;

    private CastExpr(ProvableExpression fromExpr, ColumnType toType) {
        this.fromExpr = fromExpr;
        this.toType = toType;
    }

    /**
     * Creates {@code CAST(fromExpr AS toType)}.
     *
     * @param fromExpr the operand
     * @param toType the destination type
     * @return the cast
     * @throws ColumnOperationException {@code CASTING_ERROR} if the cast is not legal
     */
    public static CastExpr tryNew(ProvableExpression fromExpr, ColumnType toType) {
        Objects.requireNonNull(toType, "toType must not be null");
        ColumnTypeArithmetic.checkCast(fromExpr.dataType(), toType);
        return new CastExpr(fromExpr, toType);
    }

    public ProvableExpression fromExpr() {
        return fromExpr;
    }

    @Override
    public ColumnType dataType() {
        return toType;
    }

    @Override
    public void collectColumnReferences(Set<ColumnRef> columns) {
        fromExpr.collectColumnReferences(columns);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CastExpr)) return false;
        CastExpr that = (CastExpr) obj;
        return fromExpr.equals(that.fromExpr) && toType.equals(that.toType);
    }

    @Override
    public int hashCode() {
        return Objects.hash("cast", fromExpr, toType);
    }

    @Override
    public String toString() {
        return "Cast(" + fromExpr + ", " + toType + ")";
    }
}
