package com.provesql.provable.expr;

import com.provesql.column.ColumnRef;
import com.provesql.column.ColumnType;
import com.provesql.column.ColumnTypeArithmetic;
import com.provesql.exception.AnalyzeException;
import com.provesql.exception.ColumnOperationException;

import java.util.Objects;
import java.util.Set;

/**
 * Widening cast that raises the scale of a decimal (or integer), or the unit
 * of a timestamp, without losing digits.
 */
public final class ScalingCastExpr implements ProvableExpression {

    private final ProvableExpression fromExpr;
    private final ColumnType toType;

    private ScalingCastExpr(ProvableExpression fromExpr, ColumnType toType) {
        this.fromExpr = fromExpr;
        this.toType = toType;
    }

    /**
     * Creates a scaling cast of {@code fromExpr} to {@code toType}.
     *
     * @param fromExpr the operand
     * @param toType the destination type, a decimal or a timestamp
     * @return the cast
     * @throws AnalyzeException {@code DATA_TYPE_MISMATCH} if the destination is
     *         neither a decimal nor a timestamp
     * @throws ColumnOperationException {@code SCALE_CASTING_ERROR} if the cast would lose digits
     */
    public static ScalingCastExpr tryNew(ProvableExpression fromExpr, ColumnType toType) {
        Objects.requireNonNull(toType, "toType must not be null");
        if (!toType.isDecimal() && toType.kind() != ColumnType.Kind.TIMESTAMP_TZ) {
            throw AnalyzeException.dataTypeMismatch(fromExpr.dataType(), toType);
        }
        ColumnTypeArithmetic.checkScaleCast(fromExpr.dataType(), toType);
        return new ScalingCastExpr(fromExpr, toType);
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
        if (!(obj instanceof ScalingCastExpr)) return false;
        ScalingCastExpr that = (ScalingCastExpr) obj;
        return fromExpr.equals(that.fromExpr) && toType.equals(that.toType);
    }

    @Override
    public int hashCode() {
        return Objects.hash("scalingCast", fromExpr, toType);
    }

    @Override
    public String toString() {
        return "ScalingCast(" + fromExpr + ", " + toType + ")";
    }
}
