package com.provesql.provable.expr;

import com.provesql.column.ColumnRef;
import com.provesql.column.ColumnType;
import com.provesql.column.ColumnTypeArithmetic;
import com.provesql.exception.ColumnOperationException;

import java.util.Objects;
import java.util.Set;

/**
 * Multiplication. Operand scales add up in the result, so no alignment is needed.
 */
public final class MultiplyExpr implements ProvableExpression {

    private final ProvableExpression lhs;
    private final ProvableExpression rhs;
    private final ColumnType resultType;

    private MultiplyExpr(ProvableExpression lhs, ProvableExpression rhs, ColumnType resultType) {
        this.lhs = lhs;
        this.rhs = rhs;
        this.resultType = resultType;
    }

    /**
     * Creates {@code lhs * rhs} under the strict precision policy.
     *
     * @param lhs the left operand
     * @param rhs the right operand
     * @return the expression
     * @throws ColumnOperationException if the operands are not numeric or the
     *         result precision or scale is out of range
     */
    public static MultiplyExpr tryNew(ProvableExpression lhs, ProvableExpression rhs) {
        ColumnType resultType = ColumnTypeArithmetic.multiply(lhs.dataType(), rhs.dataType());
        return new MultiplyExpr(lhs, rhs, resultType);
    }

    public ProvableExpression lhs() {
        return lhs;
    }

    public ProvableExpression rhs() {
        return rhs;
    }

    @Override
    public ColumnType dataType() {
        return resultType;
    }

    @Override
    public void collectColumnReferences(Set<ColumnRef> columns) {
        lhs.collectColumnReferences(columns);
        rhs.collectColumnReferences(columns);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof MultiplyExpr)) return false;
        MultiplyExpr that = (MultiplyExpr) obj;
        return lhs.equals(that.lhs) && rhs.equals(that.rhs) && resultType.equals(that.resultType);
    }

    @Override
    public int hashCode() {
        return Objects.hash("multiply", lhs, rhs, resultType);
    }

    @Override
    public String toString() {
        return "Multiply(" + lhs + ", " + rhs + ")";
    }
}
