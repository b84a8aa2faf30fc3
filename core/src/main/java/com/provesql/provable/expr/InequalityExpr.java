package com.provesql.provable.expr;

import com.provesql.column.ColumnRef;
import com.provesql.column.ColumnType;
import com.provesql.column.ColumnTypeArithmetic;
import com.provesql.exception.ColumnOperationException;

import java.util.Objects;
import java.util.Set;

/**
 * Strict ordering comparison: {@code lhs < rhs} when {@code isLt}, else {@code lhs > rhs}.
 *
 * <p>Non-strict comparisons are expressed by negating the opposite strict one:
 * {@code a <= b} is {@code NOT (a > b)}.
 */
public final class InequalityExpr implements ProvableExpression {

    private final ProvableExpression lhs;
    private final ProvableExpression rhs;
    private final boolean isLt;

    private InequalityExpr(ProvableExpression lhs, ProvableExpression rhs, boolean isLt) {
        this.lhs = lhs;
        this.rhs = rhs;
        this.isLt = isLt;
    }

    /**
     * Creates a strict inequality. Numeric operands must already share their scale.
     *
     * @param lhs the left operand
     * @param rhs the right operand
     * @param isLt true for {@code <}, false for {@code >}
     * @return the comparison
     * @throws ColumnOperationException {@code INVALID_COLUMN_TYPE} if the types are not ordered
     */
    public static InequalityExpr tryNew(ProvableExpression lhs, ProvableExpression rhs, boolean isLt) {
        ColumnTypeArithmetic.checkInequality(lhs.dataType(), rhs.dataType());
        return new InequalityExpr(lhs, rhs, isLt);
    }

    public ProvableExpression lhs() {
        return lhs;
    }

    public ProvableExpression rhs() {
        return rhs;
    }

    public boolean isLt() {
        return isLt;
    }

    @Override
    public ColumnType dataType() {
        return ColumnType.BOOLEAN;
    }

    @Override
    public void collectColumnReferences(Set<ColumnRef> columns) {
        lhs.collectColumnReferences(columns);
        rhs.collectColumnReferences(columns);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof InequalityExpr)) return false;
        InequalityExpr that = (InequalityExpr) obj;
        return isLt == that.isLt && lhs.equals(that.lhs) && rhs.equals(that.rhs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lhs, rhs, isLt);
    }

    @Override
    public String toString() {
        return "Inequality(" + lhs + ", " + rhs + ", isLt=" + isLt + ")";
    }
}
