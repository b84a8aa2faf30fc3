package com.provesql.provable.expr;

import com.provesql.column.ColumnRef;
import com.provesql.column.ColumnType;
import com.provesql.column.ColumnTypeArithmetic;
import com.provesql.exception.ColumnOperationException;

import java.util.Objects;
import java.util.Set;

/**
 * Addition or subtraction.
 *
 * <p>The result type is fixed at construction, under either the strict or the
 * capped precision policy of {@link ColumnTypeArithmetic}.
 */
public final class AddSubtractExpr implements ProvableExpression {

    private final ProvableExpression lhs;
    private final ProvableExpression rhs;
    private final boolean isSubtract;
    private final ColumnType resultType;

    private AddSubtractExpr(ProvableExpression lhs, ProvableExpression rhs, boolean isSubtract,
                            ColumnType resultType) {
        this.lhs = lhs;
        this.rhs = rhs;
        this.isSubtract = isSubtract;
        this.resultType = resultType;
    }

    /**
     * Creates {@code lhs + rhs} or {@code lhs - rhs} under the strict precision policy.
     *
     * @param lhs the left operand
     * @param rhs the right operand
     * @param isSubtract true for subtraction
     * @return the expression
     * @throws ColumnOperationException if the operands are not numeric or the
     *         result precision exceeds 75
     */
    public static AddSubtractExpr tryNew(ProvableExpression lhs, ProvableExpression rhs, boolean isSubtract) {
        ColumnType resultType = ColumnTypeArithmetic.addSubtract(lhs.dataType(), rhs.dataType());
        return new AddSubtractExpr(lhs, rhs, isSubtract, resultType);
    }

    /**
     * Creates {@code lhs + rhs} or {@code lhs - rhs} under the capped precision
     * policy. Used once the operands have been scale-aligned.
     *
     * @param lhs the left operand
     * @param rhs the right operand
     * @param isSubtract true for subtraction
     * @return the expression
     * @throws ColumnOperationException if the operands are not numeric
     */
    public static AddSubtractExpr tryNewCapped(ProvableExpression lhs, ProvableExpression rhs, boolean isSubtract) {
        ColumnType resultType = ColumnTypeArithmetic.addSubtractCapped(lhs.dataType(), rhs.dataType());
        return new AddSubtractExpr(lhs, rhs, isSubtract, resultType);
    }

    public ProvableExpression lhs() {
        return lhs;
    }

    public ProvableExpression rhs() {
        return rhs;
    }

    public boolean isSubtract() {
        return isSubtract;
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
        if (!(obj instanceof AddSubtractExpr)) return false;
        AddSubtractExpr that = (AddSubtractExpr) obj;
        return isSubtract == that.isSubtract &&
               lhs.equals(that.lhs) &&
               rhs.equals(that.rhs) &&
               resultType.equals(that.resultType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lhs, rhs, isSubtract, resultType);
    }

    @Override
    public String toString() {
        return (isSubtract ? "Subtract(" : "Add(") + lhs + ", " + rhs + ")";
    }
}
