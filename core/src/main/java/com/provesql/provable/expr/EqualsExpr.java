package com.provesql.provable.expr;

import com.provesql.column.ColumnRef;
import com.provesql.column.ColumnType;
import com.provesql.column.ColumnTypeArithmetic;
import com.provesql.exception.ColumnOperationException;

import java.util.Objects;
import java.util.Set;

/**
 * Equality comparison.
 */
public final class EqualsExpr implements ProvableExpression {

    private final ProvableExpression lhs;
    private final ProvableExpression rhs;

    private EqualsExpr(ProvableExpression lhs, ProvableExpression rhs) {
        this.lhs = lhs;
        this.rhs = rhs;
    }

    /**
     * Creates {@code lhs = rhs}. Numeric operands must already share their scale.
     *
     * @param lhs the left operand
     * @param rhs the right operand
     * @return the comparison
     * @throws ColumnOperationException {@code INVALID_COLUMN_TYPE} if the types are not comparable
     */
    public static EqualsExpr tryNew(ProvableExpression lhs, ProvableExpression rhs) {
        ColumnTypeArithmetic.checkEquals(lhs.dataType(), rhs.dataType());
        return new EqualsExpr(lhs, rhs);
    }

    public ProvableExpression lhs() {
        return lhs;
    }

    public ProvableExpression rhs() {
        return rhs;
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
        if (!(obj instanceof EqualsExpr)) return false;
        EqualsExpr that = (EqualsExpr) obj;
        return lhs.equals(that.lhs) && rhs.equals(that.rhs);
    }

    @Override
    public int hashCode() {
        return Objects.hash("equals", lhs, rhs);
    }

    @Override
    public String toString() {
        return "Equals(" + lhs + ", " + rhs + ")";
    }
}
