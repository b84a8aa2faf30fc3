package com.provesql.provable.expr;

import com.provesql.column.ColumnRef;
import com.provesql.column.ColumnType;
import com.provesql.exception.AnalyzeException;

import java.util.Objects;
import java.util.Set;

/**
 * Boolean conjunction.
 */
public final class AndExpr implements ProvableExpression {

    private final ProvableExpression lhs;
    private final ProvableExpression rhs;

    private AndExpr(ProvableExpression lhs, ProvableExpression rhs) {
        this.lhs = lhs;
        this.rhs = rhs;
    }

    /**
     * Creates {@code lhs AND rhs}.
     *
     * @param lhs the left operand
     * @param rhs the right operand
     * @return the conjunction
     * @throws AnalyzeException {@code INVALID_DATA_TYPE} unless both operands are Boolean
     */
    public static AndExpr tryNew(ProvableExpression lhs, ProvableExpression rhs) {
        NotExpr.requireBooleans(lhs, rhs);
        return new AndExpr(lhs, rhs);
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
        if (!(obj instanceof AndExpr)) return false;
        AndExpr that = (AndExpr) obj;
        return lhs.equals(that.lhs) && rhs.equals(that.rhs);
    }

    @Override
    public int hashCode() {
        return Objects.hash("and", lhs, rhs);
    }

    @Override
    public String toString() {
        return "And(" + lhs + ", " + rhs + ")";
    }
}
