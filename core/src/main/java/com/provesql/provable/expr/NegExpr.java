package com.provesql.provable.expr;

import com.provesql.column.ColumnRef;
import com.provesql.column.ColumnType;
import com.provesql.column.ColumnTypeArithmetic;
import com.provesql.exception.ColumnOperationException;

import java.util.Objects;
import java.util.Set;

/**
 * Arithmetic negation; the result has the operand's type.
 */
public final class NegExpr implements ProvableExpression {

    private final ProvableExpression expr;

    private NegExpr(ProvableExpression expr) {
        this.expr = expr;
    }

    /**
     * Creates {@code -expr}.
     *
     * @param expr the operand
     * @return the negation
     * @throws ColumnOperationException {@code INVALID_COLUMN_TYPE} unless the operand is numeric
     */
    public static NegExpr tryNew(ProvableExpression expr) {
        Objects.requireNonNull(expr, "operand must not be null");
        ColumnTypeArithmetic.checkNegate(expr.dataType());
        return new NegExpr(expr);
    }

    public ProvableExpression expr() {
        return expr;
    }

    @Override
    public ColumnType dataType() {
        return expr.dataType();
    }

    @Override
    public void collectColumnReferences(Set<ColumnRef> columns) {
        expr.collectColumnReferences(columns);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof NegExpr)) return false;
        return expr.equals(((NegExpr) obj).expr);
    }

    @Override
    public int hashCode() {
        return Objects.hash("neg", expr);
    }

    @Override
    public String toString() {
        return "Neg(" + expr + ")";
    }
}
