package com.provesql.provable.expr;

import com.provesql.column.ColumnRef;
import com.provesql.column.ColumnType;
import com.provesql.column.ColumnTypeArithmetic;
import com.provesql.exception.AnalyzeException;
import com.provesql.exception.ColumnOperationException;

import java.util.Objects;
import java.util.Set;

/**
 * Boolean negation.
 */
public final class NotExpr implements ProvableExpression {

    private final ProvableExpression expr;

    private NotExpr(ProvableExpression expr) {
        this.expr = expr;
    }

    /**
     * Creates {@code NOT expr}.
     *
     * @param expr the operand
     * @return the negation
     * @throws AnalyzeException {@code INVALID_DATA_TYPE} unless the operand is Boolean
     */
    public static NotExpr tryNew(ProvableExpression expr) {
        requireBoolean(expr);
        return new NotExpr(expr);
    }

    private static void requireBoolean(ProvableExpression expr) {
        Objects.requireNonNull(expr, "operand must not be null");
        try {
            ColumnTypeArithmetic.checkNot(expr.dataType());
        } catch (ColumnOperationException e) {
            throw AnalyzeException.invalidDataType(ColumnType.BOOLEAN, expr.dataType(), e);
        }
    }

    /**
     * Checks the operands of {@code AND} / {@code OR}.
     *
     * @throws AnalyzeException {@code INVALID_DATA_TYPE} naming the first non-Boolean operand
     */
    static void requireBooleans(ProvableExpression lhs, ProvableExpression rhs) {
        Objects.requireNonNull(lhs, "lhs must not be null");
        Objects.requireNonNull(rhs, "rhs must not be null");
        try {
            ColumnTypeArithmetic.checkAndOr(lhs.dataType(), rhs.dataType());
        } catch (ColumnOperationException e) {
            ColumnType offending = ColumnType.BOOLEAN.equals(lhs.dataType()) ? rhs.dataType() : lhs.dataType();
            throw AnalyzeException.invalidDataType(ColumnType.BOOLEAN, offending, e);
        }
    }

    public ProvableExpression expr() {
        return expr;
    }

    @Override
    public ColumnType dataType() {
        return ColumnType.BOOLEAN;
    }

    @Override
    public void collectColumnReferences(Set<ColumnRef> columns) {
        expr.collectColumnReferences(columns);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof NotExpr)) return false;
        return expr.equals(((NotExpr) obj).expr);
    }

    @Override
    public int hashCode() {
        return Objects.hash("not", expr);
    }

    @Override
    public String toString() {
        return "Not(" + expr + ")";
    }
}
