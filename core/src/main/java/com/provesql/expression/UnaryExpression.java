package com.provesql.expression;

import com.provesql.types.BooleanType;
import com.provesql.types.DataType;
import java.util.Objects;

/**
 * Expression representing a unary operation (operation with one operand).
 *
 * <p>Examples:
 * <pre>
 *   -price                     -- arithmetic negation
 *   NOT active                 -- logical negation
 *   email IS NULL              -- null check
 *   email IS NOT NULL          -- not null check
 * </pre>
 *
 * <p>Only negation and NOT have provable counterparts.
 */
public final class UnaryExpression implements Expression {

    /**
     * Unary operators.
     */
    public enum Operator {
        NEGATE("-"),
        NOT("NOT"),
        IS_NULL("IS NULL"),
        IS_NOT_NULL("IS NOT NULL");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isPostfix() {
            return this == IS_NULL || this == IS_NOT_NULL;
        }
    }

    private final Operator operator;
    private final Expression operand;

    /**
     * Creates a unary expression.
     *
     * @param operator the operator
     * @param operand the operand
     */
    public UnaryExpression(Operator operator, Expression operand) {
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.operand = Objects.requireNonNull(operand, "operand must not be null");
    }

    public Operator operator() {
        return operator;
    }

    public Expression operand() {
        return operand;
    }

    @Override
    public DataType dataType() {
        if (operator == Operator.NEGATE) {
            return operand.dataType();
        }
        return BooleanType.get();
    }

    @Override
    public boolean nullable() {
        return operator.isPostfix() ? false : operand.nullable();
    }

    @Override
    public String toSQL() {
        if (operator.isPostfix()) {
            return String.format("(%s %s)", operand.toSQL(), operator.symbol());
        }
        if (operator == Operator.NOT) {
            return String.format("(NOT %s)", operand.toSQL());
        }
        return String.format("(-%s)", operand.toSQL());
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof UnaryExpression)) return false;
        UnaryExpression that = (UnaryExpression) obj;
        return operator == that.operator &&
               Objects.equals(operand, that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }

    // ==================== Factory Methods ====================

    public static UnaryExpression negate(Expression operand) {
        return new UnaryExpression(Operator.NEGATE, operand);
    }

    public static UnaryExpression not(Expression operand) {
        return new UnaryExpression(Operator.NOT, operand);
    }

    public static UnaryExpression isNull(Expression operand) {
        return new UnaryExpression(Operator.IS_NULL, operand);
    }

    public static UnaryExpression isNotNull(Expression operand) {
        return new UnaryExpression(Operator.IS_NOT_NULL, operand);
    }
}
