package com.provesql.expression;

import com.provesql.types.BooleanType;
import com.provesql.types.DataType;
import java.util.Objects;

/**
 * Expression representing a binary operation (operation with two operands).
 *
 * <p>Binary expressions include:
 * <ul>
 *   <li>Arithmetic: a + b, a - b, a * b, a / b, a % b</li>
 *   <li>Comparison: a > b, a >= b, a < b, a <= b, a = b, a != b</li>
 *   <li>Logical: a AND b, a OR b</li>
 *   <li>String: a || b (concatenation)</li>
 * </ul>
 *
 * <p>The result type of an arithmetic expression is the one the upstream
 * analyzer computed; the provable result type is derived independently when
 * the expression is compiled.
 */
public final class BinaryExpression implements Expression {

    /**
     * Binary operators.
     */
    public enum Operator {
        // Arithmetic operators
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        MODULO("%"),

        // Comparison operators
        EQUAL("="),
        NOT_EQUAL("!="),
        LESS_THAN("<"),
        LESS_THAN_OR_EQUAL("<="),
        GREATER_THAN(">"),
        GREATER_THAN_OR_EQUAL(">="),

        // Logical operators
        AND("AND"),
        OR("OR"),

        // String operators
        CONCAT("||");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isComparison() {
            return this == EQUAL || this == NOT_EQUAL || this == LESS_THAN ||
                   this == LESS_THAN_OR_EQUAL || this == GREATER_THAN ||
                   this == GREATER_THAN_OR_EQUAL;
        }

        public boolean isLogical() {
            return this == AND || this == OR;
        }
    }

    private final Expression left;
    private final Operator operator;
    private final Expression right;
    private final DataType resultType;

    /**
     * Creates a binary expression with an explicit result type.
     *
     * @param left the left operand
     * @param operator the operator
     * @param right the right operand
     * @param resultType the analyzer's result type (null to derive it from the operands)
     */
    public BinaryExpression(Expression left, Operator operator, Expression right, DataType resultType) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
        this.resultType = resultType;
    }

    /**
     * Creates a binary expression.
     *
     * @param left the left operand
     * @param operator the operator
     * @param right the right operand
     */
    public BinaryExpression(Expression left, Operator operator, Expression right) {
        this(left, operator, right, null);
    }

    public Expression left() {
        return left;
    }

    public Operator operator() {
        return operator;
    }

    public Expression right() {
        return right;
    }

    @Override
    public DataType dataType() {
        if (operator.isComparison() || operator.isLogical()) {
            return BooleanType.get();
        }
        if (resultType != null) {
            return resultType;
        }
        return left.dataType();
    }

    @Override
    public boolean nullable() {
        return left.nullable() || right.nullable();
    }

    @Override
    public String toSQL() {
        return String.format("(%s %s %s)", left.toSQL(), operator.symbol(), right.toSQL());
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BinaryExpression)) return false;
        BinaryExpression that = (BinaryExpression) obj;
        return Objects.equals(left, that.left) &&
               operator == that.operator &&
               Objects.equals(right, that.right) &&
               Objects.equals(resultType, that.resultType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right, resultType);
    }

    // ==================== Factory Methods ====================

    public static BinaryExpression add(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.ADD, right);
    }

    public static BinaryExpression subtract(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.SUBTRACT, right);
    }

    public static BinaryExpression multiply(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.MULTIPLY, right);
    }

    public static BinaryExpression divide(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.DIVIDE, right);
    }

    public static BinaryExpression equal(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.EQUAL, right);
    }

    public static BinaryExpression notEqual(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.NOT_EQUAL, right);
    }

    public static BinaryExpression lessThan(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.LESS_THAN, right);
    }

    public static BinaryExpression lessThanOrEqual(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.LESS_THAN_OR_EQUAL, right);
    }

    public static BinaryExpression greaterThan(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.GREATER_THAN, right);
    }

    public static BinaryExpression greaterThanOrEqual(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.GREATER_THAN_OR_EQUAL, right);
    }

    public static BinaryExpression and(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.AND, right);
    }

    public static BinaryExpression or(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.OR, right);
    }
}
