package com.provesql.exception;

import com.provesql.column.ColumnType;

/**
 * Exception thrown by the column type arithmetic when an operation is not legal
 * for its operand types, or when its exact result type cannot be represented.
 *
 * <p>Decimal "overflow" is reported here as precision or scale exhaustion
 * ({@link Kind#INVALID_PRECISION}, {@link Kind#INVALID_SCALE}). Only the
 * narrow integer fast paths used while converting literal values report
 * {@link Kind#INTEGER_OVERFLOW}.
 *
 * <p>The compilers never catch this exception; it reaches the caller verbatim.
 *
 * @see com.provesql.column.ColumnTypeArithmetic
 */
public class ColumnOperationException extends RuntimeException {

    /**
     * Failure categories.
     */
    public enum Kind {
        INVALID_COLUMN_TYPE,
        INVALID_PRECISION,
        INVALID_SCALE,
        CASTING_ERROR,
        SCALE_CASTING_ERROR,
        INTEGER_OVERFLOW
    }

    private final Kind kind;
    private final String operator;
    private final ColumnType leftType;
    private final ColumnType rightType;

    private ColumnOperationException(Kind kind, String message, String operator,
                                     ColumnType leftType, ColumnType rightType) {
        super(message);
        this.kind = kind;
        this.operator = operator;
        this.leftType = leftType;
        this.rightType = rightType;
    }

    /**
     * Creates an exception for a binary operation whose operand types are not supported.
     *
     * @param operator the operator text, e.g. "+/-"
     * @param leftType the left operand type
     * @param rightType the right operand type
     * @return the exception
     */
    public static ColumnOperationException invalidColumnType(String operator,
                                                             ColumnType leftType,
                                                             ColumnType rightType) {
        return new ColumnOperationException(Kind.INVALID_COLUMN_TYPE,
            String.format("Binary operator %s does not support column types %s and %s",
                operator, leftType, rightType),
            operator, leftType, rightType);
    }

    /**
     * Creates an exception for a unary operation whose operand type is not supported.
     *
     * @param operator the operator text
     * @param operandType the operand type
     * @return the exception
     */
    public static ColumnOperationException invalidColumnType(String operator, ColumnType operandType) {
        return new ColumnOperationException(Kind.INVALID_COLUMN_TYPE,
            String.format("Unary operator %s does not support column type %s", operator, operandType),
            operator, operandType, null);
    }

    public static ColumnOperationException invalidPrecision(String precision) {
        return new ColumnOperationException(Kind.INVALID_PRECISION,
            "Decimal precision is not valid: " + precision, null, null, null);
    }

    public static ColumnOperationException invalidScale(String scale) {
        return new ColumnOperationException(Kind.INVALID_SCALE,
            "Decimal scale is not valid: " + scale, null, null, null);
    }

    public static ColumnOperationException castingError(ColumnType from, ColumnType to) {
        return new ColumnOperationException(Kind.CASTING_ERROR,
            String.format("Cannot cast %s to %s", from, to), "CAST", from, to);
    }

    public static ColumnOperationException scaleCastingError(ColumnType from, ColumnType to) {
        return new ColumnOperationException(Kind.SCALE_CASTING_ERROR,
            String.format("Cannot scale cast %s to %s", from, to), "SCALE CAST", from, to);
    }

    /**
     * Creates an exception for a value that does not fit a narrow integer type.
     *
     * @param value the textual form of the value
     * @param target the integer type the value was narrowed to
     * @return the exception
     */
    public static ColumnOperationException integerOverflow(String value, ColumnType target) {
        return new ColumnOperationException(Kind.INTEGER_OVERFLOW,
            String.format("Value %s overflows %s", value, target), null, target, null);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Returns the operator text, or null if the failure is not tied to an operator.
     *
     * @return the operator
     */
    public String operator() {
        return operator;
    }

    /**
     * Returns the left (or only, or source) operand type, if any.
     *
     * @return the left type, or null
     */
    public ColumnType leftType() {
        return leftType;
    }

    /**
     * Returns the right (or destination) operand type, if any.
     *
     * @return the right type, or null
     */
    public ColumnType rightType() {
        return rightType;
    }
}
