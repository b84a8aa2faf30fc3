package com.provesql.column;

import com.provesql.config.PlannerConfig;
import com.provesql.exception.ColumnOperationException;

/**
 * Decides the legality and the exact result type of operations over column types.
 *
 * <p>All functions are pure. Illegal combinations are reported with a
 * {@link ColumnOperationException}; no function fails in any other way on
 * numeric input, since every numeric type carries a precision and a scale.
 *
 * <h2>Result type rules</h2>
 * <ul>
 *   <li>Two integers: the wider integer type</li>
 *   <li>Scalar on either side (except division): Scalar</li>
 *   <li>Otherwise decimal arithmetic, with integers treated as Decimal(p, 0)</li>
 * </ul>
 *
 * <h2>Two precision policies</h2>
 * <ul>
 *   <li><b>strict</b> ({@link #addSubtract}, {@link #multiply}): a result precision
 *       above 75 is an {@code INVALID_PRECISION} error. Used when operands are
 *       combined directly.</li>
 *   <li><b>capped</b> ({@link #addSubtractCapped}, {@link #multiplyCapped}): the
 *       result precision is clamped to 75. Used once a scale-alignment cast has
 *       already normalized the operands.</li>
 * </ul>
 *
 * <h2>Two comparison policies</h2>
 * <ul>
 *   <li><b>same-scale</b> ({@link #checkEquals}, {@link #checkInequality}): numeric
 *       operands must share their scale. Used when no cast is inserted.</li>
 *   <li><b>scale-tolerant</b> ({@link #checkEqualsWithScaling},
 *       {@link #checkInequalityWithScaling}): any two numerics pass. Used right
 *       before a scale-alignment cast is inserted.</li>
 * </ul>
 */
public final class ColumnTypeArithmetic {

    private static final String ADD_SUBTRACT = "+/-";
    private static final String MULTIPLY = "*";
    private static final String DIVIDE = "/";
    private static final String EQUALS = "=";
    private static final String INEQUALITY = "</>";
    private static final String AND_OR = "AND/OR";
    private static final String NOT = "NOT";
    private static final String NEGATE = "-";

    private ColumnTypeArithmetic() {
        // Utility class - prevent instantiation
    }

    // ========================================================================
    // Addition / Subtraction
    // ========================================================================

    /**
     * Result type of {@code lhs + rhs} or {@code lhs - rhs}, strict policy.
     *
     * <p>Decimal formula:
     * <ul>
     *   <li>scale = max(s1, s2)</li>
     *   <li>precision = scale + max(p1 - s1, p2 - s2) + 1</li>
     * </ul>
     *
     * @param lhs the left operand type
     * @param rhs the right operand type
     * @return the result type
     * @throws ColumnOperationException {@code INVALID_COLUMN_TYPE} for a non-numeric
     *         operand, {@code INVALID_PRECISION} if the precision exceeds 75
     */
    public static ColumnType addSubtract(ColumnType lhs, ColumnType rhs) {
        return addSubtract(lhs, rhs, false);
    }

    /**
     * Result type of {@code lhs + rhs} or {@code lhs - rhs}, capped policy.
     *
     * <p>Same as {@link #addSubtract} except that the precision is clamped to 75.
     *
     * @param lhs the left operand type
     * @param rhs the right operand type
     * @return the result type
     * @throws ColumnOperationException {@code INVALID_COLUMN_TYPE} for a non-numeric operand
     */
    public static ColumnType addSubtractCapped(ColumnType lhs, ColumnType rhs) {
        return addSubtract(lhs, rhs, true);
    }

    private static ColumnType addSubtract(ColumnType lhs, ColumnType rhs, boolean capped) {
        requireNumeric(ADD_SUBTRACT, lhs, rhs);
        if (lhs.isInteger() && rhs.isInteger()) {
            return widerIntegerType(lhs, rhs);
        }
        if (isScalar(lhs) || isScalar(rhs)) {
            return ColumnType.SCALAR;
        }
        int scale = Math.max(lhs.scale(), rhs.scale());
        int integerDigits = Math.max(lhs.precision() - lhs.scale(), rhs.precision() - rhs.scale());
        int precision = scale + integerDigits + 1;
        return decimalResult(precision, scale, capped);
    }

    // ========================================================================
    // Multiplication / Division
    // ========================================================================

    /**
     * Result type of {@code lhs * rhs}, strict policy.
     *
     * <p>Decimal formula:
     * <ul>
     *   <li>precision = p1 + p2 + 1</li>
     *   <li>scale = s1 + s2</li>
     * </ul>
     *
     * @param lhs the left operand type
     * @param rhs the right operand type
     * @return the result type
     * @throws ColumnOperationException {@code INVALID_COLUMN_TYPE} for a non-numeric
     *         operand, {@code INVALID_PRECISION} if the precision exceeds 75,
     *         {@code INVALID_SCALE} if the scale leaves the signed 8-bit range
     */
    public static ColumnType multiply(ColumnType lhs, ColumnType rhs) {
        return multiply(lhs, rhs, false);
    }

    /**
     * Result type of {@code lhs * rhs}, capped policy.
     *
     * @param lhs the left operand type
     * @param rhs the right operand type
     * @return the result type
     * @throws ColumnOperationException {@code INVALID_COLUMN_TYPE} for a non-numeric
     *         operand, {@code INVALID_SCALE} if the scale leaves the signed 8-bit range
     */
    public static ColumnType multiplyCapped(ColumnType lhs, ColumnType rhs) {
        return multiply(lhs, rhs, true);
    }

    private static ColumnType multiply(ColumnType lhs, ColumnType rhs, boolean capped) {
        requireNumeric(MULTIPLY, lhs, rhs);
        if (lhs.isInteger() && rhs.isInteger()) {
            return widerIntegerType(lhs, rhs);
        }
        if (isScalar(lhs) || isScalar(rhs)) {
            return ColumnType.SCALAR;
        }
        int scale = lhs.scale() + rhs.scale();
        if (!PlannerConfig.isValidScale(scale)) {
            throw ColumnOperationException.invalidScale(Integer.toString(scale));
        }
        int precision = lhs.precision() + rhs.precision() + 1;
        return decimalResult(precision, scale, capped);
    }

    /**
     * Result type of {@code lhs / rhs}.
     *
     * <p>Only decimals and integers may be divided. Formula:
     * <ul>
     *   <li>scale = max(s1 + p2 + 1, 6)</li>
     *   <li>precision = (p1 - s1) + s2 + scale, capped at 75</li>
     * </ul>
     *
     * @param lhs the dividend type
     * @param rhs the divisor type
     * @return the result type
     * @throws ColumnOperationException {@code INVALID_COLUMN_TYPE} for a non-numeric or
     *         Scalar operand, {@code INVALID_SCALE} if the scale exceeds 127
     */
    public static ColumnType divide(ColumnType lhs, ColumnType rhs) {
        if (!lhs.isNumeric() || !rhs.isNumeric() || isScalar(lhs) || isScalar(rhs)) {
            throw ColumnOperationException.invalidColumnType(DIVIDE, lhs, rhs);
        }
        int scale = Math.max(lhs.scale() + rhs.precision() + 1, PlannerConfig.MIN_DIVISION_SCALE);
        if (!PlannerConfig.isValidScale(scale)) {
            throw ColumnOperationException.invalidScale(Integer.toString(scale));
        }
        int precision = (lhs.precision() - lhs.scale()) + rhs.scale() + scale;
        return decimalResult(precision, scale, true);
    }

    // ========================================================================
    // Comparisons
    // ========================================================================

    /**
     * Checks that {@code lhs = rhs} is legal without any scale alignment.
     *
     * <p>Accepted: VarChar/VarChar, Boolean/Boolean, anything with Scalar,
     * numeric pairs of identical scale, TimestampTZ pairs of the same unit.
     * VarBinary is never comparable.
     *
     * @param lhs the left operand type
     * @param rhs the right operand type
     * @throws ColumnOperationException {@code INVALID_COLUMN_TYPE} if illegal
     */
    public static void checkEquals(ColumnType lhs, ColumnType rhs) {
        boolean legal = !isVarBinary(lhs) && !isVarBinary(rhs) && (
            sameKind(lhs, rhs, ColumnType.Kind.VARCHAR)
                || sameKind(lhs, rhs, ColumnType.Kind.BOOLEAN)
                || isScalar(lhs) || isScalar(rhs)
                || lhs.isNumeric() && rhs.isNumeric() && lhs.scale() == rhs.scale()
                || sameKind(lhs, rhs, ColumnType.Kind.TIMESTAMP_TZ) && lhs.timeUnit() == rhs.timeUnit());
        if (!legal) {
            throw ColumnOperationException.invalidColumnType(EQUALS, lhs, rhs);
        }
    }

    /**
     * Checks that {@code lhs = rhs} is legal once a scale-alignment cast is inserted.
     *
     * <p>Accepted: VarChar/VarChar, Boolean/Boolean, anything with Scalar,
     * any two numerics, any two TimestampTZ.
     *
     * @param lhs the left operand type
     * @param rhs the right operand type
     * @throws ColumnOperationException {@code INVALID_COLUMN_TYPE} if illegal
     */
    public static void checkEqualsWithScaling(ColumnType lhs, ColumnType rhs) {
        boolean legal = !isVarBinary(lhs) && !isVarBinary(rhs) && (
            sameKind(lhs, rhs, ColumnType.Kind.VARCHAR)
                || sameKind(lhs, rhs, ColumnType.Kind.BOOLEAN)
                || isScalar(lhs) || isScalar(rhs)
                || lhs.isNumeric() && rhs.isNumeric()
                || sameKind(lhs, rhs, ColumnType.Kind.TIMESTAMP_TZ));
        if (!legal) {
            throw ColumnOperationException.invalidColumnType(EQUALS, lhs, rhs);
        }
    }

    /**
     * Checks that {@code lhs < rhs} (or {@code >}) is legal without any scale alignment.
     *
     * <p>Accepted: numeric pairs of identical scale, Boolean/Boolean, TimestampTZ
     * pairs of the same unit. Decimals above precision 38 are rejected.
     *
     * @param lhs the left operand type
     * @param rhs the right operand type
     * @throws ColumnOperationException {@code INVALID_COLUMN_TYPE} if illegal
     */
    public static void checkInequality(ColumnType lhs, ColumnType rhs) {
        boolean legal = withinInequalityPrecision(lhs) && withinInequalityPrecision(rhs) && (
            lhs.isNumeric() && rhs.isNumeric() && lhs.scale() == rhs.scale()
                || sameKind(lhs, rhs, ColumnType.Kind.BOOLEAN)
                || sameKind(lhs, rhs, ColumnType.Kind.TIMESTAMP_TZ) && lhs.timeUnit() == rhs.timeUnit());
        if (!legal) {
            throw ColumnOperationException.invalidColumnType(INEQUALITY, lhs, rhs);
        }
    }

    /**
     * Checks that {@code lhs < rhs} (or {@code >}) is legal once a scale-alignment
     * cast is inserted. Decimals above precision 38 are still rejected.
     *
     * @param lhs the left operand type
     * @param rhs the right operand type
     * @throws ColumnOperationException {@code INVALID_COLUMN_TYPE} if illegal
     */
    public static void checkInequalityWithScaling(ColumnType lhs, ColumnType rhs) {
        boolean legal = withinInequalityPrecision(lhs) && withinInequalityPrecision(rhs) && (
            lhs.isNumeric() && rhs.isNumeric()
                || sameKind(lhs, rhs, ColumnType.Kind.BOOLEAN)
                || sameKind(lhs, rhs, ColumnType.Kind.TIMESTAMP_TZ));
        if (!legal) {
            throw ColumnOperationException.invalidColumnType(INEQUALITY, lhs, rhs);
        }
    }

    // ========================================================================
    // Casts
    // ========================================================================

    /**
     * Checks that an explicit {@code CAST(from AS to)} is legal.
     *
     * <p>Accepted:
     * <ul>
     *   <li>Boolean to any signed integer</li>
     *   <li>TimestampTZ to BigInt</li>
     *   <li>Uint8 to Uint8, TinyInt to TinyInt</li>
     *   <li>Any integer to SmallInt, Int, BigInt, Int128 or Decimal(_, 0), and
     *       Decimal to Decimal, when the destination precision is at least the
     *       source precision and the scales are equal</li>
     * </ul>
     *
     * @param from the source type
     * @param to the destination type
     * @throws ColumnOperationException {@code CASTING_ERROR} if illegal
     */
    public static void checkCast(ColumnType from, ColumnType to) {
        if (!canCast(from, to)) {
            throw ColumnOperationException.castingError(from, to);
        }
    }

    private static boolean canCast(ColumnType from, ColumnType to) {
        ColumnType.Kind source = from.kind();
        ColumnType.Kind target = to.kind();
        if (source == ColumnType.Kind.BOOLEAN) {
            return to.isInteger() && to.isSigned();
        }
        if (source == ColumnType.Kind.TIMESTAMP_TZ) {
            return target == ColumnType.Kind.BIGINT;
        }
        if (source == target && (source == ColumnType.Kind.UINT8 || source == ColumnType.Kind.TINYINT)) {
            return true;
        }
        boolean integerWidening = from.isInteger() && (
            target == ColumnType.Kind.SMALLINT
                || target == ColumnType.Kind.INT
                || target == ColumnType.Kind.BIGINT
                || target == ColumnType.Kind.INT128
                || target == ColumnType.Kind.DECIMAL75 && to.scale() == 0);
        boolean decimalWidening = from.isDecimal() && to.isDecimal();
        if (integerWidening || decimalWidening) {
            return to.precision() >= from.precision() && to.scale() == from.scale();
        }
        return false;
    }

    /**
     * Checks that a scale-preserving-or-widening cast from {@code from} to {@code to} is legal.
     *
     * <p>Integers and decimals may be scale cast to a decimal when
     * {@code to.scale >= from.scale} and
     * {@code (to.precision - to.scale) >= (from.precision - from.scale)}. A
     * timestamp may be scale cast to a timestamp of an equal or finer unit.
     *
     * @param from the source type
     * @param to the destination type
     * @throws ColumnOperationException {@code SCALE_CASTING_ERROR} if illegal
     */
    public static void checkScaleCast(ColumnType from, ColumnType to) {
        boolean legal;
        if ((from.isInteger() || from.isDecimal()) && to.isDecimal()) {
            legal = to.scale() >= from.scale()
                && (to.precision() - to.scale()) >= (from.precision() - from.scale());
        } else if (from.kind() == ColumnType.Kind.TIMESTAMP_TZ && to.kind() == ColumnType.Kind.TIMESTAMP_TZ) {
            legal = to.scale() >= from.scale();
        } else {
            legal = false;
        }
        if (!legal) {
            throw ColumnOperationException.scaleCastingError(from, to);
        }
    }

    // ========================================================================
    // Boolean and unary operators
    // ========================================================================

    /**
     * Checks that {@code lhs AND rhs} / {@code lhs OR rhs} is legal.
     *
     * @param lhs the left operand type
     * @param rhs the right operand type
     * @throws ColumnOperationException {@code INVALID_COLUMN_TYPE} unless both are Boolean
     */
    public static void checkAndOr(ColumnType lhs, ColumnType rhs) {
        if (!ColumnType.BOOLEAN.equals(lhs) || !ColumnType.BOOLEAN.equals(rhs)) {
            throw ColumnOperationException.invalidColumnType(AND_OR, lhs, rhs);
        }
    }

    /**
     * Checks that {@code NOT operand} is legal.
     *
     * @param operand the operand type
     * @throws ColumnOperationException {@code INVALID_COLUMN_TYPE} unless Boolean
     */
    public static void checkNot(ColumnType operand) {
        if (!ColumnType.BOOLEAN.equals(operand)) {
            throw ColumnOperationException.invalidColumnType(NOT, operand);
        }
    }

    /**
     * Checks that {@code -operand} is legal.
     *
     * @param operand the operand type
     * @throws ColumnOperationException {@code INVALID_COLUMN_TYPE} unless numeric
     */
    public static void checkNegate(ColumnType operand) {
        if (!operand.isNumeric()) {
            throw ColumnOperationException.invalidColumnType(NEGATE, operand);
        }
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    /**
     * Returns the wider of two integer types by bit width.
     *
     * <p>Two Uint8 operands stay Uint8; any other combination yields the signed
     * integer type of the larger width.
     *
     * @param lhs an integer type
     * @param rhs an integer type
     * @return the wider integer type
     */
    public static ColumnType widerIntegerType(ColumnType lhs, ColumnType rhs) {
        if (!lhs.isInteger() || !rhs.isInteger()) {
            throw new IllegalArgumentException("Both types must be integers: " + lhs + ", " + rhs);
        }
        if (lhs.kind() == ColumnType.Kind.UINT8 && rhs.kind() == ColumnType.Kind.UINT8) {
            return ColumnType.UINT8;
        }
        return ColumnType.signedIntegerOfBits(Math.max(lhs.integerBits(), rhs.integerBits()));
    }

    private static ColumnType decimalResult(int precision, int scale, boolean capped) {
        if (precision > PlannerConfig.MAX_DECIMAL_PRECISION) {
            if (!capped) {
                throw ColumnOperationException.invalidPrecision(Integer.toString(precision));
            }
            precision = PlannerConfig.MAX_DECIMAL_PRECISION;
        }
        return ColumnType.decimal75(precision, scale);
    }

    private static void requireNumeric(String operator, ColumnType lhs, ColumnType rhs) {
        if (!lhs.isNumeric() || !rhs.isNumeric()) {
            throw ColumnOperationException.invalidColumnType(operator, lhs, rhs);
        }
    }

    private static boolean withinInequalityPrecision(ColumnType type) {
        return !type.isDecimal() || type.precision() <= PlannerConfig.MAX_INEQUALITY_PRECISION;
    }

    private static boolean sameKind(ColumnType lhs, ColumnType rhs, ColumnType.Kind kind) {
        return lhs.kind() == kind && rhs.kind() == kind;
    }

    private static boolean isScalar(ColumnType type) {
        return type.kind() == ColumnType.Kind.SCALAR;
    }

    private static boolean isVarBinary(ColumnType type) {
        return type.kind() == ColumnType.Kind.VARBINARY;
    }
}
