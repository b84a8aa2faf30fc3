package com.provesql.compiler;

import com.provesql.column.ColumnType;
import com.provesql.column.LiteralValue;
import com.provesql.exception.ColumnOperationException;
import com.provesql.exception.PlannerException;
import com.provesql.expression.Literal;
import com.provesql.types.TypeMapper;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Converts source literals to column literal values.
 *
 * <p>Integers are narrowed with checked arithmetic; decimals are rescaled
 * exactly to the declared scale and must fit the declared precision.
 */
final class LiteralConverter {

    private static final BigInteger UINT8_MAX = BigInteger.valueOf(255);

    private LiteralConverter() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts a source literal.
     *
     * @param literal the literal
     * @return the column value
     * @throws PlannerException {@code UNSUPPORTED_DATA_TYPE} for NULL and for types
     *         with no column type
     * @throws ColumnOperationException if the value does not fit its declared type
     */
    static LiteralValue convert(Literal literal) {
        if (literal.isNull()) {
            throw PlannerException.unsupportedDataType(literal);
        }
        ColumnType type = TypeMapper.toColumnType(literal.dataType());
        Object value = literal.value();

        switch (type.kind()) {
            case BOOLEAN:
                return new LiteralValue.BooleanValue(expect(value, Boolean.class, literal));
            case UINT8:
                BigInteger unsigned = toBigInteger(value, literal);
                if (unsigned.signum() < 0 || unsigned.compareTo(UINT8_MAX) > 0) {
                    throw ColumnOperationException.integerOverflow(unsigned.toString(), type);
                }
                return new LiteralValue.Uint8Value(unsigned.intValue());
            case TINYINT:
                return new LiteralValue.TinyIntValue(narrow(value, type, literal).byteValueExact());
            case SMALLINT:
                return new LiteralValue.SmallIntValue(narrow(value, type, literal).shortValueExact());
            case INT:
                return new LiteralValue.IntValue(narrow(value, type, literal).intValueExact());
            case BIGINT:
                return new LiteralValue.BigIntValue(narrow(value, type, literal).longValueExact());
            case DECIMAL75:
                return toDecimal(value, type, literal);
            case VARCHAR:
                return new LiteralValue.VarCharValue(expect(value, String.class, literal));
            case VARBINARY:
                return new LiteralValue.VarBinaryValue(expect(value, byte[].class, literal));
            case TIMESTAMP_TZ:
                return new LiteralValue.TimestampTZValue(type.timeUnit(), type.timeZone(),
                    narrow(value, ColumnType.BIGINT, literal).longValueExact());
            default:
                throw PlannerException.unsupportedDataType(literal.dataType());
        }
    }

    private static LiteralValue toDecimal(Object value, ColumnType type, Literal literal) {
        BigDecimal decimal;
        if (value instanceof BigDecimal) {
            decimal = (BigDecimal) value;
        } else {
            decimal = new BigDecimal(toBigInteger(value, literal));
        }

        BigDecimal rescaled;
        try {
            rescaled = decimal.setScale(type.scale(), RoundingMode.UNNECESSARY);
        } catch (ArithmeticException e) {
            ColumnOperationException failure = ColumnOperationException.invalidScale(decimal.toPlainString());
            failure.initCause(e);
            throw failure;
        }
        BigInteger unscaled = rescaled.unscaledValue();
        if (unscaled.signum() != 0 && unscaled.abs().toString().length() > type.precision()) {
            throw ColumnOperationException.invalidPrecision(decimal.toPlainString());
        }
        return new LiteralValue.Decimal75Value(type.precision(), type.scale(), unscaled);
    }

    /**
     * Returns the value as a BigInteger that fits the given integer type.
     */
    private static BigInteger narrow(Object value, ColumnType target, Literal literal) {
        BigInteger integer = toBigInteger(value, literal);
        if (integer.bitLength() >= target.integerBits()) {
            throw ColumnOperationException.integerOverflow(integer.toString(), target);
        }
        return integer;
    }

    private static BigInteger toBigInteger(Object value, Literal literal) {
        if (value instanceof BigInteger) {
            return (BigInteger) value;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return BigInteger.valueOf(((Number) value).longValue());
        }
        throw PlannerException.unsupportedDataType(literal);
    }

    private static <T> T expect(Object value, Class<T> type, Literal literal) {
        if (!type.isInstance(value)) {
            throw PlannerException.unsupportedDataType(literal);
        }
        return type.cast(value);
    }
}
