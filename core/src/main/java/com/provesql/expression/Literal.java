package com.provesql.expression;

import com.provesql.types.*;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;

/**
 * Expression representing a literal constant value.
 *
 * <p>The Java representation of the value depends on the data type:
 * <ul>
 *   <li>BooleanType: {@link Boolean}</li>
 *   <li>Integer types: any integral {@link Number} ({@code Byte}, {@code Short},
 *       {@code Integer}, {@code Long}, {@code BigInteger})</li>
 *   <li>DecimalType: {@link BigDecimal}</li>
 *   <li>StringType: {@link String}</li>
 *   <li>BinaryType: {@code byte[]}</li>
 *   <li>TimestampType: {@link Long}, a count of the type's unit since the epoch</li>
 *   <li>any type: {@code null} for the NULL literal</li>
 * </ul>
 */
public final class Literal implements Expression {

    private final Object value;
    private final DataType dataType;

    /**
     * Creates a literal expression.
     *
     * @param value the literal value (may be null)
     * @param dataType the data type of the literal
     */
    public Literal(Object value, DataType dataType) {
        this.value = value instanceof byte[] ? ((byte[]) value).clone() : value;
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
    }

    public Object value() {
        return value instanceof byte[] ? ((byte[]) value).clone() : value;
    }

    public boolean isNull() {
        return value == null;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return value == null;
    }

    @Override
    public String toSQL() {
        if (value == null) {
            return "NULL";
        }

        if (dataType instanceof StringType) {
            String str = value.toString().replace("'", "''");
            return "'" + str + "'";
        }

        if (dataType instanceof BooleanType) {
            return value.toString().toUpperCase(Locale.ROOT);
        }

        if (dataType instanceof BinaryType && value instanceof byte[]) {
            return "X'" + HexFormat.of().formatHex((byte[]) value) + "'";
        }

        if (dataType instanceof DecimalType && value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }

        if (dataType instanceof TimestampType) {
            return "TIMESTAMP '" + value + "'";
        }

        return value.toString();
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Literal)) return false;
        Literal that = (Literal) obj;
        return Objects.deepEquals(value, that.value) &&
               Objects.equals(dataType, that.dataType);
    }

    @Override
    public int hashCode() {
        int valueHash = value instanceof byte[] ? Arrays.hashCode((byte[]) value) : Objects.hashCode(value);
        return 31 * valueHash + dataType.hashCode();
    }

    // ==================== Factory Methods ====================

    public static Literal of(boolean value) {
        return new Literal(value, BooleanType.get());
    }

    public static Literal of(int value) {
        return new Literal(value, IntegerType.get());
    }

    public static Literal of(long value) {
        return new Literal(value, LongType.get());
    }

    public static Literal of(String value) {
        return new Literal(value, StringType.get());
    }

    public static Literal of(byte[] value) {
        return new Literal(value, BinaryType.get());
    }

    /**
     * Creates a decimal literal typed with the given precision and scale.
     *
     * @param value the decimal value
     * @param precision the declared precision
     * @param scale the declared scale
     * @return the literal expression
     */
    public static Literal decimal(BigDecimal value, int precision, int scale) {
        return new Literal(value, new DecimalType(precision, scale));
    }

    /**
     * Creates a NULL literal of the given type.
     *
     * @param dataType the data type
     * @return the literal expression
     */
    public static Literal nullOf(DataType dataType) {
        return new Literal(null, dataType);
    }
}
