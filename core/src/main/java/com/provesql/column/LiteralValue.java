package com.provesql.column;

import java.math.BigInteger;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;

/**
 * A constant value of one of the column types.
 *
 * <p>There is no NULL literal: absence of a value is not representable.
 */
public sealed interface LiteralValue
    permits LiteralValue.BooleanValue, LiteralValue.Uint8Value, LiteralValue.TinyIntValue,
            LiteralValue.SmallIntValue, LiteralValue.IntValue, LiteralValue.BigIntValue,
            LiteralValue.Int128Value, LiteralValue.Decimal75Value, LiteralValue.ScalarValue,
            LiteralValue.VarCharValue, LiteralValue.VarBinaryValue, LiteralValue.TimestampTZValue {

    /**
     * Returns the column type of this value.
     *
     * @return the column type
     */
    ColumnType columnType();

    record BooleanValue(boolean value) implements LiteralValue {
        @Override
        public ColumnType columnType() {
            return ColumnType.BOOLEAN;
        }

        @Override
        public String toString() {
            return Boolean.toString(value).toUpperCase(Locale.ROOT);
        }
    }

    /**
     * Unsigned 8-bit value, held in the range 0..255.
     */
    record Uint8Value(int value) implements LiteralValue {
        public Uint8Value {
            if (value < 0 || value > 255) {
                throw new IllegalArgumentException("uint8 value out of range: " + value);
            }
        }

        @Override
        public ColumnType columnType() {
            return ColumnType.UINT8;
        }

        @Override
        public String toString() {
            return Integer.toString(value);
        }
    }

    record TinyIntValue(byte value) implements LiteralValue {
        @Override
        public ColumnType columnType() {
            return ColumnType.TINYINT;
        }

        @Override
        public String toString() {
            return Byte.toString(value);
        }
    }

    record SmallIntValue(short value) implements LiteralValue {
        @Override
        public ColumnType columnType() {
            return ColumnType.SMALLINT;
        }

        @Override
        public String toString() {
            return Short.toString(value);
        }
    }

    record IntValue(int value) implements LiteralValue {
        @Override
        public ColumnType columnType() {
            return ColumnType.INT;
        }

        @Override
        public String toString() {
            return Integer.toString(value);
        }
    }

    record BigIntValue(long value) implements LiteralValue {
        @Override
        public ColumnType columnType() {
            return ColumnType.BIGINT;
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    /**
     * Signed 128-bit value.
     */
    record Int128Value(BigInteger value) implements LiteralValue {
        public Int128Value {
            Objects.requireNonNull(value, "value must not be null");
            if (value.bitLength() > 127) {
                throw new IllegalArgumentException("int128 value out of range: " + value);
            }
        }

        @Override
        public ColumnType columnType() {
            return ColumnType.INT128;
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    /**
     * Fixed-point decimal stored as its unscaled integer value.
     */
    record Decimal75Value(int precision, int scale, BigInteger unscaledValue) implements LiteralValue {
        public Decimal75Value {
            Objects.requireNonNull(unscaledValue, "unscaledValue must not be null");
            // validates the precision/scale pair
            ColumnType.decimal75(precision, scale);
        }

        @Override
        public ColumnType columnType() {
            return ColumnType.decimal75(precision, scale);
        }

        @Override
        public String toString() {
            return new java.math.BigDecimal(unscaledValue, scale).toPlainString();
        }
    }

    record ScalarValue(BigInteger value) implements LiteralValue {
        public ScalarValue {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public ColumnType columnType() {
            return ColumnType.SCALAR;
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    record VarCharValue(String value) implements LiteralValue {
        public VarCharValue {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public ColumnType columnType() {
            return ColumnType.VARCHAR;
        }

        @Override
        public String toString() {
            return "'" + value.replace("'", "''") + "'";
        }
    }

    record VarBinaryValue(byte[] value) implements LiteralValue {
        public VarBinaryValue {
            value = Objects.requireNonNull(value, "value must not be null").clone();
        }

        @Override
        public byte[] value() {
            return value.clone();
        }

        @Override
        public ColumnType columnType() {
            return ColumnType.VARBINARY;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof VarBinaryValue && Arrays.equals(value, ((VarBinaryValue) obj).value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "X'" + HexFormat.of().formatHex(value) + "'";
        }
    }

    /**
     * Timestamp as a count of {@code unit} since the Unix epoch.
     */
    record TimestampTZValue(TimeUnit unit, ZoneOffset zone, long value) implements LiteralValue {
        public TimestampTZValue {
            Objects.requireNonNull(unit, "unit must not be null");
            Objects.requireNonNull(zone, "zone must not be null");
        }

        @Override
        public ColumnType columnType() {
            return ColumnType.timestampTz(unit, zone);
        }

        @Override
        public String toString() {
            return "TIMESTAMP(" + value + " " + unit + ", " + zone + ")";
        }
    }
}
