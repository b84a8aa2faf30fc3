package com.provesql.column;

import com.provesql.config.PlannerConfig;
import com.provesql.exception.ColumnOperationException;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Type of a column in a provable table.
 *
 * <p>The set of column types is closed:
 * <ul>
 *   <li>Boolean</li>
 *   <li>Integers: unsigned 8-bit, signed 8/16/32/64/128-bit</li>
 *   <li>Decimal75(precision, scale): precision 1-75, scale -128..127</li>
 *   <li>Scalar: an unbounded field element</li>
 *   <li>VarChar and VarBinary</li>
 *   <li>TimestampTZ(unit, zone)</li>
 * </ul>
 *
 * <p>"Numeric" means any integer, Decimal75 or Scalar. Every numeric type carries
 * a precision and a scale; integers have scale 0 and a precision equal to the
 * number of decimal digits of their range.
 */
public final class ColumnType {

    /**
     * Column type variants.
     */
    public enum Kind {
        BOOLEAN("BOOLEAN"),
        UINT8("UINT8"),
        TINYINT("TINYINT"),
        SMALLINT("SMALLINT"),
        INT("INT"),
        BIGINT("BIGINT"),
        INT128("INT128"),
        DECIMAL75("DECIMAL75"),
        SCALAR("SCALAR"),
        VARCHAR("VARCHAR"),
        VARBINARY("BINARY"),
        TIMESTAMP_TZ("TIMESTAMP");

        private final String sqlName;

        Kind(String sqlName) {
            this.sqlName = sqlName;
        }

        public String sqlName() {
            return sqlName;
        }
    }

    public static final ColumnType BOOLEAN = new ColumnType(Kind.BOOLEAN, 0, 0, null, null);
    public static final ColumnType UINT8 = new ColumnType(Kind.UINT8, 3, 0, null, null);
    public static final ColumnType TINYINT = new ColumnType(Kind.TINYINT, 3, 0, null, null);
    public static final ColumnType SMALLINT = new ColumnType(Kind.SMALLINT, 5, 0, null, null);
    public static final ColumnType INT = new ColumnType(Kind.INT, 10, 0, null, null);
    public static final ColumnType BIGINT = new ColumnType(Kind.BIGINT, 19, 0, null, null);
    public static final ColumnType INT128 = new ColumnType(Kind.INT128, 39, 0, null, null);
    public static final ColumnType SCALAR = new ColumnType(Kind.SCALAR, 0, 0, null, null);
    public static final ColumnType VARCHAR = new ColumnType(Kind.VARCHAR, 0, 0, null, null);
    public static final ColumnType VARBINARY = new ColumnType(Kind.VARBINARY, 0, 0, null, null);

    private final Kind kind;
    private final int precision;
    private final int scale;
    private final TimeUnit timeUnit;
    private final ZoneOffset timeZone;

    private ColumnType(Kind kind, int precision, int scale, TimeUnit timeUnit, ZoneOffset timeZone) {
        this.kind = kind;
        this.precision = precision;
        this.scale = scale;
        this.timeUnit = timeUnit;
        this.timeZone = timeZone;
    }

    /**
     * Creates a decimal type.
     *
     * @param precision the total number of significant digits (1-75)
     * @param scale the number of digits right of the decimal point (-128..127)
     * @return the decimal type
     * @throws ColumnOperationException if precision or scale is out of range
     */
    public static ColumnType decimal75(int precision, int scale) {
        if (!PlannerConfig.isValidPrecision(precision)) {
            throw ColumnOperationException.invalidPrecision(Integer.toString(precision));
        }
        if (!PlannerConfig.isValidScale(scale)) {
            throw ColumnOperationException.invalidScale(Integer.toString(scale));
        }
        return new ColumnType(Kind.DECIMAL75, precision, scale, null, null);
    }

    /**
     * Creates a timestamp-with-time-zone type.
     *
     * @param unit the time unit
     * @param zone the time zone offset
     * @return the timestamp type
     */
    public static ColumnType timestampTz(TimeUnit unit, ZoneOffset zone) {
        Objects.requireNonNull(unit, "unit must not be null");
        Objects.requireNonNull(zone, "zone must not be null");
        return new ColumnType(Kind.TIMESTAMP_TZ, 19, unit.scale(), unit, zone);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Returns true for integers, decimals and Scalar.
     *
     * @return true if this type is numeric
     */
    public boolean isNumeric() {
        return isInteger() || kind == Kind.DECIMAL75 || kind == Kind.SCALAR;
    }

    public boolean isInteger() {
        switch (kind) {
            case UINT8:
            case TINYINT:
            case SMALLINT:
            case INT:
            case BIGINT:
            case INT128:
                return true;
            default:
                return false;
        }
    }

    public boolean isSigned() {
        return isInteger() && kind != Kind.UINT8 || kind == Kind.TIMESTAMP_TZ;
    }

    public boolean isDecimal() {
        return kind == Kind.DECIMAL75;
    }

    /**
     * Returns true if this type has a precision and a scale (numeric and timestamp types).
     *
     * @return true if {@link #precision()} and {@link #scale()} are defined
     */
    public boolean hasPrecision() {
        return isNumeric() || kind == Kind.TIMESTAMP_TZ;
    }

    /**
     * Returns the precision of a numeric or timestamp type.
     *
     * @return the precision
     * @throws IllegalStateException if this type has no precision
     */
    public int precision() {
        if (!hasPrecision()) {
            throw new IllegalStateException(this + " has no precision");
        }
        return precision;
    }

    /**
     * Returns the scale of a numeric or timestamp type.
     *
     * @return the scale
     * @throws IllegalStateException if this type has no scale
     */
    public int scale() {
        if (!hasPrecision()) {
            throw new IllegalStateException(this + " has no scale");
        }
        return scale;
    }

    /**
     * Returns the bit width of an integer type, or -1 for other types.
     *
     * @return the bit width
     */
    public int integerBits() {
        switch (kind) {
            case UINT8:
            case TINYINT:
                return 8;
            case SMALLINT:
                return 16;
            case INT:
                return 32;
            case BIGINT:
                return 64;
            case INT128:
                return 128;
            default:
                return -1;
        }
    }

    /**
     * Returns the signed integer type of the given bit width.
     *
     * @param bits 8, 16, 32, 64 or 128
     * @return the integer type
     */
    static ColumnType signedIntegerOfBits(int bits) {
        switch (bits) {
            case 8:
                return TINYINT;
            case 16:
                return SMALLINT;
            case 32:
                return INT;
            case 64:
                return BIGINT;
            case 128:
                return INT128;
            default:
                throw new IllegalArgumentException("No signed integer type has " + bits + " bits");
        }
    }

    /**
     * Returns the time unit of a timestamp type, or null for other types.
     *
     * @return the time unit
     */
    public TimeUnit timeUnit() {
        return timeUnit;
    }

    /**
     * Returns the time zone of a timestamp type, or null for other types.
     *
     * @return the zone offset
     */
    public ZoneOffset timeZone() {
        return timeZone;
    }

    public String typeName() {
        if (kind == Kind.DECIMAL75) {
            return String.format("DECIMAL75(%d, %d)", precision, scale);
        }
        if (kind == Kind.TIMESTAMP_TZ) {
            return String.format("TIMESTAMP(%s, %s)", timeUnit, timeZone);
        }
        return kind.sqlName();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ColumnType)) return false;
        ColumnType that = (ColumnType) obj;
        return kind == that.kind &&
               precision == that.precision &&
               scale == that.scale &&
               timeUnit == that.timeUnit &&
               Objects.equals(timeZone, that.timeZone);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, precision, scale, timeUnit, timeZone);
    }

    @Override
    public String toString() {
        return typeName();
    }
}
