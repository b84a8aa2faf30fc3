package com.provesql.types;

import java.util.Objects;

/**
 * Data type representing a fixed-precision decimal number.
 *
 * <p>Precision is the total number of digits, scale is the number of digits after the
 * decimal point. A negative scale stands for trailing zeros left of the point.
 * Example: DECIMAL(10, 2) can store values like 12345678.90
 *
 * <p>The upstream analyzer allows up to 76 digits (256-bit decimals); only
 * precisions up to 75 have a column type.
 */
public final class DecimalType implements DataType {

    public static final int MAX_PRECISION = 76;

    private final int precision;
    private final int scale;

    /**
     * Creates a decimal type with the given precision and scale.
     *
     * @param precision the total number of digits (1-76)
     * @param scale the number of digits after the decimal point (-128 to 127)
     */
    public DecimalType(int precision, int scale) {
        if (precision < 1 || precision > MAX_PRECISION) {
            throw new IllegalArgumentException("precision must be between 1 and " + MAX_PRECISION + ", got: " + precision);
        }
        if (scale < Byte.MIN_VALUE || scale > Byte.MAX_VALUE) {
            throw new IllegalArgumentException("scale must be between -128 and 127, got: " + scale);
        }
        this.precision = precision;
        this.scale = scale;
    }

    /**
     * Returns the precision (total number of digits).
     *
     * @return the precision
     */
    public int precision() {
        return precision;
    }

    /**
     * Returns the scale (number of digits after decimal point).
     *
     * @return the scale
     */
    public int scale() {
        return scale;
    }

    @Override
    public String typeName() {
        return String.format("decimal(%d,%d)", precision, scale);
    }

    @Override
    public int defaultSize() {
        if (precision <= 18) return 8;
        if (precision <= 38) return 16;
        return 32;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DecimalType)) return false;
        DecimalType that = (DecimalType) obj;
        return precision == that.precision && scale == that.scale;
    }

    @Override
    public int hashCode() {
        return Objects.hash(precision, scale);
    }

    @Override
    public String toString() {
        return typeName();
    }
}
