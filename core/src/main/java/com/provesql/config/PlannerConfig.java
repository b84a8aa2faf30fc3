package com.provesql.config;

/**
 * Limits of the downstream proof system that the planner enforces.
 */
public final class PlannerConfig {

    private PlannerConfig() {} // Utility class

    /** Largest decimal precision a column can carry */
    public static final int MAX_DECIMAL_PRECISION = 75;

    /** Largest decimal precision an inequality can compare (bit decomposition limit) */
    public static final int MAX_INEQUALITY_PRECISION = 38;

    /** Smallest scale of a division result */
    public static final int MIN_DIVISION_SCALE = 6;

    /** Decimal scale is a signed 8-bit value */
    public static final int MIN_SCALE = Byte.MIN_VALUE;

    public static final int MAX_SCALE = Byte.MAX_VALUE;

    /** Prefix of positional query parameters, e.g. {@code $1} */
    public static final String PLACEHOLDER_PREFIX = "$";

    /**
     * Returns true if the scale fits the signed 8-bit scale range.
     *
     * @param scale the scale to check
     * @return true if {@code MIN_SCALE <= scale <= MAX_SCALE}
     */
    public static boolean isValidScale(int scale) {
        return scale >= MIN_SCALE && scale <= MAX_SCALE;
    }

    /**
     * Returns true if the precision is within [1, MAX_DECIMAL_PRECISION].
     *
     * @param precision the precision to check
     * @return true if valid
     */
    public static boolean isValidPrecision(int precision) {
        return precision >= 1 && precision <= MAX_DECIMAL_PRECISION;
    }
}
