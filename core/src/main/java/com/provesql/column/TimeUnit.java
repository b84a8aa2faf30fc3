package com.provesql.column;

/**
 * Precision of a timestamp column. The unit doubles as the timestamp's scale
 * (number of fractional second digits).
 */
public enum TimeUnit {
    SECOND(0),
    MILLISECOND(3),
    MICROSECOND(6),
    NANOSECOND(9);

    private final int scale;

    TimeUnit(int scale) {
        this.scale = scale;
    }

    public int scale() {
        return scale;
    }
}
