package com.provesql.types;

import com.provesql.column.TimeUnit;

import java.util.Objects;

/**
 * Data type representing a point in time, stored as a count of {@code unit}
 * since the Unix epoch (1970-01-01 00:00:00 UTC).
 *
 * <p>The time zone is kept as the analyzer reported it (e.g. "+00:00", "UTC");
 * a null zone means UTC.
 */
public final class TimestampType implements DataType {

    private final TimeUnit unit;
    private final String timeZone;

    /**
     * Creates a timestamp type.
     *
     * @param unit the time unit
     * @param timeZone the time zone text, or null for UTC
     */
    public TimestampType(TimeUnit unit, String timeZone) {
        this.unit = Objects.requireNonNull(unit, "unit must not be null");
        this.timeZone = timeZone;
    }

    /**
     * Creates a UTC timestamp type with the given unit.
     *
     * @param unit the time unit
     * @return the timestamp type
     */
    public static TimestampType utc(TimeUnit unit) {
        return new TimestampType(unit, null);
    }

    public TimeUnit unit() {
        return unit;
    }

    /**
     * Returns the time zone text.
     *
     * @return the time zone, or null for UTC
     */
    public String timeZone() {
        return timeZone;
    }

    @Override
    public String typeName() {
        return timeZone == null
            ? String.format("timestamp(%s)", unit)
            : String.format("timestamp(%s, %s)", unit, timeZone);
    }

    @Override
    public int defaultSize() {
        return 8;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TimestampType)) return false;
        TimestampType that = (TimestampType) obj;
        return unit == that.unit && Objects.equals(timeZone, that.timeZone);
    }

    @Override
    public int hashCode() {
        return Objects.hash(unit, timeZone);
    }

    @Override
    public String toString() {
        return typeName();
    }
}
