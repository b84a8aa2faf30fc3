package com.provesql.types;

/**
 * Data type of a signed 16-bit integer.
 * Maps to column type SMALLINT.
 */
public final class ShortType implements DataType {

    private static final ShortType INSTANCE = new ShortType();

    private ShortType() {}

    public static ShortType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "smallint";
    }

    @Override
    public int defaultSize() {
        return 2;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof ShortType;
    }

    @Override
    public int hashCode() {
        return typeName().hashCode();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
