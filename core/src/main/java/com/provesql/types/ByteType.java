package com.provesql.types;

/**
 * Data type of a signed 8-bit integer (-128 to 127).
 * Maps to column type TINYINT.
 */
public final class ByteType implements DataType {

    private static final ByteType INSTANCE = new ByteType();

    private ByteType() {}

    public static ByteType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "tinyint";
    }

    @Override
    public int defaultSize() {
        return 1;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof ByteType;
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
