package com.provesql.types;

/**
 * Data type of an unsigned 8-bit integer (0 to 255).
 * Maps to column type UINT8.
 */
public final class UnsignedByteType implements DataType {

    private static final UnsignedByteType INSTANCE = new UnsignedByteType();

    private UnsignedByteType() {}

    public static UnsignedByteType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "tinyint unsigned";
    }

    @Override
    public int defaultSize() {
        return 1;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof UnsignedByteType;
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
