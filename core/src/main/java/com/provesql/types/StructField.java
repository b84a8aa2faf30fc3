package com.provesql.types;

import java.util.Objects;

/**
 * Represents a field in a StructType.
 *
 * <p>Each field has a name, data type, and nullability flag. Provable columns
 * never hold NULLs; the flag is carried only as the analyzer reported it.
 */
public record StructField(String name, DataType dataType, boolean nullable) {

    public StructField {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(dataType, "dataType must not be null");
    }

    /**
     * Creates a non-nullable struct field.
     *
     * @param name the field name
     * @param dataType the field data type
     */
    public StructField(String name, DataType dataType) {
        this(name, dataType, false);
    }

    @Override
    public String toString() {
        return name + ": " + dataType + (nullable ? "" : " NOT NULL");
    }
}
