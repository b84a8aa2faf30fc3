package com.provesql.column;

import java.util.Objects;

/**
 * A named, typed column of a result set or table schema.
 *
 * @param name the column name
 * @param dataType the column type
 */
public record ColumnField(String name, ColumnType dataType) {

    public ColumnField {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(dataType, "dataType must not be null");
    }

    @Override
    public String toString() {
        return name + ": " + dataType;
    }
}
