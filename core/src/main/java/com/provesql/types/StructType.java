package com.provesql.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Represents a struct type (row schema) with named fields.
 *
 * <p>Every upstream plan node is annotated with one; field order is the order
 * of the node's output columns.
 */
public final class StructType implements DataType {

    /** Empty struct type with no fields. */
    public static final StructType EMPTY = new StructType(Collections.emptyList());

    private final List<StructField> fields;

    /**
     * Creates a StructType with the given fields.
     *
     * @param fields the fields in this struct
     */
    public StructType(List<StructField> fields) {
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    /**
     * Creates a StructType with the given fields.
     *
     * @param fields the fields in this struct
     */
    public StructType(StructField... fields) {
        this(List.of(fields));
    }

    /**
     * Returns the fields in this struct.
     *
     * @return an unmodifiable list of fields
     */
    public List<StructField> fields() {
        return fields;
    }

    public int size() {
        return fields.size();
    }

    /**
     * Returns the field at the given index.
     *
     * @param index the field index
     * @return the field
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public StructField fieldAt(int index) {
        return fields.get(index);
    }

    @Override
    public String typeName() {
        return "struct";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StructType)) return false;
        StructType that = (StructType) o;
        return Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "StructType(" + fields + ")";
    }
}
