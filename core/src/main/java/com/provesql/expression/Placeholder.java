package com.provesql.expression;

import com.provesql.types.DataType;
import java.util.Objects;

/**
 * Expression representing a query parameter such as {@code $1}.
 *
 * <p>The analyzer may leave the type of a parameter unresolved; an enclosing
 * {@link CastExpression} then supplies it.
 */
public final class Placeholder implements Expression {

    private final String id;
    private final DataType dataType;

    /**
     * Creates a placeholder.
     *
     * @param id the placeholder text, e.g. "$1"
     * @param dataType the declared type, or null if untyped
     */
    public Placeholder(String id, DataType dataType) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.dataType = dataType;
    }

    public String id() {
        return id;
    }

    /**
     * Returns the declared type.
     *
     * @return the data type, or null if untyped
     */
    @Override
    public DataType dataType() {
        return dataType;
    }

    public boolean isTyped() {
        return dataType != null;
    }

    /**
     * Returns a copy of this placeholder with the given type.
     *
     * @param type the type to bind
     * @return the typed placeholder
     */
    public Placeholder withType(DataType type) {
        return new Placeholder(id, Objects.requireNonNull(type, "type must not be null"));
    }

    @Override
    public boolean nullable() {
        return false;
    }

    @Override
    public String toSQL() {
        return id;
    }

    @Override
    public String toString() {
        return dataType == null ? id : id + ":" + dataType;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Placeholder)) return false;
        Placeholder that = (Placeholder) obj;
        return Objects.equals(id, that.id) &&
               Objects.equals(dataType, that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, dataType);
    }
}
