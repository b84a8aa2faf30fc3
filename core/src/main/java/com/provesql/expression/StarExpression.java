package com.provesql.expression;

import com.provesql.types.DataType;
import com.provesql.types.StructType;
import java.util.Objects;

/**
 * Expression representing a star (*), as in {@code COUNT(*)} or {@code SELECT t.*}.
 */
public final class StarExpression implements Expression {

    private final String qualifier;

    /**
     * Creates an unqualified star expression (*).
     */
    public StarExpression() {
        this.qualifier = null;
    }

    /**
     * Creates a qualified star expression (table.*).
     *
     * @param qualifier the table name or alias
     */
    public StarExpression(String qualifier) {
        this.qualifier = qualifier;
    }

    public String qualifier() {
        return qualifier;
    }

    @Override
    public DataType dataType() {
        // stands for several columns, not one value
        return StructType.EMPTY;
    }

    @Override
    public boolean nullable() {
        return true;
    }

    @Override
    public String toSQL() {
        return qualifier != null ? qualifier + ".*" : "*";
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof StarExpression)) return false;
        StarExpression that = (StarExpression) obj;
        return Objects.equals(qualifier, that.qualifier);
    }

    @Override
    public int hashCode() {
        return Objects.hash(qualifier);
    }
}
