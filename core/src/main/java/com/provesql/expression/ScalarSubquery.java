package com.provesql.expression;

import com.provesql.logical.LogicalPlan;
import com.provesql.types.DataType;

import java.util.Objects;

/**
 * Scalar subquery expression that returns a single value.
 *
 * <p>Examples:
 * <pre>
 *   WHERE amount > (SELECT AVG(amount) FROM transactions)
 * </pre>
 *
 * <p>Subqueries have no provable counterpart.
 */
public final class ScalarSubquery implements Expression {

    private final LogicalPlan subquery;

    /**
     * Creates a scalar subquery.
     *
     * @param subquery the subquery that returns a single value
     */
    public ScalarSubquery(LogicalPlan subquery) {
        this.subquery = Objects.requireNonNull(subquery, "subquery must not be null");
    }

    public LogicalPlan subquery() {
        return subquery;
    }

    @Override
    public DataType dataType() {
        if (!subquery.schema().fields().isEmpty()) {
            return subquery.schema().fields().get(0).dataType();
        }
        return null;
    }

    @Override
    public boolean nullable() {
        return true;
    }

    @Override
    public String toSQL() {
        return "(" + subquery + ")";
    }

    @Override
    public String toString() {
        return String.format("ScalarSubquery(%s)", subquery);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ScalarSubquery)) return false;
        return subquery.equals(((ScalarSubquery) obj).subquery);
    }

    @Override
    public int hashCode() {
        return subquery.hashCode();
    }
}
