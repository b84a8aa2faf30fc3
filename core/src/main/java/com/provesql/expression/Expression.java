package com.provesql.expression;

import com.provesql.types.DataType;

/**
 * Base interface for the expressions of an upstream query plan.
 *
 * <p>Expressions arrive already name-resolved and type-annotated by the upstream
 * analyzer. They appear in:
 * <ul>
 *   <li>projection lists</li>
 *   <li>filter predicates</li>
 *   <li>GROUP BY keys and aggregate calls</li>
 *   <li>join conditions</li>
 * </ul>
 *
 * <p>{@link #toSQL()} is the canonical display name of an expression. Aggregate
 * output columns are named after it, so two structurally equal expressions
 * always render the same text.
 */
public interface Expression {

    /**
     * Returns the data type of the value produced by this expression.
     *
     * @return the data type, or null if the analyzer left it unresolved
     */
    DataType dataType();

    /**
     * Returns whether this expression can produce null values.
     *
     * @return true if nullable, false otherwise
     */
    boolean nullable();

    /**
     * Returns the SQL text of this expression, used as its display name.
     *
     * @return the SQL string representation
     */
    String toSQL();
}
