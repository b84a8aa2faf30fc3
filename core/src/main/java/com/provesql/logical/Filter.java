package com.provesql.logical;

import com.provesql.expression.Expression;
import com.provesql.types.StructType;
import java.util.Objects;

/**
 * Logical plan node representing a filter (WHERE clause) that was not pushed
 * into a table scan.
 */
public final class Filter extends LogicalPlan {

    private final Expression condition;

    /**
     * Creates a filter node.
     *
     * @param child the child node
     * @param condition the filter condition
     */
    public Filter(LogicalPlan child, Expression condition) {
        super(child);
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
    }

    public Expression condition() {
        return condition;
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public StructType inferSchema() {
        return child().schema();
    }

    @Override
    public String toString() {
        return String.format("Filter(%s)", condition);
    }
}
