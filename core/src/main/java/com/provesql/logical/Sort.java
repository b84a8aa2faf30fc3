package com.provesql.logical;

import com.provesql.expression.Expression;
import com.provesql.types.StructType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing ORDER BY.
 *
 * <p>Ordering has no provable counterpart; the node exists so that queries
 * using it are rejected with a precise error.
 */
public final class Sort extends LogicalPlan {

    private final List<SortOrder> sortOrders;

    /**
     * Creates a sort node.
     *
     * @param child the child node
     * @param sortOrders the sort keys
     */
    public Sort(LogicalPlan child, List<SortOrder> sortOrders) {
        super(child);
        this.sortOrders = new ArrayList<>(Objects.requireNonNull(sortOrders, "sortOrders must not be null"));
        if (this.sortOrders.isEmpty()) {
            throw new IllegalArgumentException("sortOrders must not be empty");
        }
    }

    public List<SortOrder> sortOrders() {
        return Collections.unmodifiableList(sortOrders);
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
        return String.format("Sort(%s)", sortOrders);
    }

    /**
     * One sort key.
     */
    public record SortOrder(Expression expression, boolean ascending) {
        public SortOrder {
            Objects.requireNonNull(expression, "expression must not be null");
        }

        @Override
        public String toString() {
            return expression.toSQL() + (ascending ? " ASC" : " DESC");
        }
    }
}
