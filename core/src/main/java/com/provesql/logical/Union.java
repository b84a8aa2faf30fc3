package com.provesql.logical;

import com.provesql.types.StructType;

import java.util.List;

/**
 * Logical plan node representing UNION ALL over two or more inputs.
 *
 * <p>All inputs share the unified output schema; rows are not de-duplicated.
 */
public final class Union extends LogicalPlan {

    /**
     * Creates a union node.
     *
     * @param inputs the inputs (at least two)
     * @param schema the unified output schema (null to take the first input's)
     */
    public Union(List<LogicalPlan> inputs, StructType schema) {
        super(inputs);
        if (inputs.size() < 2) {
            throw new IllegalArgumentException("union requires at least two inputs, got: " + inputs.size());
        }
        this.schema = schema;
    }

    public Union(List<LogicalPlan> inputs) {
        this(inputs, null);
    }

    public List<LogicalPlan> inputs() {
        return children();
    }

    @Override
    public StructType inferSchema() {
        return children.get(0).schema();
    }

    @Override
    public String toString() {
        return String.format("Union(%d inputs)", children.size());
    }
}
