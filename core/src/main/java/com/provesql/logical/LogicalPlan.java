package com.provesql.logical;

import com.provesql.types.StructType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class for all nodes of an upstream relational plan.
 *
 * <p>Each node has zero or more children and an output schema (ordered, named,
 * typed columns). Plans arrive name-resolved and schema-annotated from the
 * upstream analyzer; nodes that the analyzer annotates take their schema as a
 * constructor argument, the others infer it from their children.
 *
 * @see com.provesql.compiler.PlanCompiler
 */
public abstract class LogicalPlan {

    /** Child nodes in the plan tree */
    protected final List<LogicalPlan> children;

    /** Output schema of this node */
    protected StructType schema;

    /**
     * Creates a logical plan node with no children.
     */
    protected LogicalPlan() {
        this.children = Collections.emptyList();
    }

    /**
     * Creates a logical plan node with a single child.
     *
     * @param child the child node
     */
    protected LogicalPlan(LogicalPlan child) {
        this.children = Collections.singletonList(child);
    }

    /**
     * Creates a logical plan node with multiple children.
     *
     * @param children the child nodes
     */
    protected LogicalPlan(List<LogicalPlan> children) {
        this.children = new ArrayList<>(children);
    }

    /**
     * Infers the output schema for this logical plan node.
     *
     * @return the output schema
     */
    public abstract StructType inferSchema();

    /**
     * Returns the child nodes of this plan.
     *
     * @return an unmodifiable list of children
     */
    public List<LogicalPlan> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Returns the output schema of this plan node.
     *
     * <p>If the schema hasn't been computed yet, this calls {@link #inferSchema()}
     * to compute it.
     *
     * @return the output schema
     */
    public StructType schema() {
        if (schema == null) {
            schema = inferSchema();
        }
        return schema;
    }

    /**
     * Returns a human-readable string representation of this plan node.
     *
     * @return a string representation
     */
    @Override
    public abstract String toString();
}
