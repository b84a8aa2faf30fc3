package com.provesql.logical;

import com.provesql.expression.Expression;
import com.provesql.types.StructField;
import com.provesql.types.StructType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing a join of two relations.
 *
 * <p>The analyzer splits the join condition into equality pairs ({@code on})
 * and an optional residual {@code filter}. The constraint records whether the
 * condition was written as {@code ON} or {@code USING}.
 *
 * <p>Examples:
 * <pre>
 *   SELECT * FROM a INNER JOIN b ON a.id = b.id
 *   SELECT * FROM a JOIN b USING (id)
 * </pre>
 */
public final class Join extends LogicalPlan {

    private final LogicalPlan left;
    private final LogicalPlan right;
    private final JoinType joinType;
    private final JoinConstraint joinConstraint;
    private final List<EquiPair> on;
    private final Expression filter;

    /**
     * Creates a join node.
     *
     * @param left the left input
     * @param right the right input
     * @param joinType the join type
     * @param joinConstraint ON or USING
     * @param on the equality pairs (left expression, right expression)
     * @param filter the residual join filter (may be null)
     * @param schema the output schema (null to concatenate both inputs' schemas)
     */
    public Join(LogicalPlan left, LogicalPlan right, JoinType joinType, JoinConstraint joinConstraint,
                List<EquiPair> on, Expression filter, StructType schema) {
        super(Arrays.asList(left, right));
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
        this.joinType = Objects.requireNonNull(joinType, "joinType must not be null");
        this.joinConstraint = Objects.requireNonNull(joinConstraint, "joinConstraint must not be null");
        this.on = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(on, "on must not be null")));
        this.filter = filter;
        this.schema = schema;
    }

    public Join(LogicalPlan left, LogicalPlan right, JoinType joinType, List<EquiPair> on) {
        this(left, right, joinType, JoinConstraint.ON, on, null, null);
    }

    public LogicalPlan left() {
        return left;
    }

    public LogicalPlan right() {
        return right;
    }

    public JoinType joinType() {
        return joinType;
    }

    public JoinConstraint joinConstraint() {
        return joinConstraint;
    }

    public List<EquiPair> on() {
        return on;
    }

    /**
     * Returns the residual join filter.
     *
     * @return the filter, or null if the condition is purely equalities
     */
    public Expression filter() {
        return filter;
    }

    @Override
    public StructType inferSchema() {
        List<StructField> fields = new ArrayList<>(left.schema().fields());
        fields.addAll(right.schema().fields());
        return new StructType(fields);
    }

    @Override
    public String toString() {
        return String.format("Join(type=%s, constraint=%s, on=%s)", joinType, joinConstraint, on);
    }

    /**
     * One equality of an equi-join condition.
     */
    public record EquiPair(Expression left, Expression right) {
        public EquiPair {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    /**
     * Join types.
     */
    public enum JoinType {
        INNER,
        LEFT,
        RIGHT,
        FULL,
        CROSS,
        LEFT_SEMI,
        LEFT_ANTI
    }

    /**
     * How the join condition was written.
     */
    public enum JoinConstraint {
        ON,
        USING
    }
}
