package com.provesql.logical;

import com.provesql.expression.AliasExpression;
import com.provesql.expression.ColumnReference;
import com.provesql.expression.Expression;
import com.provesql.types.StructField;
import com.provesql.types.StructType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing an aggregation (GROUP BY clause).
 *
 * <p>The output columns are the grouping expressions followed by the aggregate
 * expressions. Each output column is named after the display name of its
 * expression, e.g. {@code SUM(b)}, unless the analyzer supplied a schema.
 *
 * <p>Examples:
 * <pre>
 *   SELECT a, SUM(b), COUNT(*) FROM t GROUP BY a
 * </pre>
 */
public final class Aggregate extends LogicalPlan {

    private final List<Expression> groupingExpressions;
    private final List<Expression> aggregateExpressions;

    /**
     * Creates an aggregate node.
     *
     * @param child the child node
     * @param groupingExpressions the GROUP BY expressions (may be empty)
     * @param aggregateExpressions the aggregate function calls
     * @param schema the output schema (null to derive it from the expressions)
     */
    public Aggregate(LogicalPlan child,
                     List<Expression> groupingExpressions,
                     List<Expression> aggregateExpressions,
                     StructType schema) {
        super(child);
        this.groupingExpressions = new ArrayList<>(
            Objects.requireNonNull(groupingExpressions, "groupingExpressions must not be null"));
        this.aggregateExpressions = new ArrayList<>(
            Objects.requireNonNull(aggregateExpressions, "aggregateExpressions must not be null"));
        this.schema = schema;
    }

    public Aggregate(LogicalPlan child,
                     List<Expression> groupingExpressions,
                     List<Expression> aggregateExpressions) {
        this(child, groupingExpressions, aggregateExpressions, null);
    }

    public List<Expression> groupingExpressions() {
        return Collections.unmodifiableList(groupingExpressions);
    }

    public List<Expression> aggregateExpressions() {
        return Collections.unmodifiableList(aggregateExpressions);
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    /**
     * Returns the display name of an aggregate output expression: the alias
     * of an aliased expression, the name of a column, otherwise its SQL text.
     *
     * @param expr a grouping or aggregate expression
     * @return the display name
     */
    public static String displayName(Expression expr) {
        if (expr instanceof AliasExpression) {
            return ((AliasExpression) expr).alias();
        }
        if (expr instanceof ColumnReference) {
            return ((ColumnReference) expr).columnName();
        }
        return expr.toSQL();
    }

    @Override
    public StructType inferSchema() {
        List<StructField> fields = new ArrayList<>();
        for (Expression expr : groupingExpressions) {
            fields.add(new StructField(displayName(expr), expr.dataType(), expr.nullable()));
        }
        for (Expression expr : aggregateExpressions) {
            fields.add(new StructField(displayName(expr), expr.dataType(), expr.nullable()));
        }
        return new StructType(fields);
    }

    @Override
    public String toString() {
        return String.format("Aggregate(groupBy=%s, aggregates=%s)",
                             groupingExpressions, aggregateExpressions);
    }
}
