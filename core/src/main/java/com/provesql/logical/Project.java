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
 * Logical plan node representing a projection (SELECT clause).
 *
 * <p>The i-th output column is named by the i-th field of the schema.
 *
 * <p>Examples:
 * <pre>
 *   SELECT name, age FROM users
 *   SELECT a, SUM(b) AS total FROM t GROUP BY a
 * </pre>
 */
public final class Project extends LogicalPlan {

    private final List<Expression> projections;

    /**
     * Creates a projection node with an analyzer-supplied schema.
     *
     * @param child the child node
     * @param projections the projection expressions
     * @param schema the output schema
     */
    public Project(LogicalPlan child, List<Expression> projections, StructType schema) {
        super(child);
        this.projections = new ArrayList<>(Objects.requireNonNull(projections, "projections must not be null"));

        if (this.projections.isEmpty()) {
            throw new IllegalArgumentException("projections must not be empty");
        }
        this.schema = schema;
    }

    /**
     * Creates a projection node whose schema is derived from the expressions.
     *
     * @param child the child node
     * @param projections the projection expressions
     */
    public Project(LogicalPlan child, List<Expression> projections) {
        this(child, projections, null);
    }

    public List<Expression> projections() {
        return Collections.unmodifiableList(projections);
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public StructType inferSchema() {
        List<StructField> fields = new ArrayList<>();
        for (Expression expr : projections) {
            fields.add(new StructField(outputName(expr), expr.dataType(), expr.nullable()));
        }
        return new StructType(fields);
    }

    private static String outputName(Expression expr) {
        if (expr instanceof AliasExpression) {
            return ((AliasExpression) expr).alias();
        }
        if (expr instanceof ColumnReference) {
            return ((ColumnReference) expr).columnName();
        }
        return expr.toSQL();
    }

    @Override
    public String toString() {
        return String.format("Project(%s)", projections);
    }
}
