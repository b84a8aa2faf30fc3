package com.provesql.compiler;

import com.provesql.column.ColumnField;
import com.provesql.column.ColumnType;
import com.provesql.column.LiteralValue;
import com.provesql.column.TableRef;
import com.provesql.exception.PlannerException;
import com.provesql.expression.AggregateFunction;
import com.provesql.expression.AliasExpression;
import com.provesql.expression.ColumnReference;
import com.provesql.expression.Expression;
import com.provesql.expression.StarExpression;
import com.provesql.logical.Aggregate;
import com.provesql.logical.LogicalPlan;
import com.provesql.logical.Project;
import com.provesql.logical.TableScan;
import com.provesql.provable.expr.AliasedProvableExpr;
import com.provesql.provable.expr.ColumnExpr;
import com.provesql.provable.expr.LiteralExpr;
import com.provesql.provable.expr.ProvableExpression;
import com.provesql.provable.plan.GroupByExec;
import com.provesql.types.StructType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Compiles an aggregation over a table scan into a {@link GroupByExec}.
 *
 * <p>The aggregate list must be zero or more {@code SUM}s followed by exactly
 * one {@code COUNT}. Grouping keys must be bare columns. Output names of the
 * aggregates come from an alias map keyed by each aggregate's display name
 * (see {@link Aggregate#displayName(Expression)}).
 */
public class AggregateCompiler {

    private static final Logger logger = LoggerFactory.getLogger(AggregateCompiler.class);

    /**
     * Aggregate functions the proof system can evaluate.
     */
    public enum AggregateKind {
        SUM,
        COUNT
    }

    /**
     * A compiled aggregate argument.
     *
     * @param kind the aggregate function
     * @param expr the compiled argument
     */
    public record CompiledAggregate(AggregateKind kind, ProvableExpression expr) {
    }

    private final ExpressionCompiler expressionCompiler;

    public AggregateCompiler(ExpressionCompiler expressionCompiler) {
        this.expressionCompiler = Objects.requireNonNull(expressionCompiler, "expressionCompiler must not be null");
    }

    /**
     * Compiles an aggregation.
     *
     * @param aggregate the aggregation
     * @param aliases output name of each aggregate, keyed by display name
     * @param schemaAccessor the table schemas
     * @return the group-by plan
     * @throws PlannerException {@code UNSUPPORTED_LOGICAL_PLAN} if the aggregation
     *         does not have the supported shape
     */
    public GroupByExec compile(Aggregate aggregate, Map<String, String> aliases, SchemaAccessor schemaAccessor) {
        LogicalPlan input = aggregate.child();
        if (!(input instanceof TableScan) || ((TableScan) input).fetch() != null) {
            throw PlannerException.unsupportedLogicalPlan(aggregate);
        }
        TableScan scan = (TableScan) input;
        TableRef table = scan.tableName();
        List<ColumnField> schema = schemaAccessor.lookupSchema(table);
        logger.debug("Compiling aggregate over {}", table);

        List<ColumnExpr> groupBy = new ArrayList<>();
        for (Expression expr : aggregate.groupingExpressions()) {
            if (!(expr instanceof ColumnReference)) {
                throw PlannerException.unsupportedLogicalPlan(aggregate);
            }
            groupBy.add((ColumnExpr) expressionCompiler.compile(expr, schema, table));
        }

        List<Expression> aggregates = aggregate.aggregateExpressions();
        if (aggregates.isEmpty()) {
            throw PlannerException.unsupportedLogicalPlan(aggregate);
        }

        List<AliasedProvableExpr> sums = new ArrayList<>();
        String countAlias = null;
        for (int i = 0; i < aggregates.size(); i++) {
            Expression expr = aggregates.get(i);
            String alias = aliases.get(Aggregate.displayName(expr));
            if (alias == null) {
                throw PlannerException.unsupportedLogicalPlan(aggregate);
            }
            Expression unaliased = expr instanceof AliasExpression ? ((AliasExpression) expr).expression() : expr;
            if (!(unaliased instanceof AggregateFunction)) {
                throw PlannerException.unsupportedLogicalPlan(aggregate);
            }

            CompiledAggregate compiled = compileFunction((AggregateFunction) unaliased, schema, table);
            boolean last = i == aggregates.size() - 1;
            if (last && compiled.kind() == AggregateKind.COUNT) {
                countAlias = alias;
            } else if (!last && compiled.kind() == AggregateKind.SUM) {
                sums.add(new AliasedProvableExpr(compiled.expr(), alias));
            } else {
                throw PlannerException.unsupportedLogicalPlan(aggregate);
            }
        }

        ProvableExpression where = PlanCompiler.foldFilters(
            expressionCompiler, scan.filters(), schema, table);
        return GroupByExec.tryNew(groupBy, sums, countAlias, table, where);
    }

    /**
     * Compiles the argument of a {@code SUM} or {@code COUNT} call.
     *
     * @param function the aggregate call
     * @param schema the visible columns
     * @param table the table of unqualified columns
     * @return the function kind and its compiled argument; {@code COUNT(*)}
     *         compiles to the BIGINT literal 1
     * @throws PlannerException {@code UNSUPPORTED_AGGREGATE_FUNCTION} for any other
     *         function, DISTINCT, or an argument count other than one
     */
    public CompiledAggregate compileFunction(AggregateFunction function, List<ColumnField> schema, TableRef table) {
        if (function.isDistinct() || function.arguments().size() != 1) {
            throw PlannerException.unsupportedAggregateFunction(function);
        }

        AggregateKind kind;
        switch (function.function().toUpperCase(Locale.ROOT)) {
            case "SUM":
                kind = AggregateKind.SUM;
                break;
            case "COUNT":
                kind = AggregateKind.COUNT;
                break;
            default:
                throw PlannerException.unsupportedAggregateFunction(function);
        }

        Expression argument = function.arguments().get(0);
        if (argument instanceof StarExpression) {
            return new CompiledAggregate(kind, new LiteralExpr(new LiteralValue.BigIntValue(1L)));
        }
        return new CompiledAggregate(kind, expressionCompiler.compile(argument, schema, table));
    }

    // ==================== Alias Maps ====================

    /**
     * Builds the alias map of an aggregation that is not under a projection:
     * every grouping and aggregate expression keeps the name of its own output column.
     *
     * @param aggregate the aggregation
     * @return display name to output name
     */
    public static Map<String, String> aliasesOf(Aggregate aggregate) {
        List<Expression> outputs = new ArrayList<>(aggregate.groupingExpressions());
        outputs.addAll(aggregate.aggregateExpressions());
        StructType schema = aggregate.schema();

        Map<String, String> aliases = new LinkedHashMap<>();
        for (int i = 0; i < outputs.size() && i < schema.size(); i++) {
            aliases.put(Aggregate.displayName(outputs.get(i)), schema.fieldAt(i).name());
        }
        return aliases;
    }

    /**
     * Builds the alias map of a projection over an aggregation. Every projected
     * expression must be a column of the aggregation's output or an alias of one.
     *
     * @param project the projection
     * @return aggregation output name to projected name
     * @throws PlannerException {@code UNSUPPORTED_LOGICAL_PLAN} for any other projected expression
     */
    public static Map<String, String> aliasesOf(Project project) {
        Map<String, String> aliases = new LinkedHashMap<>();
        for (Expression expr : project.projections()) {
            if (expr instanceof ColumnReference) {
                String name = ((ColumnReference) expr).columnName();
                aliases.put(name, name);
            } else if (expr instanceof AliasExpression
                       && ((AliasExpression) expr).expression() instanceof ColumnReference) {
                AliasExpression alias = (AliasExpression) expr;
                aliases.put(((ColumnReference) alias.expression()).columnName(), alias.alias());
            } else {
                throw PlannerException.unsupportedLogicalPlan(project);
            }
        }
        return aliases;
    }
}
