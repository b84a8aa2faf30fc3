package com.provesql.compiler;

import com.provesql.column.ColumnField;
import com.provesql.column.ColumnRef;
import com.provesql.column.LiteralValue;
import com.provesql.column.TableRef;
import com.provesql.exception.PlannerException;
import com.provesql.expression.ColumnReference;
import com.provesql.expression.Expression;
import com.provesql.logical.Aggregate;
import com.provesql.logical.EmptyRelation;
import com.provesql.logical.Join;
import com.provesql.logical.Limit;
import com.provesql.logical.LogicalPlan;
import com.provesql.logical.Project;
import com.provesql.logical.TableScan;
import com.provesql.logical.Union;
import com.provesql.provable.expr.AliasedProvableExpr;
import com.provesql.provable.expr.AndExpr;
import com.provesql.provable.expr.ColumnExpr;
import com.provesql.provable.expr.LiteralExpr;
import com.provesql.provable.expr.ProvableExpression;
import com.provesql.provable.plan.EmptyExec;
import com.provesql.provable.plan.FilterExec;
import com.provesql.provable.plan.ProjectionExec;
import com.provesql.provable.plan.ProvablePlan;
import com.provesql.provable.plan.SliceExec;
import com.provesql.provable.plan.SortMergeJoinExec;
import com.provesql.provable.plan.TableExec;
import com.provesql.provable.plan.UnionExec;
import com.provesql.types.StructType;
import com.provesql.types.TypeMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Compiles logical plans into provable plans.
 *
 * <p>Each node is matched against a small set of supported shapes; the first
 * node that matches none of them fails the whole compilation.
 *
 * <table>
 *   <caption>Supported shapes</caption>
 *   <tr><th>Logical plan</th><th>Provable plan</th></tr>
 *   <tr><td>EmptyRelation</td><td>Empty</td></tr>
 *   <tr><td>TableScan</td><td>Projection(Table), or Filter when the scan has filters;
 *       wrapped in Slice when the scan has a row limit</td></tr>
 *   <tr><td>Aggregate over a TableScan, optionally under a renaming Project</td><td>GroupBy</td></tr>
 *   <tr><td>Project</td><td>Projection</td></tr>
 *   <tr><td>Limit</td><td>Slice</td></tr>
 *   <tr><td>Union</td><td>Union</td></tr>
 *   <tr><td>inner equi-Join</td><td>SortMergeJoin</td></tr>
 * </table>
 *
 * <p>Compilation is a pure function of the plan and the schemas returned by
 * the {@link SchemaAccessor}.
 *
 * <p>Example usage:
 * <pre>
 *   PlanCompiler compiler = new PlanCompiler(schemaAccessor);
 *   ProvablePlan plan = compiler.compile(logicalPlan);
 * </pre>
 */
public class PlanCompiler {

    private static final Logger logger = LoggerFactory.getLogger(PlanCompiler.class);

    private final SchemaAccessor schemaAccessor;
    private final ExpressionCompiler expressionCompiler;
    private final AggregateCompiler aggregateCompiler;

    public PlanCompiler(SchemaAccessor schemaAccessor) {
        this(schemaAccessor, new ExpressionCompiler());
    }

    public PlanCompiler(SchemaAccessor schemaAccessor, ExpressionCompiler expressionCompiler) {
        this.schemaAccessor = Objects.requireNonNull(schemaAccessor, "schemaAccessor must not be null");
        this.expressionCompiler = Objects.requireNonNull(expressionCompiler, "expressionCompiler must not be null");
        this.aggregateCompiler = new AggregateCompiler(expressionCompiler);
    }

    /**
     * Compiles a logical plan.
     *
     * @param plan the logical plan
     * @return the provable plan
     * @throws PlannerException if the plan falls outside the provable subset
     * @throws com.provesql.exception.ColumnOperationException if an expression
     *         combines incompatible column types
     */
    public ProvablePlan compile(LogicalPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");
        logger.debug("Compiling {}", plan);

        if (plan instanceof EmptyRelation) {
            return new EmptyExec();
        } else if (plan instanceof TableScan) {
            return compileTableScan((TableScan) plan);
        } else if (plan instanceof Aggregate) {
            Aggregate aggregate = (Aggregate) plan;
            return aggregateCompiler.compile(aggregate, AggregateCompiler.aliasesOf(aggregate), schemaAccessor);
        } else if (plan instanceof Project) {
            Project project = (Project) plan;
            if (project.child() instanceof Aggregate) {
                return aggregateCompiler.compile((Aggregate) project.child(),
                    AggregateCompiler.aliasesOf(project), schemaAccessor);
            }
            return compileProjection(project);
        } else if (plan instanceof Limit) {
            Limit limit = (Limit) plan;
            return new SliceExec(compile(limit.child()), limit.skip(), toOptional(limit.fetch()));
        } else if (plan instanceof Union) {
            return compileUnion((Union) plan);
        } else if (plan instanceof Join) {
            return compileJoin((Join) plan);
        }
        throw PlannerException.unsupportedLogicalPlan(plan);
    }

    // ==================== Table Scans ====================

    private ProvablePlan compileTableScan(TableScan scan) {
        if (scan.projection() == null) {
            throw PlannerException.unsupportedLogicalPlan(scan);
        }
        TableRef table = scan.tableName();
        List<ColumnField> schema = schemaAccessor.lookupSchema(table);
        List<AliasedProvableExpr> projected = projectedColumns(scan, schema);

        ProvablePlan result;
        if (scan.filters().isEmpty()) {
            result = new ProjectionExec(projected, new TableExec(table, schema));
        } else {
            ProvableExpression where = foldFilters(expressionCompiler, scan.filters(), schema, table);
            result = FilterExec.tryNew(projected, table, where);
        }

        if (scan.fetch() != null) {
            result = new SliceExec(result, 0, OptionalLong.of(scan.fetch()));
        }
        return result;
    }

    private static List<AliasedProvableExpr> projectedColumns(TableScan scan, List<ColumnField> schema) {
        StructType projectedSchema = scan.schema();
        List<Integer> projection = scan.projection();

        List<AliasedProvableExpr> projected = new ArrayList<>(projection.size());
        for (int i = 0; i < projection.size(); i++) {
            int index = projection.get(i);
            if (index < 0 || index >= schema.size() || i >= projectedSchema.size()) {
                throw PlannerException.columnNotFound(scan.tableName() + "[" + index + "]");
            }
            ColumnField source = schema.get(index);
            ColumnExpr column = new ColumnExpr(new ColumnRef(scan.tableName(), source.name(), source.dataType()));
            projected.add(new AliasedProvableExpr(column, projectedSchema.fieldAt(i).name()));
        }
        return projected;
    }

    /**
     * Compiles scan filters and folds them with AND.
     *
     * @param compiler the expression compiler
     * @param filters the filters, implicitly ANDed
     * @param schema the table columns
     * @param table the filtered table
     * @return the folded predicate, or the literal TRUE if there are no filters
     */
    static ProvableExpression foldFilters(ExpressionCompiler compiler, List<Expression> filters,
                                          List<ColumnField> schema, TableRef table) {
        ProvableExpression where = null;
        for (Expression filter : filters) {
            ProvableExpression compiled = compiler.compile(filter, schema, table);
            where = where == null ? compiled : AndExpr.tryNew(where, compiled);
        }
        return where != null ? where : new LiteralExpr(new LiteralValue.BooleanValue(true));
    }

    // ==================== Projections and Unions ====================

    private ProvablePlan compileProjection(Project project) {
        ProvablePlan input = compile(project.child());
        List<ColumnField> inputSchema = input.getColumnResultFields();
        Set<TableRef> tables = input.getTableReferences();
        TableRef table = tables.size() == 1 ? tables.iterator().next() : null;

        StructType outputSchema = project.schema();
        List<Expression> projections = project.projections();
        List<AliasedProvableExpr> aliased = new ArrayList<>(projections.size());
        for (int i = 0; i < projections.size(); i++) {
            ProvableExpression expr = expressionCompiler.compile(projections.get(i), inputSchema, table);
            aliased.add(new AliasedProvableExpr(expr, outputSchema.fieldAt(i).name()));
        }
        return new ProjectionExec(aliased, input);
    }

    private ProvablePlan compileUnion(Union union) {
        List<ProvablePlan> inputs = new ArrayList<>();
        for (LogicalPlan input : union.inputs()) {
            inputs.add(compile(input));
        }
        return new UnionExec(inputs, TypeMapper.toColumnFields(union.schema()));
    }

    // ==================== Joins ====================

    private ProvablePlan compileJoin(Join join) {
        if (join.joinType() != Join.JoinType.INNER
                || join.joinConstraint() != Join.JoinConstraint.ON
                || join.on().isEmpty()
                || join.filter() != null) {
            throw PlannerException.unsupportedLogicalPlan(join);
        }

        ProvablePlan left = compile(join.left());
        ProvablePlan right = compile(join.right());
        List<String> leftNames = names(left);
        List<String> rightNames = names(right);

        List<Integer> leftKeys = new ArrayList<>();
        List<Integer> rightKeys = new ArrayList<>();
        List<String> keyNames = new ArrayList<>();
        for (Join.EquiPair pair : join.on()) {
            String name = sharedColumnName(pair);
            if (name == null) {
                logger.warn("Dropping join key {} = {}: both sides must be columns of the same name",
                    pair.left().toSQL(), pair.right().toSQL());
                continue;
            }
            int leftIndex = leftNames.indexOf(name);
            int rightIndex = rightNames.indexOf(name);
            if (leftIndex < 0 || rightIndex < 0) {
                logger.warn("Dropping join key {}: column is not an output of both sides", name);
                continue;
            }
            leftKeys.add(leftIndex);
            rightKeys.add(rightIndex);
            keyNames.add(name);
        }

        List<String> resultNames = new ArrayList<>(keyNames);
        for (int i = 0; i < leftNames.size(); i++) {
            if (!leftKeys.contains(i)) {
                resultNames.add(leftNames.get(i));
            }
        }
        for (int i = 0; i < rightNames.size(); i++) {
            if (!rightKeys.contains(i)) {
                resultNames.add(rightNames.get(i));
            }
        }
        return new SortMergeJoinExec(left, right, leftKeys, rightKeys, resultNames);
    }

    private static String sharedColumnName(Join.EquiPair pair) {
        if (!(pair.left() instanceof ColumnReference) || !(pair.right() instanceof ColumnReference)) {
            return null;
        }
        String leftName = ((ColumnReference) pair.left()).columnName();
        String rightName = ((ColumnReference) pair.right()).columnName();
        return leftName.equals(rightName) ? leftName : null;
    }

    private static List<String> names(ProvablePlan plan) {
        List<String> names = new ArrayList<>();
        for (ColumnField field : plan.getColumnResultFields()) {
            names.add(field.name());
        }
        return names;
    }

    private static OptionalLong toOptional(Long fetch) {
        return fetch == null ? OptionalLong.empty() : OptionalLong.of(fetch);
    }
}
