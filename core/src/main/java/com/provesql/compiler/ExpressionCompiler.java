package com.provesql.compiler;

import com.provesql.column.ColumnField;
import com.provesql.column.ColumnRef;
import com.provesql.column.ColumnType;
import com.provesql.column.TableRef;
import com.provesql.exception.AnalyzeException;
import com.provesql.exception.ColumnOperationException;
import com.provesql.exception.PlannerException;
import com.provesql.expression.AliasExpression;
import com.provesql.expression.BinaryExpression;
import com.provesql.expression.CastExpression;
import com.provesql.expression.ColumnReference;
import com.provesql.expression.Expression;
import com.provesql.expression.Literal;
import com.provesql.expression.Placeholder;
import com.provesql.expression.UnaryExpression;
import com.provesql.provable.expr.AddSubtractExpr;
import com.provesql.provable.expr.AndExpr;
import com.provesql.provable.expr.CastExpr;
import com.provesql.provable.expr.ColumnExpr;
import com.provesql.provable.expr.EqualsExpr;
import com.provesql.provable.expr.InequalityExpr;
import com.provesql.provable.expr.LiteralExpr;
import com.provesql.provable.expr.MultiplyExpr;
import com.provesql.provable.expr.NegExpr;
import com.provesql.provable.expr.NotExpr;
import com.provesql.provable.expr.OrExpr;
import com.provesql.provable.expr.ProvableExpression;
import com.provesql.provable.expr.ScalingCastExpr;
import com.provesql.types.TypeMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Compiles source expressions into provable expressions.
 *
 * <p>Every expression is compiled against the ordered column list visible at
 * its position in the plan. Columns resolve by name; a qualified column takes
 * its table from the qualifier, an unqualified one from the table the caller
 * supplies.
 *
 * <p>Supported expressions:
 * <ul>
 *   <li>columns, literals and placeholders</li>
 *   <li>aliases (the alias itself is dropped)</li>
 *   <li>casts, falling back to a scaling cast when a plain cast is not legal</li>
 *   <li>NOT and unary minus</li>
 *   <li>+ - * = != &lt; &gt; &lt;= &gt;= AND OR</li>
 * </ul>
 *
 * <p>Comparisons and additions whose numeric operands differ in scale get a
 * scaling cast on the lower-scale side (see {@link ScaleAlignment}).
 *
 * <p>Instances hold no mutable state and can be shared.
 */
public class ExpressionCompiler {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionCompiler.class);

    private final PlaceholderTranslator placeholderTranslator;

    public ExpressionCompiler() {
        this(new DefaultPlaceholderTranslator());
    }

    public ExpressionCompiler(PlaceholderTranslator placeholderTranslator) {
        this.placeholderTranslator = Objects.requireNonNull(placeholderTranslator,
            "placeholderTranslator must not be null");
    }

    /**
     * Compiles an expression whose columns are all qualified.
     *
     * @param expr the source expression
     * @param schema the visible columns
     * @return the provable expression
     */
    public ProvableExpression compile(Expression expr, List<ColumnField> schema) {
        return compile(expr, schema, null);
    }

    /**
     * Compiles an expression.
     *
     * @param expr the source expression
     * @param schema the visible columns
     * @param table the table of unqualified columns (may be null)
     * @return the provable expression
     * @throws PlannerException if the expression falls outside the provable subset
     * @throws ColumnOperationException if the operand types cannot be combined
     * @throws AnalyzeException if a node's own operand contract is violated
     */
    public ProvableExpression compile(Expression expr, List<ColumnField> schema, TableRef table) {
        Objects.requireNonNull(expr, "expr must not be null");
        Objects.requireNonNull(schema, "schema must not be null");

        if (expr instanceof AliasExpression) {
            return compile(((AliasExpression) expr).expression(), schema, table);
        } else if (expr instanceof ColumnReference) {
            return compileColumn((ColumnReference) expr, schema, table);
        } else if (expr instanceof Literal) {
            return new LiteralExpr(LiteralConverter.convert((Literal) expr));
        } else if (expr instanceof Placeholder) {
            Placeholder placeholder = (Placeholder) expr;
            return placeholderTranslator.translate(placeholder.id(), placeholder.dataType());
        } else if (expr instanceof CastExpression) {
            return compileCast((CastExpression) expr, schema, table);
        } else if (expr instanceof UnaryExpression) {
            return compileUnary((UnaryExpression) expr, schema, table);
        } else if (expr instanceof BinaryExpression) {
            return compileBinary((BinaryExpression) expr, schema, table);
        }
        throw PlannerException.unsupportedLogicalExpression(expr);
    }

    private ProvableExpression compileColumn(ColumnReference column, List<ColumnField> schema, TableRef table) {
        ColumnField field = null;
        for (ColumnField candidate : schema) {
            if (candidate.name().equals(column.columnName())) {
                field = candidate;
                break;
            }
        }
        if (field == null) {
            throw PlannerException.columnNotFound(column.qualifiedName());
        }

        TableRef columnTable = table;
        if (column.isQualified()) {
            try {
                columnTable = TableRef.of(column.qualifier());
            } catch (IllegalArgumentException e) {
                throw new PlannerException(PlannerException.Kind.COLUMN_NOT_FOUND,
                    "Column not found: " + column.qualifiedName(), column.qualifiedName(), e);
            }
        }
        if (columnTable == null) {
            throw PlannerException.columnNotFound(column.qualifiedName());
        }
        return new ColumnExpr(new ColumnRef(columnTable, field.name(), field.dataType()));
    }

    private ProvableExpression compileCast(CastExpression cast, List<ColumnField> schema, TableRef table) {
        ColumnType toType = TypeMapper.toColumnType(cast.targetType());

        if (cast.expression() instanceof Placeholder && !((Placeholder) cast.expression()).isTyped()) {
            Placeholder placeholder = (Placeholder) cast.expression();
            return placeholderTranslator.translate(placeholder.id(), cast.targetType());
        }

        ProvableExpression operand = compile(cast.expression(), schema, table);
        try {
            return CastExpr.tryNew(operand, toType);
        } catch (ColumnOperationException castFailure) {
            logger.debug("Cast of {} to {} is not legal, trying a scaling cast", operand, toType);
            try {
                return ScalingCastExpr.tryNew(operand, toType);
            } catch (ColumnOperationException e) {
                e.addSuppressed(castFailure);
                throw e;
            } catch (AnalyzeException e) {
                PlannerException failure = PlannerException.analyzeError(e, cast);
                failure.addSuppressed(castFailure);
                throw failure;
            }
        }
    }

    private ProvableExpression compileUnary(UnaryExpression unary, List<ColumnField> schema, TableRef table) {
        switch (unary.operator()) {
            case NOT:
                return NotExpr.tryNew(compile(unary.operand(), schema, table));
            case NEGATE:
                return NegExpr.tryNew(compile(unary.operand(), schema, table));
            default:
                throw PlannerException.unsupportedLogicalExpression(unary);
        }
    }

    private ProvableExpression compileBinary(BinaryExpression binary, List<ColumnField> schema, TableRef table) {
        BinaryExpression.Operator operator = binary.operator();
        ProvableExpression lhs = compile(binary.left(), schema, table);
        ProvableExpression rhs = compile(binary.right(), schema, table);

        ScaleAlignment.Aligned aligned = ScaleAlignment.align(operator, lhs, rhs);
        lhs = aligned.lhs();
        rhs = aligned.rhs();

        switch (operator) {
            case AND:
                return AndExpr.tryNew(lhs, rhs);
            case OR:
                return OrExpr.tryNew(lhs, rhs);
            case MULTIPLY:
                return MultiplyExpr.tryNew(lhs, rhs);
            case EQUAL:
                return EqualsExpr.tryNew(lhs, rhs);
            case NOT_EQUAL:
                return NotExpr.tryNew(EqualsExpr.tryNew(lhs, rhs));
            case LESS_THAN:
                return InequalityExpr.tryNew(lhs, rhs, true);
            case GREATER_THAN:
                return InequalityExpr.tryNew(lhs, rhs, false);
            case LESS_THAN_OR_EQUAL:
                return NotExpr.tryNew(InequalityExpr.tryNew(lhs, rhs, false));
            case GREATER_THAN_OR_EQUAL:
                return NotExpr.tryNew(InequalityExpr.tryNew(lhs, rhs, true));
            case ADD:
            case SUBTRACT:
                boolean isSubtract = operator == BinaryExpression.Operator.SUBTRACT;
                return aligned.scaled()
                    ? AddSubtractExpr.tryNewCapped(lhs, rhs, isSubtract)
                    : AddSubtractExpr.tryNew(lhs, rhs, isSubtract);
            default:
                throw PlannerException.unsupportedBinaryOperator(operator.symbol());
        }
    }
}
