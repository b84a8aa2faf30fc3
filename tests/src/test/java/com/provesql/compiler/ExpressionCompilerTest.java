package com.provesql.compiler;

import com.provesql.column.ColumnField;
import com.provesql.column.ColumnRef;
import com.provesql.column.ColumnType;
import com.provesql.column.LiteralValue;
import com.provesql.column.TableRef;
import com.provesql.exception.AnalyzeException;
import com.provesql.exception.ColumnOperationException;
import com.provesql.exception.PlannerException;
import com.provesql.expression.AliasExpression;
import com.provesql.expression.BinaryExpression;
import com.provesql.expression.CastExpression;
import com.provesql.expression.ColumnReference;
import com.provesql.expression.Expression;
import com.provesql.expression.InExpression;
import com.provesql.expression.Literal;
import com.provesql.expression.Placeholder;
import com.provesql.expression.ScalarSubquery;
import com.provesql.expression.UnaryExpression;
import com.provesql.logical.EmptyRelation;
import com.provesql.provable.expr.AddSubtractExpr;
import com.provesql.provable.expr.CastExpr;
import com.provesql.provable.expr.ColumnExpr;
import com.provesql.provable.expr.EqualsExpr;
import com.provesql.provable.expr.InequalityExpr;
import com.provesql.provable.expr.LiteralExpr;
import com.provesql.provable.expr.MultiplyExpr;
import com.provesql.provable.expr.NegExpr;
import com.provesql.provable.expr.NotExpr;
import com.provesql.provable.expr.PlaceholderExpr;
import com.provesql.provable.expr.ProvableExpression;
import com.provesql.provable.expr.ScalingCastExpr;
import com.provesql.test.TestBase;
import com.provesql.test.TestCategories;
import com.provesql.types.BooleanType;
import com.provesql.types.ByteType;
import com.provesql.types.DecimalType;
import com.provesql.types.DoubleType;
import com.provesql.types.IntegerType;
import com.provesql.types.LongType;
import com.provesql.types.ShortType;
import com.provesql.types.StringType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Test suite for ExpressionCompiler.
 *
 * <p>Covers column resolution, operator dispatch, scale alignment, casts,
 * placeholders and literal conversion.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Expression
@DisplayName("ExpressionCompiler Tests")
public class ExpressionCompilerTest extends TestBase {

    private static final TableRef TABLE = TableRef.of("ns.t");

    private static final List<ColumnField> SCHEMA = List.of(
        new ColumnField("a", ColumnType.SMALLINT),
        new ColumnField("b", ColumnType.decimal75(25, 5)),
        new ColumnField("c", ColumnType.BIGINT),
        new ColumnField("d", ColumnType.BIGINT),
        new ColumnField("flag", ColumnType.BOOLEAN),
        new ColumnField("name", ColumnType.VARCHAR));

    private static final ColumnReference A = ColumnReference.of("a", ShortType.get());
    private static final ColumnReference B = ColumnReference.of("b", new DecimalType(25, 5));
    private static final ColumnReference C = ColumnReference.of("c", LongType.get());
    private static final ColumnReference D = ColumnReference.of("d", LongType.get());
    private static final ColumnReference FLAG = ColumnReference.of("flag", BooleanType.get());
    private static final ColumnReference NAME = ColumnReference.of("name", StringType.get());

    private ExpressionCompiler compiler;

    @Override
    protected void doSetUp() {
        compiler = new ExpressionCompiler();
    }

    private ProvableExpression compile(Expression expr) {
        return compiler.compile(expr, SCHEMA, TABLE);
    }

    private static ColumnExpr column(String name) {
        ColumnField field = SCHEMA.stream().filter(f -> f.name().equals(name)).findFirst().orElseThrow();
        return new ColumnExpr(new ColumnRef(TABLE, name, field.dataType()));
    }

    private static PlannerException.Kind plannerKind(Throwable e) {
        return ((PlannerException) e).kind();
    }

    // ==================== Columns ====================

    @Nested
    @DisplayName("Column Resolution")
    class Columns {

        @Test
        @DisplayName("Unqualified column takes the table supplied by the caller")
        void testUnqualifiedColumn() {
            assertThat(compile(C)).isEqualTo(column("c"));
        }

        @Test
        @DisplayName("Qualified column takes its table from the qualifier")
        void testQualifiedColumn() {
            ProvableExpression result = compiler.compile(
                ColumnReference.qualified("other.u", "c", LongType.get()), SCHEMA);

            assertThat(result).isEqualTo(new ColumnExpr(new ColumnRef(TableRef.of("other.u"), "c", ColumnType.BIGINT)));
        }

        @Test
        @DisplayName("Unknown column is COLUMN_NOT_FOUND")
        void testUnknownColumn() {
            assertThatThrownBy(() -> compile(ColumnReference.of("missing", LongType.get())))
                .isInstanceOf(PlannerException.class)
                .extracting(ExpressionCompilerTest::plannerKind)
                .isEqualTo(PlannerException.Kind.COLUMN_NOT_FOUND);
        }

        @Test
        @DisplayName("Unqualified column without a known table is COLUMN_NOT_FOUND")
        void testUnqualifiedWithoutTable() {
            assertThatThrownBy(() -> compiler.compile(C, SCHEMA))
                .isInstanceOf(PlannerException.class)
                .extracting(ExpressionCompilerTest::plannerKind)
                .isEqualTo(PlannerException.Kind.COLUMN_NOT_FOUND);
        }

        @Test
        @DisplayName("Alias is dropped")
        void testAlias() {
            assertThat(compile(new AliasExpression(C, "renamed"))).isEqualTo(column("c"));
        }
    }

    // ==================== Binary Operators ====================

    @Nested
    @DisplayName("Binary Operators")
    class BinaryOperators {

        @Test
        @DisplayName("a + b scales the SMALLINT side to DECIMAL75(10, 5)")
        void testAddWithScaling() {
            ProvableExpression result = compile(BinaryExpression.add(A, B));

            ProvableExpression expected = AddSubtractExpr.tryNewCapped(
                ScalingCastExpr.tryNew(column("a"), ColumnType.decimal75(10, 5)), column("b"), false);
            assertThat(result).isEqualTo(expected);
            assertThat(result.dataType()).isEqualTo(ColumnType.decimal75(26, 5));
        }

        @Test
        @DisplayName("b - a scales the right side")
        void testSubtractScalesRight() {
            ProvableExpression result = compile(BinaryExpression.subtract(B, A));

            assertThat(result).isEqualTo(AddSubtractExpr.tryNewCapped(
                column("b"), ScalingCastExpr.tryNew(column("a"), ColumnType.decimal75(10, 5)), true));
        }

        @Test
        @DisplayName("c <> d is Not(Equals(c, d))")
        void testNotEqual() {
            ProvableExpression result = compile(BinaryExpression.notEqual(C, D));

            assertThat(result).isEqualTo(NotExpr.tryNew(EqualsExpr.tryNew(column("c"), column("d"))));
        }

        @Test
        @DisplayName("Inequalities map onto Inequality and its negation")
        void testInequalities() {
            assertThat(compile(BinaryExpression.lessThan(C, D)))
                .isEqualTo(InequalityExpr.tryNew(column("c"), column("d"), true));
            assertThat(compile(BinaryExpression.greaterThan(C, D)))
                .isEqualTo(InequalityExpr.tryNew(column("c"), column("d"), false));
            assertThat(compile(BinaryExpression.lessThanOrEqual(C, D)))
                .isEqualTo(NotExpr.tryNew(InequalityExpr.tryNew(column("c"), column("d"), false)));
            assertThat(compile(BinaryExpression.greaterThanOrEqual(C, D)))
                .isEqualTo(NotExpr.tryNew(InequalityExpr.tryNew(column("c"), column("d"), true)));
        }

        @Test
        @DisplayName("Equality between scales inserts a scaling cast")
        void testEqualsWithScaling() {
            ProvableExpression result = compile(BinaryExpression.equal(A, B));

            assertThat(result).isEqualTo(EqualsExpr.tryNew(
                ScalingCastExpr.tryNew(column("a"), ColumnType.decimal75(10, 5)), column("b")));
        }

        @Test
        @DisplayName("Multiplication never scale-aligns")
        void testMultiply() {
            ProvableExpression result = compile(BinaryExpression.multiply(A, B));

            assertThat(result).isEqualTo(MultiplyExpr.tryNew(column("a"), column("b")));
            assertThat(result.dataType()).isEqualTo(ColumnType.decimal75(31, 5));
        }

        @Test
        @DisplayName("Division is not a provable operator")
        void testDivideUnsupported() {
            assertThatThrownBy(() -> compile(BinaryExpression.divide(C, D)))
                .isInstanceOf(PlannerException.class)
                .extracting(ExpressionCompilerTest::plannerKind)
                .isEqualTo(PlannerException.Kind.UNSUPPORTED_BINARY_OPERATOR);
        }

        @Test
        @DisplayName("Operands are resolved before the operator is checked")
        void testDivideUnknownOperand() {
            assertThatThrownBy(() -> compile(BinaryExpression.divide(C, ColumnReference.of("missing", LongType.get()))))
                .isInstanceOf(PlannerException.class)
                .extracting(ExpressionCompilerTest::plannerKind)
                .isEqualTo(PlannerException.Kind.COLUMN_NOT_FOUND);
        }

        @Test
        @DisplayName("Comparing VARCHAR with BIGINT fails in the type arithmetic")
        void testIncomparable() {
            assertThatThrownBy(() -> compile(BinaryExpression.equal(NAME, C)))
                .isInstanceOf(ColumnOperationException.class)
                .extracting(e -> ((ColumnOperationException) e).kind())
                .isEqualTo(ColumnOperationException.Kind.INVALID_COLUMN_TYPE);
        }

        @Test
        @DisplayName("AND over a non-Boolean operand violates the node contract")
        void testAndNonBoolean() {
            assertThatThrownBy(() -> compile(BinaryExpression.and(FLAG, C)))
                .isInstanceOf(AnalyzeException.class)
                .extracting(e -> ((AnalyzeException) e).kind())
                .isEqualTo(AnalyzeException.Kind.INVALID_DATA_TYPE);
        }
    }

    // ==================== Unary Operators ====================

    @Nested
    @DisplayName("Unary Operators")
    class UnaryOperators {

        @Test
        @DisplayName("NOT and unary minus")
        void testNotAndNegate() {
            assertThat(compile(UnaryExpression.not(FLAG))).isEqualTo(NotExpr.tryNew(column("flag")));
            assertThat(compile(UnaryExpression.negate(B))).isEqualTo(NegExpr.tryNew(column("b")));
        }

        @Test
        @DisplayName("NOT re-validates its operand type")
        void testNotOverInteger() {
            assertThatThrownBy(() -> compile(UnaryExpression.not(C)))
                .isInstanceOf(AnalyzeException.class);
        }

        @Test
        @DisplayName("IS NULL, IN and subqueries are unsupported expressions")
        void testUnsupported() {
            List<Expression> unsupported = List.of(
                UnaryExpression.isNull(C),
                new InExpression(C, List.of(Literal.of(1L)), false),
                new ScalarSubquery(new EmptyRelation()));

            for (Expression expr : unsupported) {
                assertThatThrownBy(() -> compile(expr))
                    .isInstanceOf(PlannerException.class)
                    .extracting(ExpressionCompilerTest::plannerKind)
                    .isEqualTo(PlannerException.Kind.UNSUPPORTED_LOGICAL_EXPRESSION);
            }
        }
    }

    // ==================== Casts and Placeholders ====================

    @Nested
    @DisplayName("Casts and Placeholders")
    class CastsAndPlaceholders {

        @Test
        @DisplayName("A legal cast compiles to Cast")
        void testCast() {
            ProvableExpression result = compile(new CastExpression(A, LongType.get()));

            assertThat(result).isEqualTo(CastExpr.tryNew(column("a"), ColumnType.BIGINT));
        }

        @Test
        @DisplayName("A cast that changes scale falls back to a scaling cast")
        void testCastFallback() {
            ProvableExpression result = compile(new CastExpression(A, new DecimalType(10, 2)));

            assertThat(result).isEqualTo(ScalingCastExpr.tryNew(column("a"), ColumnType.decimal75(10, 2)));
        }

        @Test
        @DisplayName("A cast that neither form allows surfaces the scaling cast error")
        void testCastFailure() {
            assertThatThrownBy(() -> compile(new CastExpression(B, new DecimalType(10, 5))))
                .isInstanceOf(ColumnOperationException.class)
                .extracting(e -> ((ColumnOperationException) e).kind())
                .isEqualTo(ColumnOperationException.Kind.SCALE_CASTING_ERROR);
        }

        @Test
        @DisplayName("A cast to a non-decimal target the plain cast refuses is an analyze error")
        void testCastAnalyzeError() {
            assertThatThrownBy(() -> compile(new CastExpression(C, StringType.get())))
                .isInstanceOf(PlannerException.class)
                .hasCauseInstanceOf(AnalyzeException.class)
                .extracting(ExpressionCompilerTest::plannerKind)
                .isEqualTo(PlannerException.Kind.ANALYZE_ERROR);
        }

        @Test
        @DisplayName("A cast binds the type of an untyped placeholder")
        void testCastBindsPlaceholder() {
            ProvableExpression result = compile(new CastExpression(new Placeholder("$2", null), LongType.get()));

            assertThat(result).isEqualTo(PlaceholderExpr.tryNew(2, ColumnType.BIGINT));
        }

        @Test
        @DisplayName("A typed placeholder compiles directly")
        void testTypedPlaceholder() {
            assertThat(compile(new Placeholder("$1", IntegerType.get())))
                .isEqualTo(PlaceholderExpr.tryNew(1, ColumnType.INT));
        }

        @Test
        @DisplayName("An untyped placeholder outside a cast is rejected")
        void testUntypedPlaceholder() {
            assertThatThrownBy(() -> compile(new Placeholder("$1", null)))
                .isInstanceOf(PlannerException.class)
                .extracting(ExpressionCompilerTest::plannerKind)
                .isEqualTo(PlannerException.Kind.UNTYPED_PLACEHOLDER);
        }
    }

    // ==================== Literals ====================

    @Nested
    @DisplayName("Literals")
    class Literals {

        @Test
        @DisplayName("Literals map to their column values")
        void testLiterals() {
            assertThat(compile(Literal.of(true))).isEqualTo(new LiteralExpr(new LiteralValue.BooleanValue(true)));
            assertThat(compile(Literal.of(7))).isEqualTo(new LiteralExpr(new LiteralValue.IntValue(7)));
            assertThat(compile(Literal.of(7L))).isEqualTo(new LiteralExpr(new LiteralValue.BigIntValue(7L)));
            assertThat(compile(Literal.of("x"))).isEqualTo(new LiteralExpr(new LiteralValue.VarCharValue("x")));
        }

        @Test
        @DisplayName("Decimal literal values are rescaled to the declared scale")
        void testDecimalLiteral() {
            ProvableExpression result = compile(Literal.decimal(new BigDecimal("1.5"), 5, 2));

            assertThat(result).isEqualTo(new LiteralExpr(
                new LiteralValue.Decimal75Value(5, 2, BigInteger.valueOf(150))));
        }

        @Test
        @DisplayName("A decimal literal that would lose digits is an invalid scale")
        void testDecimalLiteralScale() {
            assertThatThrownBy(() -> compile(Literal.decimal(new BigDecimal("1.234"), 5, 2)))
                .isInstanceOf(ColumnOperationException.class)
                .extracting(e -> ((ColumnOperationException) e).kind())
                .isEqualTo(ColumnOperationException.Kind.INVALID_SCALE);
        }

        @Test
        @DisplayName("A decimal literal wider than its precision is an invalid precision")
        void testDecimalLiteralPrecision() {
            assertThatThrownBy(() -> compile(Literal.decimal(new BigDecimal("12345.6"), 5, 1)))
                .isInstanceOf(ColumnOperationException.class)
                .extracting(e -> ((ColumnOperationException) e).kind())
                .isEqualTo(ColumnOperationException.Kind.INVALID_PRECISION);
        }

        @Test
        @DisplayName("An integer that does not fit its declared type overflows")
        void testIntegerOverflow() {
            assertThatThrownBy(() -> compile(new Literal(300, ByteType.get())))
                .isInstanceOf(ColumnOperationException.class)
                .extracting(e -> ((ColumnOperationException) e).kind())
                .isEqualTo(ColumnOperationException.Kind.INTEGER_OVERFLOW);
        }

        @Test
        @DisplayName("NULL and floating point literals are unsupported data types")
        void testUnsupportedLiterals() {
            assertThatThrownBy(() -> compile(Literal.nullOf(LongType.get())))
                .isInstanceOf(PlannerException.class)
                .extracting(ExpressionCompilerTest::plannerKind)
                .isEqualTo(PlannerException.Kind.UNSUPPORTED_DATA_TYPE);
            assertThatThrownBy(() -> compile(new Literal(1.5, DoubleType.get())))
                .isInstanceOf(PlannerException.class)
                .extracting(ExpressionCompilerTest::plannerKind)
                .isEqualTo(PlannerException.Kind.UNSUPPORTED_DATA_TYPE);
        }

        @Test
        @DisplayName("Comparing a BIGINT column with an INT literal needs no cast")
        void testColumnAgainstLiteral() {
            ProvableExpression result = compile(BinaryExpression.greaterThan(C, Literal.of(2)));

            assertThat(result).isEqualTo(InequalityExpr.tryNew(
                column("c"), new LiteralExpr(new LiteralValue.IntValue(2)), false));
        }
    }
}
