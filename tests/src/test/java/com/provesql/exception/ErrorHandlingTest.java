package com.provesql.exception;

import com.provesql.column.ColumnField;
import com.provesql.column.ColumnType;
import com.provesql.column.TableRef;
import com.provesql.compiler.ExpressionCompiler;
import com.provesql.expression.CastExpression;
import com.provesql.expression.ColumnReference;
import com.provesql.test.TestBase;
import com.provesql.test.TestCategories;
import com.provesql.types.LongType;
import com.provesql.types.StringType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for error context and user-facing messages.
 *
 * <p>These tests verify that:
 * <ul>
 *   <li>Exceptions carry the failing fragment and operand types</li>
 *   <li>User messages are short and actionable</li>
 *   <li>Technical messages include kind, fragment and cause</li>
 * </ul>
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Error Handling Tests")
public class ErrorHandlingTest extends TestBase {

    @Nested
    @DisplayName("ColumnOperationException")
    class ColumnOperationErrors {

        @Test
        @DisplayName("Binary type errors carry the operator and both operand types")
        void testBinaryContext() {
            ColumnOperationException ex = ColumnOperationException.invalidColumnType(
                "=", ColumnType.VARCHAR, ColumnType.BIGINT);

            assertThat(ex.kind()).isEqualTo(ColumnOperationException.Kind.INVALID_COLUMN_TYPE);
            assertThat(ex.operator()).isEqualTo("=");
            assertThat(ex.leftType()).isEqualTo(ColumnType.VARCHAR);
            assertThat(ex.rightType()).isEqualTo(ColumnType.BIGINT);
            assertThat(ex.getMessage()).contains("VARCHAR").contains("BIGINT");
        }

        @Test
        @DisplayName("Cast errors name source and destination")
        void testCastContext() {
            ColumnOperationException ex = ColumnOperationException.castingError(
                ColumnType.BIGINT, ColumnType.INT);

            assertThat(ex.getMessage()).isEqualTo("Cannot cast BIGINT to INT");
            assertThat(ex.leftType()).isEqualTo(ColumnType.BIGINT);
            assertThat(ex.rightType()).isEqualTo(ColumnType.INT);
        }

        @Test
        @DisplayName("Precision errors are not tied to an operator")
        void testPrecisionContext() {
            ColumnOperationException ex = ColumnOperationException.invalidPrecision("76");

            assertThat(ex.operator()).isNull();
            assertThat(ex.getMessage()).contains("76");
        }
    }

    @Nested
    @DisplayName("PlannerException")
    class PlannerErrors {

        @Test
        @DisplayName("User message names the missing column")
        void testColumnNotFoundUserMessage() {
            PlannerException ex = PlannerException.columnNotFound("t.ghost");

            assertThat(ex.fragment()).isEqualTo("t.ghost");
            assertThat(ex.getUserMessage())
                .contains("does not exist")
                .contains("t.ghost");
        }

        @Test
        @DisplayName("User message explains the supported aggregates")
        void testAggregateUserMessage() {
            PlannerException ex = PlannerException.unsupportedAggregateFunction("AVG(x)");

            assertThat(ex.getUserMessage()).contains("SUM").contains("COUNT");
        }

        @Test
        @DisplayName("Technical message includes kind, fragment and cause")
        void testTechnicalMessage() {
            // Given: a cast the proof system cannot express
            ExpressionCompiler compiler = new ExpressionCompiler();
            CastExpression cast = new CastExpression(ColumnReference.of("a", LongType.get()), StringType.get());

            // When: compiling it
            Throwable thrown = catchThrowable(() -> compiler.compile(cast,
                List.of(new ColumnField("a", ColumnType.BIGINT)), TableRef.of("t")));

            // Then: the planner error wraps the analyze error
            assertThat(thrown).isInstanceOf(PlannerException.class);
            PlannerException ex = (PlannerException) thrown;
            logData("technical message", ex.getTechnicalMessage());

            assertThat(ex.kind()).isEqualTo(PlannerException.Kind.ANALYZE_ERROR);
            assertThat(ex.fragment()).isSameAs(cast);
            assertThat(ex.getSuppressed()).hasSize(1);
            assertThat(ex.getSuppressed()[0]).isInstanceOf(ColumnOperationException.class);
            assertThat(ex.getTechnicalMessage())
                .contains("Kind: ANALYZE_ERROR")
                .contains("Fragment Type: " + CastExpression.class.getName())
                .contains("Cause: ");
            assertThat(ex.getUserMessage()).startsWith("The query could not be analyzed");
        }
    }
}
