package com.provesql.column;

import com.provesql.exception.ColumnOperationException;
import com.provesql.test.TestBase;
import com.provesql.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BinaryOperator;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Test suite for ColumnTypeArithmetic.
 *
 * <p>Covers:
 * <ul>
 *   <li>Result types of add/subtract, multiply and divide</li>
 *   <li>Strict versus capped precision policies</li>
 *   <li>Same-scale versus scale-tolerant comparison legality</li>
 *   <li>Cast and scale-cast legality</li>
 * </ul>
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("ColumnTypeArithmetic Tests")
public class ColumnTypeArithmeticTest extends TestBase {

    private static final ColumnType TS_MICROS = ColumnType.timestampTz(TimeUnit.MICROSECOND, ZoneOffset.UTC);
    private static final ColumnType TS_SECONDS = ColumnType.timestampTz(TimeUnit.SECOND, ZoneOffset.UTC);

    static List<ColumnType> numericTypes() {
        List<ColumnType> types = new ArrayList<>(List.of(
            ColumnType.UINT8, ColumnType.TINYINT, ColumnType.SMALLINT, ColumnType.INT,
            ColumnType.BIGINT, ColumnType.INT128, ColumnType.SCALAR));
        for (int precision : new int[] {1, 10, 38, 39, 74, 75}) {
            for (int scale : new int[] {-3, 0, 2, 5}) {
                types.add(ColumnType.decimal75(precision, scale));
            }
        }
        return types;
    }

    static List<ColumnType> nonNumericTypes() {
        return List.of(ColumnType.BOOLEAN, ColumnType.VARCHAR, ColumnType.VARBINARY, TS_MICROS);
    }

    static Stream<Arguments> equalScaleNumericPairs() {
        List<Arguments> pairs = new ArrayList<>();
        for (ColumnType left : numericTypes()) {
            for (ColumnType right : numericTypes()) {
                if (left.scale() == right.scale()) {
                    pairs.add(Arguments.of(left, right));
                }
            }
        }
        return pairs.stream();
    }

    static Stream<Arguments> pairsWithNonNumeric() {
        List<Arguments> pairs = new ArrayList<>();
        for (ColumnType nonNumeric : nonNumericTypes()) {
            for (ColumnType other : numericTypes()) {
                pairs.add(Arguments.of(nonNumeric, other));
                pairs.add(Arguments.of(other, nonNumeric));
            }
            pairs.add(Arguments.of(nonNumeric, nonNumeric));
        }
        return pairs.stream();
    }

    // ==================== Addition / Subtraction ====================

    @Nested
    @DisplayName("Addition and Subtraction")
    class AddSubtract {

        @Test
        @DisplayName("Two integers yield the wider integer")
        void testIntegerWidening() {
            assertThat(ColumnTypeArithmetic.addSubtract(ColumnType.SMALLINT, ColumnType.BIGINT))
                .isEqualTo(ColumnType.BIGINT);
            assertThat(ColumnTypeArithmetic.addSubtract(ColumnType.UINT8, ColumnType.UINT8))
                .isEqualTo(ColumnType.UINT8);
            assertThat(ColumnTypeArithmetic.addSubtract(ColumnType.UINT8, ColumnType.TINYINT))
                .isEqualTo(ColumnType.TINYINT);
            assertThat(ColumnTypeArithmetic.addSubtract(ColumnType.INT128, ColumnType.INT))
                .isEqualTo(ColumnType.INT128);
        }

        @Test
        @DisplayName("Scalar on either side yields Scalar")
        void testScalar() {
            assertThat(ColumnTypeArithmetic.addSubtract(ColumnType.SCALAR, ColumnType.decimal75(10, 2)))
                .isEqualTo(ColumnType.SCALAR);
            assertThat(ColumnTypeArithmetic.addSubtract(ColumnType.INT, ColumnType.SCALAR))
                .isEqualTo(ColumnType.SCALAR);
        }

        @ParameterizedTest(name = "DECIMAL({0},{1}) + DECIMAL({2},{3}) = DECIMAL({4},{5})")
        @CsvSource({
            "10, 2, 5, 1, 11, 2",
            "25, 5, 5, 0, 26, 5",
            "38, 0, 38, 0, 39, 0",
            "7, -2, 3, 1, 11, 1"
        })
        @DisplayName("Decimal result follows scale = max(s), precision = scale + max(p - s) + 1")
        void testDecimalFormula(int p1, int s1, int p2, int s2, int expectedPrecision, int expectedScale) {
            ColumnType result = ColumnTypeArithmetic.addSubtract(
                ColumnType.decimal75(p1, s1), ColumnType.decimal75(p2, s2));

            assertThat(result).isEqualTo(ColumnType.decimal75(expectedPrecision, expectedScale));
        }

        @Test
        @DisplayName("Integers combine with decimals as Decimal(p, 0)")
        void testIntegerWithDecimal() {
            // SMALLINT = (5, 0); scale = 5, precision = 5 + max(5, 20) + 1
            ColumnType result = ColumnTypeArithmetic.addSubtract(ColumnType.SMALLINT, ColumnType.decimal75(25, 5));

            assertThat(result).isEqualTo(ColumnType.decimal75(26, 5));
        }

        @Test
        @DisplayName("Strict policy rejects precision above 75")
        void testStrictOverflow() {
            assertThatThrownBy(() -> ColumnTypeArithmetic.addSubtract(
                    ColumnType.decimal75(75, 0), ColumnType.decimal75(75, 0)))
                .isInstanceOf(ColumnOperationException.class)
                .extracting(e -> ((ColumnOperationException) e).kind())
                .isEqualTo(ColumnOperationException.Kind.INVALID_PRECISION);
        }

        @Test
        @DisplayName("Capped policy clamps precision to 75")
        void testCappedOverflow() {
            ColumnType result = ColumnTypeArithmetic.addSubtractCapped(
                ColumnType.decimal75(75, 0), ColumnType.decimal75(75, 0));

            assertThat(result).isEqualTo(ColumnType.decimal75(75, 0));
        }
    }

    // ==================== Multiplication / Division ====================

    @Nested
    @DisplayName("Multiplication and Division")
    class MultiplyDivide {

        @Test
        @DisplayName("Decimal product adds precisions plus one and adds scales")
        void testDecimalProduct() {
            ColumnType result = ColumnTypeArithmetic.multiply(ColumnType.decimal75(10, 2), ColumnType.decimal75(5, 3));

            assertThat(result).isEqualTo(ColumnType.decimal75(16, 5));
        }

        @Test
        @DisplayName("Two integers yield the wider integer")
        void testIntegerProduct() {
            assertThat(ColumnTypeArithmetic.multiply(ColumnType.INT, ColumnType.TINYINT))
                .isEqualTo(ColumnType.INT);
        }

        @Test
        @DisplayName("Scale beyond the signed 8-bit range is rejected")
        void testScaleOverflow() {
            assertThatThrownBy(() -> ColumnTypeArithmetic.multiplyCapped(
                    ColumnType.decimal75(75, 100), ColumnType.decimal75(75, 100)))
                .isInstanceOf(ColumnOperationException.class)
                .extracting(e -> ((ColumnOperationException) e).kind())
                .isEqualTo(ColumnOperationException.Kind.INVALID_SCALE);
        }

        @Test
        @DisplayName("Strict product rejects precision above 75, capped product clamps it")
        void testProductPolicies() {
            ColumnType wide = ColumnType.decimal75(40, 0);

            assertThatThrownBy(() -> ColumnTypeArithmetic.multiply(wide, wide))
                .isInstanceOf(ColumnOperationException.class);
            assertThat(ColumnTypeArithmetic.multiplyCapped(wide, wide)).isEqualTo(ColumnType.decimal75(75, 0));
        }

        @Test
        @DisplayName("Quotient scale has a minimum of 6")
        void testDivisionMinimumScale() {
            // scale = max(0 + 3 + 1, 6) = 6; precision = (10 - 0) + 0 + 6 = 16
            ColumnType result = ColumnTypeArithmetic.divide(ColumnType.INT, ColumnType.TINYINT);

            assertThat(result).isEqualTo(ColumnType.decimal75(16, 6));
        }

        @Test
        @DisplayName("Quotient of decimals")
        void testDivisionDecimal() {
            // scale = max(2 + 5 + 1, 6) = 8; precision = (10 - 2) + 1 + 8 = 17
            ColumnType result = ColumnTypeArithmetic.divide(ColumnType.decimal75(10, 2), ColumnType.decimal75(5, 1));

            assertThat(result).isEqualTo(ColumnType.decimal75(17, 8));
        }

        @Test
        @DisplayName("Division refuses Scalar operands")
        void testDivisionScalar() {
            assertThatThrownBy(() -> ColumnTypeArithmetic.divide(ColumnType.SCALAR, ColumnType.INT))
                .isInstanceOf(ColumnOperationException.class)
                .extracting(e -> ((ColumnOperationException) e).kind())
                .isEqualTo(ColumnOperationException.Kind.INVALID_COLUMN_TYPE);
        }
    }

    // ==================== Properties ====================

    @Nested
    @DisplayName("Arithmetic Properties")
    class Properties {

        @ParameterizedTest(name = "{0} and {1}")
        @MethodSource("com.provesql.column.ColumnTypeArithmeticTest#equalScaleNumericPairs")
        @DisplayName("Equal-scale numeric pairs give a precision of at most 75 or a typed error")
        void testEqualScaleNeverFailsUntyped(ColumnType left, ColumnType right) {
            assertBoundedOrTyped(ColumnTypeArithmetic::addSubtract, left, right);
            assertBoundedOrTyped(ColumnTypeArithmetic::multiply, left, right);
            assertBoundedOrTyped(ColumnTypeArithmetic::addSubtractCapped, left, right);
        }

        @ParameterizedTest(name = "{0} and {1}")
        @MethodSource("com.provesql.column.ColumnTypeArithmeticTest#pairsWithNonNumeric")
        @DisplayName("Any non-numeric operand is an invalid column type")
        void testNonNumericRejected(ColumnType left, ColumnType right) {
            List<BinaryOperator<ColumnType>> operations = List.of(
                ColumnTypeArithmetic::addSubtract,
                ColumnTypeArithmetic::addSubtractCapped,
                ColumnTypeArithmetic::multiply,
                ColumnTypeArithmetic::multiplyCapped,
                ColumnTypeArithmetic::divide);

            for (BinaryOperator<ColumnType> operation : operations) {
                assertThatThrownBy(() -> operation.apply(left, right))
                    .isInstanceOf(ColumnOperationException.class)
                    .extracting(e -> ((ColumnOperationException) e).kind())
                    .isEqualTo(ColumnOperationException.Kind.INVALID_COLUMN_TYPE);
            }
        }

        private void assertBoundedOrTyped(BinaryOperator<ColumnType> operation, ColumnType left, ColumnType right) {
            try {
                ColumnType result = operation.apply(left, right);
                if (result.kind() != ColumnType.Kind.SCALAR) {
                    assertThat(result.precision()).isLessThanOrEqualTo(75);
                }
            } catch (ColumnOperationException e) {
                assertThat(e.kind()).isIn(
                    ColumnOperationException.Kind.INVALID_PRECISION,
                    ColumnOperationException.Kind.INVALID_SCALE);
            }
        }
    }

    // ==================== Comparisons ====================

    @Nested
    @DisplayName("Comparisons")
    class Comparisons {

        @Test
        @DisplayName("Same-scale equality rejects differing scales, scale-tolerant accepts them")
        void testEqualityPolicies() {
            ColumnType left = ColumnType.SMALLINT;
            ColumnType right = ColumnType.decimal75(25, 5);

            assertThatThrownBy(() -> ColumnTypeArithmetic.checkEquals(left, right))
                .isInstanceOf(ColumnOperationException.class);
            assertThatCode(() -> ColumnTypeArithmetic.checkEqualsWithScaling(left, right))
                .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("VarBinary is never comparable")
        void testVarBinary() {
            assertThatThrownBy(() -> ColumnTypeArithmetic.checkEquals(ColumnType.VARBINARY, ColumnType.VARBINARY))
                .isInstanceOf(ColumnOperationException.class);
            assertThatThrownBy(() ->
                    ColumnTypeArithmetic.checkEqualsWithScaling(ColumnType.VARBINARY, ColumnType.VARBINARY))
                .isInstanceOf(ColumnOperationException.class);
        }

        @Test
        @DisplayName("Equality accepts VarChar, Boolean, Scalar and same-unit timestamps")
        void testEqualityAccepted() {
            assertThatCode(() -> {
                ColumnTypeArithmetic.checkEquals(ColumnType.VARCHAR, ColumnType.VARCHAR);
                ColumnTypeArithmetic.checkEquals(ColumnType.BOOLEAN, ColumnType.BOOLEAN);
                ColumnTypeArithmetic.checkEquals(ColumnType.SCALAR, ColumnType.decimal75(10, 3));
                ColumnTypeArithmetic.checkEquals(TS_MICROS, TS_MICROS);
            }).doesNotThrowAnyException();
            assertThatThrownBy(() -> ColumnTypeArithmetic.checkEquals(TS_MICROS, TS_SECONDS))
                .isInstanceOf(ColumnOperationException.class);
        }

        @Test
        @DisplayName("Inequality rejects decimals wider than 38 digits")
        void testInequalityPrecisionLimit() {
            ColumnType wide = ColumnType.decimal75(39, 0);

            assertThatThrownBy(() -> ColumnTypeArithmetic.checkInequality(wide, wide))
                .isInstanceOf(ColumnOperationException.class);
            assertThatThrownBy(() -> ColumnTypeArithmetic.checkInequalityWithScaling(wide, ColumnType.INT))
                .isInstanceOf(ColumnOperationException.class);
            assertThatCode(() -> ColumnTypeArithmetic.checkInequality(
                    ColumnType.decimal75(38, 2), ColumnType.decimal75(10, 2)))
                .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Inequality never accepts VarChar")
        void testInequalityVarChar() {
            assertThatThrownBy(() -> ColumnTypeArithmetic.checkInequality(ColumnType.VARCHAR, ColumnType.VARCHAR))
                .isInstanceOf(ColumnOperationException.class);
        }
    }

    // ==================== Casts ====================

    @Nested
    @DisplayName("Casts")
    class Casts {

        @Test
        @DisplayName("Legal explicit casts")
        void testLegalCasts() {
            assertThatCode(() -> {
                ColumnTypeArithmetic.checkCast(ColumnType.BOOLEAN, ColumnType.INT);
                ColumnTypeArithmetic.checkCast(TS_MICROS, ColumnType.BIGINT);
                ColumnTypeArithmetic.checkCast(ColumnType.INT, ColumnType.BIGINT);
                ColumnTypeArithmetic.checkCast(ColumnType.SMALLINT, ColumnType.decimal75(5, 0));
                ColumnTypeArithmetic.checkCast(ColumnType.decimal75(10, 2), ColumnType.decimal75(20, 2));
                ColumnTypeArithmetic.checkCast(ColumnType.TINYINT, ColumnType.TINYINT);
            }).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Illegal explicit casts are casting errors")
        void testIllegalCasts() {
            assertThatThrownBy(() -> ColumnTypeArithmetic.checkCast(ColumnType.BOOLEAN, ColumnType.UINT8))
                .isInstanceOf(ColumnOperationException.class)
                .extracting(e -> ((ColumnOperationException) e).kind())
                .isEqualTo(ColumnOperationException.Kind.CASTING_ERROR);
            assertThatThrownBy(() -> ColumnTypeArithmetic.checkCast(ColumnType.BIGINT, ColumnType.INT))
                .isInstanceOf(ColumnOperationException.class);
            assertThatThrownBy(() -> ColumnTypeArithmetic.checkCast(
                    ColumnType.decimal75(10, 2), ColumnType.decimal75(20, 3)))
                .isInstanceOf(ColumnOperationException.class);
        }

        @ParameterizedTest(name = "{0}")
        @MethodSource("com.provesql.column.ColumnTypeArithmeticTest#numericTypes")
        @DisplayName("Scale cast is reflexive for decimals only")
        void testScaleCastReflexive(ColumnType type) {
            if (type.isDecimal()) {
                assertThatCode(() -> ColumnTypeArithmetic.checkScaleCast(type, type)).doesNotThrowAnyException();
            } else {
                assertThatThrownBy(() -> ColumnTypeArithmetic.checkScaleCast(type, type))
                    .isInstanceOf(ColumnOperationException.class)
                    .extracting(e -> ((ColumnOperationException) e).kind())
                    .isEqualTo(ColumnOperationException.Kind.SCALE_CASTING_ERROR);
            }
        }

        @Test
        @DisplayName("Scale cast is monotonic in destination precision at a fixed scale")
        void testScaleCastMonotonic() {
            ColumnType from = ColumnType.decimal75(10, 2);
            for (int precision = 1; precision <= 75; precision++) {
                ColumnType to = ColumnType.decimal75(precision, 4);
                boolean legal = isScaleCastLegal(from, to);
                if (legal && precision < 75) {
                    assertThat(isScaleCastLegal(from, ColumnType.decimal75(precision + 1, 4))).isTrue();
                }
            }
            assertThat(isScaleCastLegal(from, ColumnType.decimal75(11, 4))).isFalse();
            assertThat(isScaleCastLegal(from, ColumnType.decimal75(12, 4))).isTrue();
        }

        @Test
        @DisplayName("Scale cast never lowers the scale")
        void testScaleCastLowersScale() {
            assertThatThrownBy(() -> ColumnTypeArithmetic.checkScaleCast(
                    ColumnType.decimal75(10, 4), ColumnType.decimal75(20, 2)))
                .isInstanceOf(ColumnOperationException.class)
                .extracting(e -> ((ColumnOperationException) e).kind())
                .isEqualTo(ColumnOperationException.Kind.SCALE_CASTING_ERROR);
        }

        @Test
        @DisplayName("Timestamps scale cast to an equal or finer unit")
        void testTimestampScaleCast() {
            assertThatCode(() -> ColumnTypeArithmetic.checkScaleCast(TS_SECONDS, TS_MICROS))
                .doesNotThrowAnyException();
            assertThatThrownBy(() -> ColumnTypeArithmetic.checkScaleCast(TS_MICROS, TS_SECONDS))
                .isInstanceOf(ColumnOperationException.class);
        }

        private boolean isScaleCastLegal(ColumnType from, ColumnType to) {
            try {
                ColumnTypeArithmetic.checkScaleCast(from, to);
                return true;
            } catch (ColumnOperationException e) {
                return false;
            }
        }
    }

    // ==================== Boolean and Unary ====================

    @Test
    @DisplayName("AND/OR and NOT require Boolean, negation requires a numeric")
    void testBooleanAndUnary() {
        assertThatCode(() -> {
            ColumnTypeArithmetic.checkAndOr(ColumnType.BOOLEAN, ColumnType.BOOLEAN);
            ColumnTypeArithmetic.checkNot(ColumnType.BOOLEAN);
            ColumnTypeArithmetic.checkNegate(ColumnType.decimal75(5, 2));
        }).doesNotThrowAnyException();

        assertThatThrownBy(() -> ColumnTypeArithmetic.checkAndOr(ColumnType.BOOLEAN, ColumnType.INT))
            .isInstanceOf(ColumnOperationException.class);
        assertThatThrownBy(() -> ColumnTypeArithmetic.checkNot(ColumnType.VARCHAR))
            .isInstanceOf(ColumnOperationException.class);
        assertThatThrownBy(() -> ColumnTypeArithmetic.checkNegate(ColumnType.BOOLEAN))
            .isInstanceOf(ColumnOperationException.class);
    }
}
