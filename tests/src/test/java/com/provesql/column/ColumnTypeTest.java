package com.provesql.column;

import com.provesql.exception.ColumnOperationException;
import com.provesql.test.TestBase;
import com.provesql.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("ColumnType Tests")
public class ColumnTypeTest extends TestBase {

    @Test
    @DisplayName("Integers carry the precision of their decimal range and scale 0")
    void testIntegerPrecision() {
        assertThat(ColumnType.UINT8.precision()).isEqualTo(3);
        assertThat(ColumnType.TINYINT.precision()).isEqualTo(3);
        assertThat(ColumnType.SMALLINT.precision()).isEqualTo(5);
        assertThat(ColumnType.INT.precision()).isEqualTo(10);
        assertThat(ColumnType.BIGINT.precision()).isEqualTo(19);
        assertThat(ColumnType.INT128.precision()).isEqualTo(39);
        assertThat(ColumnType.BIGINT.scale()).isZero();
        assertThat(ColumnType.SCALAR.scale()).isZero();
    }

    @ParameterizedTest(name = "{0} -> scale {1}")
    @CsvSource({"SECOND, 0", "MILLISECOND, 3", "MICROSECOND, 6", "NANOSECOND, 9"})
    @DisplayName("Timestamp scale follows its unit")
    void testTimestampScale(TimeUnit unit, int scale) {
        ColumnType type = ColumnType.timestampTz(unit, ZoneOffset.UTC);

        assertThat(type.scale()).isEqualTo(scale);
        assertThat(type.precision()).isEqualTo(19);
        assertThat(type.isNumeric()).isFalse();
    }

    @ParameterizedTest(name = "DECIMAL({0}, {1})")
    @CsvSource({"0, 0", "76, 0", "10, 128", "10, -129"})
    @DisplayName("Out-of-range decimals are rejected at construction")
    void testDecimalBounds(int precision, int scale) {
        assertThatThrownBy(() -> ColumnType.decimal75(precision, scale))
            .isInstanceOf(ColumnOperationException.class);
    }

    @Test
    @DisplayName("Non-numeric types have no precision")
    void testNoPrecision() {
        assertThatThrownBy(() -> ColumnType.VARCHAR.precision())
            .isInstanceOf(IllegalStateException.class);
        assertThat(ColumnType.BOOLEAN.hasPrecision()).isFalse();
    }

    @Test
    @DisplayName("Decimals are equal by precision and scale")
    void testDecimalEquality() {
        assertThat(ColumnType.decimal75(10, 2)).isEqualTo(ColumnType.decimal75(10, 2));
        assertThat(ColumnType.decimal75(10, 2)).isNotEqualTo(ColumnType.decimal75(10, 3));
        assertThat(ColumnType.decimal75(10, 2).typeName()).isEqualTo("DECIMAL75(10, 2)");
    }
}
