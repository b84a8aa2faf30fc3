package com.provesql.expression;

import com.provesql.test.TestBase;
import com.provesql.test.TestCategories;
import com.provesql.types.LongType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Expression
@DisplayName("AggregateFunction Tests")
public class AggregateFunctionTest extends TestBase {

    private static final ColumnReference PRICE = ColumnReference.of("price", LongType.get());

    @Test
    @DisplayName("Display name upper-cases the function name")
    void testDisplayName() {
        AggregateFunction sum = new AggregateFunction("sum", List.of(PRICE), false, null);

        assertThat(sum.toSQL()).isEqualTo("SUM(price)");
        assertThat(AggregateFunction.countStar().toSQL()).isEqualTo("COUNT(*)");
    }

    @Test
    @DisplayName("Display name does not depend on the default locale")
    void testDisplayNameUnderTurkishLocale() {
        Locale saved = Locale.getDefault();
        try {
            Locale.setDefault(new Locale("tr", "TR"));
            logStep("Rendering lower-case aggregate names under tr-TR");

            assertThat(new AggregateFunction("min", List.of(PRICE), false, null).toSQL())
                .isEqualTo("MIN(price)");
            assertThat(new AggregateFunction("distinct_count", List.of(PRICE), true, null).toSQL())
                .isEqualTo("DISTINCT_COUNT(DISTINCT price)");
        } finally {
            Locale.setDefault(saved);
        }
    }
}
