package com.provesql.compiler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.provesql.column.ColumnField;
import com.provesql.column.ColumnType;
import com.provesql.column.TableRef;
import com.provesql.column.TimeUnit;
import com.provesql.test.TestBase;
import com.provesql.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.InputStream;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Test suite for InMemorySchemaAccessor.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.TypeMapping
@DisplayName("InMemorySchemaAccessor Tests")
public class InMemorySchemaAccessorTest extends TestBase {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        @DisplayName("Registered tables are looked up by reference")
        void testLookup() {
            InMemorySchemaAccessor accessor = InMemorySchemaAccessor.builder()
                .table("ns.t", new ColumnField("a", ColumnType.BIGINT), new ColumnField("b", ColumnType.VARCHAR))
                .build();

            assertThat(accessor.lookupSchema(TableRef.of("ns.t"))).containsExactly(
                new ColumnField("a", ColumnType.BIGINT), new ColumnField("b", ColumnType.VARCHAR));
            assertThat(accessor.tables()).containsExactly(TableRef.of("ns.t"));
        }

        @Test
        @DisplayName("Unknown tables have an empty schema")
        void testUnknownTable() {
            InMemorySchemaAccessor accessor = InMemorySchemaAccessor.builder().build();

            assertThat(accessor.lookupSchema(TableRef.of("ns.missing"))).isEmpty();
        }

        @Test
        @DisplayName("Schema qualification is part of the table identity")
        void testQualification() {
            InMemorySchemaAccessor accessor = InMemorySchemaAccessor.builder()
                .table("t", new ColumnField("a", ColumnType.INT))
                .build();

            assertThat(accessor.lookupSchema(TableRef.of("t"))).hasSize(1);
            assertThat(accessor.lookupSchema(TableRef.of("ns.t"))).isEmpty();
        }
    }

    @Nested
    @DisplayName("JSON Catalogs")
    class JsonCatalogs {

        @Test
        @DisplayName("Catalog resource loads every table in order")
        void testLoadResource() throws Exception {
            logStep("Given: the shop catalog resource");
            InMemorySchemaAccessor accessor;
            try (InputStream in = getClass().getResourceAsStream("/catalogs/shop.json")) {
                assertThat(in).isNotNull();
                accessor = InMemorySchemaAccessor.fromJson(in);
            }

            logStep("Then: both tables are present with their column types");
            assertThat(accessor.tables()).containsExactly(TableRef.of("shop.orders"), TableRef.of("customers"));

            List<ColumnField> orders = accessor.lookupSchema(TableRef.of("shop.orders"));
            logData("orders", orders);
            assertThat(orders).containsExactly(
                new ColumnField("id", ColumnType.BIGINT),
                new ColumnField("qty", ColumnType.INT),
                new ColumnField("price", ColumnType.decimal75(10, 2)),
                new ColumnField("region", ColumnType.VARCHAR),
                new ColumnField("paid", ColumnType.BOOLEAN),
                new ColumnField("placed_at",
                    ColumnType.timestampTz(TimeUnit.MILLISECOND, ZoneOffset.ofHours(2))));

            assertThat(accessor.lookupSchema(TableRef.of("customers"))).containsExactly(
                new ColumnField("id", ColumnType.BIGINT),
                new ColumnField("avatar", ColumnType.VARBINARY),
                new ColumnField("joined", ColumnType.timestampTz(TimeUnit.MICROSECOND, ZoneOffset.UTC)));
        }

        @Test
        @DisplayName("Document without a tables object is rejected")
        void testMissingTables() {
            assertThatThrownBy(() -> InMemorySchemaAccessor.fromJson("{\"schemas\": {}}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tables");
        }

        @Test
        @DisplayName("Malformed JSON is rejected with the parser error as cause")
        void testMalformedJson() {
            assertThatThrownBy(() -> InMemorySchemaAccessor.fromJson("{\"tables\": "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Failed to parse JSON catalog")
                .hasCauseInstanceOf(java.io.IOException.class);
        }

        @Test
        @DisplayName("Column without a name is rejected")
        void testMissingName() {
            assertThatThrownBy(() -> InMemorySchemaAccessor.fromJson(
                "{\"tables\": {\"t\": [{\"type\": \"INT\"}]}}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("has no name");
        }
    }

    @Nested
    @DisplayName("Column Type Parsing")
    class TypeParsing {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "'\"BOOLEAN\"',  BOOLEAN",
            "'\"uint8\"',    UINT8",
            "'\"TinyInt\"',  TINYINT",
            "'\"SMALLINT\"', SMALLINT",
            "'\"INT\"',      INT",
            "'\"BIGINT\"',   BIGINT",
            "'\"INT128\"',   INT128",
            "'\"SCALAR\"',   SCALAR",
            "'\"VARCHAR\"',  VARCHAR",
            "'\"BINARY\"',   VARBINARY"
        })
        @DisplayName("Type names map to column kinds")
        void testTypeNames(String typeJson, ColumnType.Kind expected) throws Exception {
            assertThat(InMemorySchemaAccessor.parseColumnType(json(typeJson)).kind()).isEqualTo(expected);
        }

        @Test
        @DisplayName("Decimal and timestamp objects carry their parameters")
        void testParameterizedTypes() throws Exception {
            assertThat(InMemorySchemaAccessor.parseColumnType(json("{\"Decimal\": [38, 4]}")))
                .isEqualTo(ColumnType.decimal75(38, 4));
            assertThat(InMemorySchemaAccessor.parseColumnType(json("{\"TimestampTZ\": [\"second\", \"Z\"]}")))
                .isEqualTo(ColumnType.timestampTz(TimeUnit.SECOND, ZoneOffset.UTC));
        }

        @ParameterizedTest
        @ValueSource(strings = {
            "\"DOUBLE\"",
            "42",
            "{\"Decimal75\": [10]}",
            "{\"TimestampTZ\": [\"FORTNIGHT\", \"+00:00\"]}",
            "{\"TimestampTZ\": [\"SECOND\", \"Mars/Olympus\"]}",
            "{\"Struct\": []}"
        })
        @DisplayName("Unknown or malformed types are rejected")
        void testInvalidTypes(String typeJson) throws Exception {
            JsonNode node = json(typeJson);
            assertThatThrownBy(() -> InMemorySchemaAccessor.parseColumnType(node))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
