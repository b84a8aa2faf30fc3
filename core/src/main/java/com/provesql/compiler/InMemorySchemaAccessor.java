package com.provesql.compiler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.provesql.column.ColumnField;
import com.provesql.column.ColumnType;
import com.provesql.column.TableRef;
import com.provesql.column.TimeUnit;

import java.io.IOException;
import java.io.InputStream;
import java.time.DateTimeException;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Schema accessor backed by an in-memory table catalog.
 *
 * <p>A catalog can be assembled with {@link #builder()} or loaded from JSON:
 * <pre>
 * {
 *   "tables": {
 *     "ns.t": [
 *       {"name": "a", "type": "BIGINT"},
 *       {"name": "d", "type": {"Decimal75": [25, 5]}},
 *       {"name": "ts", "type": {"TimestampTZ": ["MICROSECOND", "+00:00"]}}
 *     ]
 *   }
 * }
 * </pre>
 *
 * <p>Type names are case-insensitive. A bare {@code TIMESTAMP} reads as
 * microseconds in UTC.
 */
public final class InMemorySchemaAccessor implements SchemaAccessor {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final Map<TableRef, List<ColumnField>> tables;

    private InMemorySchemaAccessor(Map<TableRef, List<ColumnField>> tables) {
        this.tables = tables;
    }

    @Override
    public List<ColumnField> lookupSchema(TableRef table) {
        return tables.getOrDefault(table, Collections.emptyList());
    }

    /**
     * Returns the known tables in registration order.
     *
     * @return the table references
     */
    public List<TableRef> tables() {
        return new ArrayList<>(tables.keySet());
    }

    // ==================== Factory Methods ====================

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads a catalog from a JSON document.
     *
     * @param json the catalog document
     * @return the accessor
     * @throws IllegalArgumentException if the document is malformed
     */
    public static InMemorySchemaAccessor fromJson(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return fromJsonNode(objectMapper.readTree(json));
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to parse JSON catalog: " + e.getMessage(), e);
        }
    }

    /**
     * Loads a catalog from a JSON stream.
     *
     * @param in the catalog document
     * @return the accessor
     * @throws IllegalArgumentException if the document is malformed
     */
    public static InMemorySchemaAccessor fromJson(InputStream in) {
        Objects.requireNonNull(in, "in must not be null");
        try {
            return fromJsonNode(objectMapper.readTree(in));
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to parse JSON catalog: " + e.getMessage(), e);
        }
    }

    private static InMemorySchemaAccessor fromJsonNode(JsonNode root) {
        JsonNode tablesNode = root == null ? null : root.get("tables");
        if (tablesNode == null || !tablesNode.isObject()) {
            throw new IllegalArgumentException("JSON catalog must have a \"tables\" object");
        }

        Builder builder = builder();
        Iterator<Map.Entry<String, JsonNode>> entries = tablesNode.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (!entry.getValue().isArray()) {
                throw new IllegalArgumentException("Columns of table " + entry.getKey() + " must be an array");
            }
            List<ColumnField> columns = new ArrayList<>();
            for (JsonNode columnNode : entry.getValue()) {
                JsonNode nameNode = columnNode.get("name");
                if (nameNode == null || !nameNode.isTextual()) {
                    throw new IllegalArgumentException("Column of table " + entry.getKey() + " has no name");
                }
                columns.add(new ColumnField(nameNode.asText(), parseColumnType(columnNode.get("type"))));
            }
            builder.table(TableRef.of(entry.getKey()), columns);
        }
        return builder.build();
    }

    /**
     * Parses a column type from its JSON form: a type name, or a single-entry
     * object for parameterized types.
     */
    static ColumnType parseColumnType(JsonNode typeNode) {
        if (typeNode == null) {
            throw new IllegalArgumentException("Type node cannot be null");
        }
        if (typeNode.isTextual()) {
            return parseTypeName(typeNode.asText());
        }
        if (typeNode.isObject() && typeNode.size() == 1) {
            Map.Entry<String, JsonNode> entry = typeNode.fields().next();
            String typeName = entry.getKey().toUpperCase(Locale.ROOT);
            JsonNode args = entry.getValue();

            switch (typeName) {
                case "DECIMAL75":
                case "DECIMAL":
                    if (!args.isArray() || args.size() != 2) {
                        throw new IllegalArgumentException("Decimal75 takes [precision, scale], got: " + args);
                    }
                    return ColumnType.decimal75(args.get(0).asInt(), args.get(1).asInt());

                case "TIMESTAMPTZ":
                case "TIMESTAMP":
                    if (!args.isArray() || args.size() != 2) {
                        throw new IllegalArgumentException("TimestampTZ takes [unit, zone], got: " + args);
                    }
                    return ColumnType.timestampTz(parseTimeUnit(args.get(0).asText()),
                        parseZone(args.get(1).asText()));

                default:
                    throw new IllegalArgumentException("Unknown column type: " + entry.getKey());
            }
        }
        throw new IllegalArgumentException("Invalid column type: " + typeNode);
    }

    private static ColumnType parseTypeName(String name) {
        switch (name.toUpperCase(Locale.ROOT)) {
            case "BOOLEAN":
                return ColumnType.BOOLEAN;
            case "UINT8":
                return ColumnType.UINT8;
            case "TINYINT":
                return ColumnType.TINYINT;
            case "SMALLINT":
                return ColumnType.SMALLINT;
            case "INT":
                return ColumnType.INT;
            case "BIGINT":
                return ColumnType.BIGINT;
            case "INT128":
                return ColumnType.INT128;
            case "SCALAR":
                return ColumnType.SCALAR;
            case "VARCHAR":
                return ColumnType.VARCHAR;
            case "BINARY":
                return ColumnType.VARBINARY;
            case "TIMESTAMP":
                return ColumnType.timestampTz(TimeUnit.MICROSECOND, ZoneOffset.UTC);
            default:
                throw new IllegalArgumentException("Unknown column type: " + name);
        }
    }

    private static TimeUnit parseTimeUnit(String unit) {
        try {
            return TimeUnit.valueOf(unit.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown time unit: " + unit, e);
        }
    }

    private static ZoneOffset parseZone(String zone) {
        try {
            return ZoneOffset.of(zone);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid zone offset: " + zone, e);
        }
    }

    /**
     * Builder for in-memory catalogs.
     */
    public static final class Builder {

        private final Map<TableRef, List<ColumnField>> tables = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder table(TableRef table, List<ColumnField> columns) {
            Objects.requireNonNull(table, "table must not be null");
            tables.put(table, Collections.unmodifiableList(new ArrayList<>(columns)));
            return this;
        }

        public Builder table(String qualifiedName, ColumnField... columns) {
            return table(TableRef.of(qualifiedName), List.of(columns));
        }

        public InMemorySchemaAccessor build() {
            return new InMemorySchemaAccessor(Collections.unmodifiableMap(new LinkedHashMap<>(tables)));
        }
    }
}
