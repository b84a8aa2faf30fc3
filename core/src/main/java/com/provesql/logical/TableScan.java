package com.provesql.logical;

import com.provesql.column.TableRef;
import com.provesql.expression.Expression;
import com.provesql.types.StructType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Scan of a stored table.
 *
 * <p>The analyzer pushes column pruning, predicates and row limits into the
 * scan:
 * <ul>
 *   <li>{@code projection}: indices into the table's full column list, in
 *       output order (null when the analyzer did not prune)</li>
 *   <li>{@code projectedSchema}: the output schema, naming each projected column</li>
 *   <li>{@code filters}: predicates over the table's full schema, implicitly ANDed</li>
 *   <li>{@code fetch}: maximum number of rows to return (null when unbounded)</li>
 * </ul>
 */
public final class TableScan extends LogicalPlan {

    private final TableRef tableName;
    private final List<Integer> projection;
    private final List<Expression> filters;
    private final Long fetch;

    /**
     * Creates a table scan.
     *
     * @param tableName the scanned table
     * @param projection projected column indices (may be null)
     * @param projectedSchema the output schema
     * @param filters pushed-down predicates (may be empty)
     * @param fetch the row limit (may be null)
     */
    public TableScan(TableRef tableName, List<Integer> projection, StructType projectedSchema,
                     List<Expression> filters, Long fetch) {
        super();
        this.tableName = Objects.requireNonNull(tableName, "tableName must not be null");
        this.projection = projection != null ? Collections.unmodifiableList(new ArrayList<>(projection)) : null;
        this.schema = Objects.requireNonNull(projectedSchema, "projectedSchema must not be null");
        this.filters = filters != null
            ? Collections.unmodifiableList(new ArrayList<>(filters))
            : Collections.emptyList();
        this.fetch = fetch;
    }

    /**
     * Creates an unfiltered, unlimited scan.
     *
     * @param tableName the scanned table
     * @param projection projected column indices
     * @param projectedSchema the output schema
     */
    public TableScan(TableRef tableName, List<Integer> projection, StructType projectedSchema) {
        this(tableName, projection, projectedSchema, null, null);
    }

    public TableRef tableName() {
        return tableName;
    }

    /**
     * Returns the projected column indices.
     *
     * @return the indices, or null if the scan is not pruned
     */
    public List<Integer> projection() {
        return projection;
    }

    public List<Expression> filters() {
        return filters;
    }

    /**
     * Returns the row limit.
     *
     * @return the limit, or null if unbounded
     */
    public Long fetch() {
        return fetch;
    }

    @Override
    public StructType inferSchema() {
        return schema;
    }

    @Override
    public String toString() {
        return String.format("TableScan(%s, projection=%s, filters=%s, fetch=%s)",
                             tableName, projection, filters, fetch);
    }
}
