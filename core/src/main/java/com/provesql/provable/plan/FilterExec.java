package com.provesql.provable.plan;

import com.provesql.column.ColumnField;
import com.provesql.column.ColumnRef;
import com.provesql.column.ColumnType;
import com.provesql.column.TableRef;
import com.provesql.exception.AnalyzeException;
import com.provesql.provable.expr.AliasedProvableExpr;
import com.provesql.provable.expr.ProvableExpression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Selects the rows of a stored table satisfying a predicate and evaluates one
 * named expression per output column over them.
 */
public final class FilterExec implements ProvablePlan {

    private final List<AliasedProvableExpr> aliasedResults;
    private final TableRef table;
    private final ProvableExpression where;

    private FilterExec(List<AliasedProvableExpr> aliasedResults, TableRef table, ProvableExpression where) {
        this.aliasedResults = aliasedResults;
        this.table = table;
        this.where = where;
    }

    /**
     * Creates a filter.
     *
     * @param aliasedResults the output expressions
     * @param table the filtered table
     * @param where the predicate
     * @return the filter
     * @throws AnalyzeException {@code INVALID_DATA_TYPE} unless the predicate is Boolean
     */
    public static FilterExec tryNew(List<AliasedProvableExpr> aliasedResults, TableRef table,
                                    ProvableExpression where) {
        Objects.requireNonNull(table, "table must not be null");
        if (!ColumnType.BOOLEAN.equals(where.dataType())) {
            throw AnalyzeException.invalidDataType(ColumnType.BOOLEAN, where.dataType());
        }
        return new FilterExec(Collections.unmodifiableList(new ArrayList<>(aliasedResults)), table, where);
    }

    public List<AliasedProvableExpr> aliasedResults() {
        return aliasedResults;
    }

    public TableRef table() {
        return table;
    }

    public ProvableExpression where() {
        return where;
    }

    @Override
    public List<ColumnField> getColumnResultFields() {
        List<ColumnField> fields = new ArrayList<>(aliasedResults.size());
        for (AliasedProvableExpr aliased : aliasedResults) {
            fields.add(new ColumnField(aliased.alias(), aliased.expr().dataType()));
        }
        return fields;
    }

    @Override
    public Set<ColumnRef> getColumnReferences() {
        Set<ColumnRef> columns = new LinkedHashSet<>();
        for (AliasedProvableExpr aliased : aliasedResults) {
            aliased.expr().collectColumnReferences(columns);
        }
        where.collectColumnReferences(columns);
        return columns;
    }

    @Override
    public Set<TableRef> getTableReferences() {
        Set<TableRef> tables = new LinkedHashSet<>();
        tables.add(table);
        return tables;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FilterExec)) return false;
        FilterExec that = (FilterExec) obj;
        return aliasedResults.equals(that.aliasedResults) &&
               table.equals(that.table) &&
               where.equals(that.where);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aliasedResults, table, where);
    }

    @Override
    public String toString() {
        return "Filter(" + aliasedResults + ", " + table + ", " + where + ")";
    }
}
