package com.provesql.provable.plan;

import com.provesql.column.ColumnField;
import com.provesql.column.ColumnRef;
import com.provesql.column.ColumnType;
import com.provesql.column.TableRef;
import com.provesql.exception.AnalyzeException;
import com.provesql.provable.expr.AliasedProvableExpr;
import com.provesql.provable.expr.ColumnExpr;
import com.provesql.provable.expr.ProvableExpression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Groups the filtered rows of a stored table by a list of columns, producing
 * the group columns, one SUM per aggregated expression, and the row count.
 *
 * <p>Output: group columns ++ (alias, sum type)... ++ (count alias, BIGINT).
 */
public final class GroupByExec implements ProvablePlan {

    private final List<ColumnExpr> groupByExprs;
    private final List<AliasedProvableExpr> sumExprs;
    private final String countAlias;
    private final TableRef table;
    private final ProvableExpression where;

    private GroupByExec(List<ColumnExpr> groupByExprs, List<AliasedProvableExpr> sumExprs, String countAlias,
                        TableRef table, ProvableExpression where) {
        this.groupByExprs = groupByExprs;
        this.sumExprs = sumExprs;
        this.countAlias = countAlias;
        this.table = table;
        this.where = where;
    }

    /**
     * Creates a group-by.
     *
     * @param groupByExprs the grouping columns
     * @param sumExprs the summed expressions with their output names
     * @param countAlias the output name of the row count
     * @param table the grouped table
     * @param where the row predicate
     * @return the group-by
     * @throws AnalyzeException {@code INVALID_DATA_TYPE} unless the predicate is Boolean
     */
    public static GroupByExec tryNew(List<ColumnExpr> groupByExprs, List<AliasedProvableExpr> sumExprs,
                                     String countAlias, TableRef table, ProvableExpression where) {
        Objects.requireNonNull(countAlias, "countAlias must not be null");
        Objects.requireNonNull(table, "table must not be null");
        if (!ColumnType.BOOLEAN.equals(where.dataType())) {
            throw AnalyzeException.invalidDataType(ColumnType.BOOLEAN, where.dataType());
        }
        return new GroupByExec(
            Collections.unmodifiableList(new ArrayList<>(groupByExprs)),
            Collections.unmodifiableList(new ArrayList<>(sumExprs)),
            countAlias, table, where);
    }

    public List<ColumnExpr> groupByExprs() {
        return groupByExprs;
    }

    public List<AliasedProvableExpr> sumExprs() {
        return sumExprs;
    }

    public String countAlias() {
        return countAlias;
    }

    public TableRef table() {
        return table;
    }

    public ProvableExpression where() {
        return where;
    }

    @Override
    public List<ColumnField> getColumnResultFields() {
        List<ColumnField> fields = new ArrayList<>();
        for (ColumnExpr column : groupByExprs) {
            fields.add(new ColumnField(column.columnName(), column.dataType()));
        }
        for (AliasedProvableExpr sum : sumExprs) {
            fields.add(new ColumnField(sum.alias(), sum.expr().dataType()));
        }
        fields.add(new ColumnField(countAlias, ColumnType.BIGINT));
        return fields;
    }

    @Override
    public Set<ColumnRef> getColumnReferences() {
        Set<ColumnRef> columns = new LinkedHashSet<>();
        for (ColumnExpr column : groupByExprs) {
            columns.add(column.columnRef());
        }
        for (AliasedProvableExpr sum : sumExprs) {
            sum.expr().collectColumnReferences(columns);
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
        if (!(obj instanceof GroupByExec)) return false;
        GroupByExec that = (GroupByExec) obj;
        return groupByExprs.equals(that.groupByExprs) &&
               sumExprs.equals(that.sumExprs) &&
               countAlias.equals(that.countAlias) &&
               table.equals(that.table) &&
               where.equals(that.where);
    }

    @Override
    public int hashCode() {
        return Objects.hash(groupByExprs, sumExprs, countAlias, table, where);
    }

    @Override
    public String toString() {
        return "GroupBy(" + groupByExprs + ", " + sumExprs + ", " + countAlias + ", " + table + ", " + where + ")";
    }
}
