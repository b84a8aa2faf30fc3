package com.provesql.provable.plan;

import com.provesql.column.ColumnField;
import com.provesql.column.ColumnRef;
import com.provesql.column.TableRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Every column of a stored table, in physical order.
 */
public final class TableExec implements ProvablePlan {

    private final TableRef tableRef;
    private final List<ColumnField> schema;

    public TableExec(TableRef tableRef, List<ColumnField> schema) {
        this.tableRef = Objects.requireNonNull(tableRef, "tableRef must not be null");
        this.schema = Collections.unmodifiableList(new ArrayList<>(schema));
    }

    public TableRef tableRef() {
        return tableRef;
    }

    public List<ColumnField> schema() {
        return schema;
    }

    @Override
    public List<ColumnField> getColumnResultFields() {
        return schema;
    }

    @Override
    public Set<ColumnRef> getColumnReferences() {
        Set<ColumnRef> columns = new LinkedHashSet<>();
        for (ColumnField field : schema) {
            columns.add(new ColumnRef(tableRef, field.name(), field.dataType()));
        }
        return columns;
    }

    @Override
    public Set<TableRef> getTableReferences() {
        Set<TableRef> tables = new LinkedHashSet<>();
        tables.add(tableRef);
        return tables;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TableExec)) return false;
        TableExec that = (TableExec) obj;
        return tableRef.equals(that.tableRef) && schema.equals(that.schema);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tableRef, schema);
    }

    @Override
    public String toString() {
        return "Table(" + tableRef + ", " + schema + ")";
    }
}
