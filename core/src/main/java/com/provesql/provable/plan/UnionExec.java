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
 * Concatenates the rows of two or more inputs (UNION ALL).
 */
public final class UnionExec implements ProvablePlan {

    private final List<ProvablePlan> inputs;
    private final List<ColumnField> schema;

    /**
     * Creates a union.
     *
     * @param inputs the inputs (at least two)
     * @param schema the unified output schema
     */
    public UnionExec(List<ProvablePlan> inputs, List<ColumnField> schema) {
        if (inputs.size() < 2) {
            throw new IllegalArgumentException("union requires at least two inputs, got: " + inputs.size());
        }
        this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
        this.schema = Collections.unmodifiableList(new ArrayList<>(schema));
    }

    public List<ProvablePlan> inputs() {
        return inputs;
    }

    @Override
    public List<ColumnField> getColumnResultFields() {
        return schema;
    }

    @Override
    public Set<ColumnRef> getColumnReferences() {
        Set<ColumnRef> columns = new LinkedHashSet<>();
        for (ProvablePlan input : inputs) {
            columns.addAll(input.getColumnReferences());
        }
        return columns;
    }

    @Override
    public Set<TableRef> getTableReferences() {
        Set<TableRef> tables = new LinkedHashSet<>();
        for (ProvablePlan input : inputs) {
            tables.addAll(input.getTableReferences());
        }
        return tables;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof UnionExec)) return false;
        UnionExec that = (UnionExec) obj;
        return inputs.equals(that.inputs) && schema.equals(that.schema);
    }

    @Override
    public int hashCode() {
        return Objects.hash(inputs, schema);
    }

    @Override
    public String toString() {
        return "Union(" + inputs + ", " + schema + ")";
    }
}
