package com.provesql.provable.plan;

import com.provesql.column.ColumnField;
import com.provesql.column.ColumnRef;
import com.provesql.column.TableRef;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Relation with no columns and no input table.
 */
public final class EmptyExec implements ProvablePlan {

    @Override
    public List<ColumnField> getColumnResultFields() {
        return Collections.emptyList();
    }

    @Override
    public Set<ColumnRef> getColumnReferences() {
        return Collections.emptySet();
    }

    @Override
    public Set<TableRef> getTableReferences() {
        return Collections.emptySet();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof EmptyExec;
    }

    @Override
    public int hashCode() {
        return EmptyExec.class.hashCode();
    }

    @Override
    public String toString() {
        return "Empty";
    }
}
