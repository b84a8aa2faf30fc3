package com.provesql.provable.plan;

import com.provesql.column.ColumnField;
import com.provesql.column.ColumnRef;
import com.provesql.column.TableRef;
import com.provesql.provable.expr.AliasedProvableExpr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Evaluates one named expression per output column over the rows of its input.
 */
public final class ProjectionExec implements ProvablePlan {

    private final List<AliasedProvableExpr> aliasedResults;
    private final ProvablePlan input;

    public ProjectionExec(List<AliasedProvableExpr> aliasedResults, ProvablePlan input) {
        this.aliasedResults = Collections.unmodifiableList(new ArrayList<>(aliasedResults));
        this.input = Objects.requireNonNull(input, "input must not be null");
    }

    public List<AliasedProvableExpr> aliasedResults() {
        return aliasedResults;
    }

    public ProvablePlan input() {
        return input;
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
        columns.addAll(input.getColumnReferences());
        return columns;
    }

    @Override
    public Set<TableRef> getTableReferences() {
        return input.getTableReferences();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ProjectionExec)) return false;
        ProjectionExec that = (ProjectionExec) obj;
        return aliasedResults.equals(that.aliasedResults) && input.equals(that.input);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aliasedResults, input);
    }

    @Override
    public String toString() {
        return "Projection(" + aliasedResults + ", " + input + ")";
    }
}
