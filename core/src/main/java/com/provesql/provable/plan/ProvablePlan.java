package com.provesql.provable.plan;

import com.provesql.column.ColumnField;
import com.provesql.column.ColumnRef;
import com.provesql.column.TableRef;

import java.util.List;
import java.util.Set;

/**
 * Node of a provable plan tree.
 *
 * <p>The set of nodes is closed. Leaves are {@link TableExec} and
 * {@link EmptyExec}; every other node derives its output schema from its
 * children. A plan is built once per query and never mutated.
 */
public sealed interface ProvablePlan
    permits EmptyExec, TableExec, ProjectionExec, FilterExec, GroupByExec, SliceExec,
            UnionExec, SortMergeJoinExec {

    /**
     * Returns the output schema of this node, in column order.
     *
     * @return the result fields
     */
    List<ColumnField> getColumnResultFields();

    /**
     * Returns every stored column this plan reads, in first-reference order.
     *
     * @return the column references
     */
    Set<ColumnRef> getColumnReferences();

    /**
     * Returns every table this plan reads, in first-reference order.
     *
     * @return the table references
     */
    Set<TableRef> getTableReferences();
}
