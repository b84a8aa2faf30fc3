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
 * Inner equi-join of two inputs on pairs of key columns.
 *
 * <p>Output columns: the left key columns, then the left non-key columns, then
 * the right non-key columns, each renamed positionally by {@code resultNames}.
 */
public final class SortMergeJoinExec implements ProvablePlan {

    private final ProvablePlan left;
    private final ProvablePlan right;
    private final List<Integer> leftJoinColumnIndexes;
    private final List<Integer> rightJoinColumnIndexes;
    private final List<String> resultNames;

    /**
     * Creates a join.
     *
     * @param left the left input
     * @param right the right input
     * @param leftJoinColumnIndexes key positions in the left output
     * @param rightJoinColumnIndexes key positions in the right output, pairwise with the left ones
     * @param resultNames the output column names
     */
    public SortMergeJoinExec(ProvablePlan left, ProvablePlan right,
                             List<Integer> leftJoinColumnIndexes, List<Integer> rightJoinColumnIndexes,
                             List<String> resultNames) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
        if (leftJoinColumnIndexes.size() != rightJoinColumnIndexes.size()) {
            throw new IllegalArgumentException("left and right key lists must have the same size");
        }
        this.leftJoinColumnIndexes = Collections.unmodifiableList(new ArrayList<>(leftJoinColumnIndexes));
        this.rightJoinColumnIndexes = Collections.unmodifiableList(new ArrayList<>(rightJoinColumnIndexes));
        this.resultNames = Collections.unmodifiableList(new ArrayList<>(resultNames));
    }

    public ProvablePlan left() {
        return left;
    }

    public ProvablePlan right() {
        return right;
    }

    public List<Integer> leftJoinColumnIndexes() {
        return leftJoinColumnIndexes;
    }

    public List<Integer> rightJoinColumnIndexes() {
        return rightJoinColumnIndexes;
    }

    public List<String> resultNames() {
        return resultNames;
    }

    @Override
    public List<ColumnField> getColumnResultFields() {
        List<ColumnField> leftFields = left.getColumnResultFields();
        List<ColumnField> rightFields = right.getColumnResultFields();

        List<ColumnField> ordered = new ArrayList<>();
        for (int index : leftJoinColumnIndexes) {
            ordered.add(leftFields.get(index));
        }
        for (int i = 0; i < leftFields.size(); i++) {
            if (!leftJoinColumnIndexes.contains(i)) {
                ordered.add(leftFields.get(i));
            }
        }
        for (int i = 0; i < rightFields.size(); i++) {
            if (!rightJoinColumnIndexes.contains(i)) {
                ordered.add(rightFields.get(i));
            }
        }

        List<ColumnField> renamed = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            String name = i < resultNames.size() ? resultNames.get(i) : ordered.get(i).name();
            renamed.add(new ColumnField(name, ordered.get(i).dataType()));
        }
        return renamed;
    }

    @Override
    public Set<ColumnRef> getColumnReferences() {
        Set<ColumnRef> columns = new LinkedHashSet<>(left.getColumnReferences());
        columns.addAll(right.getColumnReferences());
        return columns;
    }

    @Override
    public Set<TableRef> getTableReferences() {
        Set<TableRef> tables = new LinkedHashSet<>(left.getTableReferences());
        tables.addAll(right.getTableReferences());
        return tables;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SortMergeJoinExec)) return false;
        SortMergeJoinExec that = (SortMergeJoinExec) obj;
        return left.equals(that.left) &&
               right.equals(that.right) &&
               leftJoinColumnIndexes.equals(that.leftJoinColumnIndexes) &&
               rightJoinColumnIndexes.equals(that.rightJoinColumnIndexes) &&
               resultNames.equals(that.resultNames);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, right, leftJoinColumnIndexes, rightJoinColumnIndexes, resultNames);
    }

    @Override
    public String toString() {
        return "SortMergeJoin(" + left + ", " + right + ", " + leftJoinColumnIndexes + ", "
            + rightJoinColumnIndexes + ", " + resultNames + ")";
    }
}
