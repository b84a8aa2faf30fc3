package com.provesql.provable.plan;

import com.provesql.column.ColumnField;
import com.provesql.column.ColumnRef;
import com.provesql.column.TableRef;

import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Discards the first {@code skip} rows of its input and keeps at most
 * {@code fetch} of the rest.
 */
public final class SliceExec implements ProvablePlan {

    private final ProvablePlan input;
    private final long skip;
    private final OptionalLong fetch;

    /**
     * Creates a slice.
     *
     * @param input the input plan
     * @param skip the number of leading rows to discard
     * @param fetch the maximum number of rows to keep, empty for unbounded
     */
    public SliceExec(ProvablePlan input, long skip, OptionalLong fetch) {
        this.input = Objects.requireNonNull(input, "input must not be null");
        if (skip < 0) {
            throw new IllegalArgumentException("skip must be non-negative, got: " + skip);
        }
        this.skip = skip;
        this.fetch = Objects.requireNonNull(fetch, "fetch must not be null");
    }

    public ProvablePlan input() {
        return input;
    }

    public long skip() {
        return skip;
    }

    public OptionalLong fetch() {
        return fetch;
    }

    @Override
    public List<ColumnField> getColumnResultFields() {
        return input.getColumnResultFields();
    }

    @Override
    public Set<ColumnRef> getColumnReferences() {
        return input.getColumnReferences();
    }

    @Override
    public Set<TableRef> getTableReferences() {
        return input.getTableReferences();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SliceExec)) return false;
        SliceExec that = (SliceExec) obj;
        return skip == that.skip && input.equals(that.input) && fetch.equals(that.fetch);
    }

    @Override
    public int hashCode() {
        return Objects.hash(input, skip, fetch);
    }

    @Override
    public String toString() {
        return "Slice(" + input + ", skip=" + skip + ", fetch=" + fetch + ")";
    }
}
