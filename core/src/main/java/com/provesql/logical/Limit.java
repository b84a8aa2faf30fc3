package com.provesql.logical;

import com.provesql.types.StructType;

/**
 * Logical plan node representing LIMIT / OFFSET.
 *
 * <p>{@code skip} rows are discarded from the front; at most {@code fetch}
 * rows are returned after that (no fetch means unbounded).
 */
public final class Limit extends LogicalPlan {

    private final long skip;
    private final Long fetch;

    /**
     * Creates a limit node.
     *
     * @param child the child node
     * @param skip the number of leading rows to discard (non-negative)
     * @param fetch the maximum number of rows to return (may be null)
     */
    public Limit(LogicalPlan child, long skip, Long fetch) {
        super(child);
        if (skip < 0) {
            throw new IllegalArgumentException("skip must be non-negative, got: " + skip);
        }
        if (fetch != null && fetch < 0) {
            throw new IllegalArgumentException("fetch must be non-negative, got: " + fetch);
        }
        this.skip = skip;
        this.fetch = fetch;
    }

    public long skip() {
        return skip;
    }

    /**
     * Returns the row limit.
     *
     * @return the limit, or null if unbounded
     */
    public Long fetch() {
        return fetch;
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public StructType inferSchema() {
        return child().schema();
    }

    @Override
    public String toString() {
        return String.format("Limit(skip=%d, fetch=%s)", skip, fetch);
    }
}
