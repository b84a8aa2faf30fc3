package com.provesql.logical;

import com.provesql.types.StructType;

/**
 * A relation with no input table, e.g. the source of {@code SELECT 1} or the
 * result of a predicate folded to FALSE.
 */
public final class EmptyRelation extends LogicalPlan {

    private final boolean produceOneRow;

    /**
     * Creates an empty relation.
     *
     * @param produceOneRow whether the relation yields a single row with no columns
     * @param schema the output schema
     */
    public EmptyRelation(boolean produceOneRow, StructType schema) {
        super();
        this.produceOneRow = produceOneRow;
        this.schema = schema != null ? schema : StructType.EMPTY;
    }

    public EmptyRelation() {
        this(false, StructType.EMPTY);
    }

    public boolean produceOneRow() {
        return produceOneRow;
    }

    @Override
    public StructType inferSchema() {
        return StructType.EMPTY;
    }

    @Override
    public String toString() {
        return String.format("EmptyRelation(produceOneRow=%s)", produceOneRow);
    }
}
