package com.provesql.provable.expr;

import com.provesql.column.ColumnRef;
import com.provesql.column.ColumnType;

import java.util.Set;

/**
 * Node of a provable expression tree.
 *
 * <p>The set of nodes is closed. Every node is immutable and is built bottom-up
 * through a static {@code tryNew} smart constructor that validates operand
 * types, so an invalid node can never exist. The result type of each node is a
 * structural function of its variant and operands.
 */
public sealed interface ProvableExpression
    permits ColumnExpr, LiteralExpr, PlaceholderExpr, AndExpr, OrExpr, NotExpr, NegExpr,
            EqualsExpr, InequalityExpr, AddSubtractExpr, MultiplyExpr, CastExpr, ScalingCastExpr {

    /**
     * Returns the type of the value this expression produces.
     *
     * @return the result column type
     */
    ColumnType dataType();

    /**
     * Adds every column this expression references to {@code columns}.
     *
     * @param columns the accumulator, usually insertion-ordered
     */
    void collectColumnReferences(Set<ColumnRef> columns);
}
