package com.provesql.expression;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Utility methods for inspecting expressions.
 */
public final class ExpressionUtils {

    private ExpressionUtils() {}

    /**
     * Collects the names of every column an expression references.
     *
     * <p>The traversal descends through binary expressions, NOT, aliases, casts
     * and aggregate-call argument lists only; every other node kind contributes
     * nothing. Names are returned in order of first occurrence, without
     * duplicates.
     *
     * @param expr the expression to inspect
     * @return the referenced column names, in first-occurrence order
     */
    public static Set<String> columnIdentifiers(Expression expr) {
        Set<String> identifiers = new LinkedHashSet<>();
        collectColumnIdentifiers(expr, identifiers);
        return Collections.unmodifiableSet(identifiers);
    }

    private static void collectColumnIdentifiers(Expression expr, Set<String> identifiers) {
        if (expr instanceof ColumnReference column) {
            identifiers.add(column.columnName());
        } else if (expr instanceof BinaryExpression bin) {
            collectColumnIdentifiers(bin.left(), identifiers);
            collectColumnIdentifiers(bin.right(), identifiers);
        } else if (expr instanceof UnaryExpression unary) {
            if (unary.operator() == UnaryExpression.Operator.NOT) {
                collectColumnIdentifiers(unary.operand(), identifiers);
            }
        } else if (expr instanceof AliasExpression alias) {
            collectColumnIdentifiers(alias.expression(), identifiers);
        } else if (expr instanceof CastExpression cast) {
            collectColumnIdentifiers(cast.expression(), identifiers);
        } else if (expr instanceof AggregateFunction aggregate) {
            for (Expression argument : aggregate.arguments()) {
                collectColumnIdentifiers(argument, identifiers);
            }
        }
        // Literals, placeholders, star, IN lists, subqueries: nothing to collect
    }
}
