package com.provesql.expression;

import com.provesql.types.DataType;
import com.provesql.types.LongType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Expression representing an aggregate function call such as {@code SUM(amount)}
 * or {@code COUNT(*)}.
 *
 * <p>{@code COUNT(*)} carries a single {@link StarExpression} argument. The
 * display name ({@link #toSQL()}) upper-cases the function name, so
 * {@code sum(b)} and {@code SUM(b)} name the same output column.
 */
public final class AggregateFunction implements Expression {

    private final String function;
    private final List<Expression> arguments;
    private final boolean distinct;
    private final DataType resultType;

    /**
     * Creates an aggregate function call.
     *
     * @param function the aggregate function name (COUNT, SUM, AVG, MIN, MAX, etc.)
     * @param arguments the argument expressions
     * @param distinct whether to aggregate only distinct values
     * @param resultType the analyzer's result type (may be null)
     */
    public AggregateFunction(String function, List<Expression> arguments, boolean distinct, DataType resultType) {
        this.function = Objects.requireNonNull(function, "function must not be null");
        this.arguments = Collections.unmodifiableList(
            new ArrayList<>(Objects.requireNonNull(arguments, "arguments must not be null")));
        this.distinct = distinct;
        this.resultType = resultType;
    }

    /**
     * Returns the aggregate function name as written.
     *
     * @return the function name (e.g., "count", "SUM")
     */
    public String function() {
        return function;
    }

    public List<Expression> arguments() {
        return arguments;
    }

    public boolean isDistinct() {
        return distinct;
    }

    @Override
    public DataType dataType() {
        if (resultType != null) {
            return resultType;
        }
        if (function.equalsIgnoreCase("COUNT")) {
            return LongType.get();
        }
        return arguments.isEmpty() ? null : arguments.get(0).dataType();
    }

    @Override
    public boolean nullable() {
        return !function.equalsIgnoreCase("COUNT");
    }

    @Override
    public String toSQL() {
        StringBuilder sql = new StringBuilder();
        sql.append(function.toUpperCase(Locale.ROOT));
        sql.append("(");
        if (distinct) {
            sql.append("DISTINCT ");
        }
        sql.append(arguments.stream().map(Expression::toSQL).collect(Collectors.joining(", ")));
        sql.append(")");
        return sql.toString();
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AggregateFunction)) return false;
        AggregateFunction that = (AggregateFunction) obj;
        return distinct == that.distinct &&
               function.equals(that.function) &&
               arguments.equals(that.arguments) &&
               Objects.equals(resultType, that.resultType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, arguments, distinct, resultType);
    }

    // ==================== Factory Methods ====================

    public static AggregateFunction sum(Expression argument) {
        return new AggregateFunction("SUM", List.of(argument), false, null);
    }

    public static AggregateFunction count(Expression argument) {
        return new AggregateFunction("COUNT", List.of(argument), false, LongType.get());
    }

    public static AggregateFunction countStar() {
        return count(new StarExpression());
    }
}
