package com.provesql.expression;

import com.provesql.types.DataType;
import java.util.Objects;

/**
 * Expression that gives an alias (name) to another expression.
 *
 * <p>Examples:
 * <pre>
 *   price * quantity AS total
 *   SUM(amount) AS total_amount
 *   first_name AS fname
 * </pre>
 */
public final class AliasExpression implements Expression {

    private final Expression expression;
    private final String alias;

    /**
     * Creates an alias expression.
     *
     * @param expression the expression to alias
     * @param alias the alias name
     */
    public AliasExpression(Expression expression, String alias) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.alias = Objects.requireNonNull(alias, "alias must not be null");
    }

    public Expression expression() {
        return expression;
    }

    public String alias() {
        return alias;
    }

    @Override
    public DataType dataType() {
        return expression.dataType();
    }

    @Override
    public boolean nullable() {
        return expression.nullable();
    }

    @Override
    public String toSQL() {
        return String.format("%s AS %s", expression.toSQL(), alias);
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AliasExpression)) return false;
        AliasExpression that = (AliasExpression) obj;
        return Objects.equals(expression, that.expression) &&
               Objects.equals(alias, that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, alias);
    }
}
