package com.provesql.provable.expr;

import java.util.Objects;

/**
 * A provable expression together with the name of the output column it produces.
 */
public record AliasedProvableExpr(ProvableExpression expr, String alias) {

    public AliasedProvableExpr {
        Objects.requireNonNull(expr, "expr must not be null");
        Objects.requireNonNull(alias, "alias must not be null");
    }

    @Override
    public String toString() {
        return expr + " AS " + alias;
    }
}
