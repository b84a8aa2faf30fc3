package com.provesql.compiler;

import com.provesql.provable.expr.PlaceholderExpr;
import com.provesql.types.DataType;

/**
 * Turns a query parameter into a provable placeholder.
 */
public interface PlaceholderTranslator {

    /**
     * Translates a placeholder.
     *
     * @param id the placeholder text, e.g. {@code $1}
     * @param declaredType the parameter type, or null if the analyzer left it unresolved
     * @return the provable placeholder
     * @throws com.provesql.exception.PlannerException if the id is malformed or the type is missing
     */
    PlaceholderExpr translate(String id, DataType declaredType);
}
