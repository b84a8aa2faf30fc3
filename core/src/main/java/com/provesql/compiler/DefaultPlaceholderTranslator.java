package com.provesql.compiler;

import com.provesql.column.ColumnType;
import com.provesql.config.PlannerConfig;
import com.provesql.exception.PlannerException;
import com.provesql.provable.expr.PlaceholderExpr;
import com.provesql.types.DataType;
import com.provesql.types.TypeMapper;

/**
 * Translates positional parameters of the form {@code $N}, N &gt;= 1.
 */
public class DefaultPlaceholderTranslator implements PlaceholderTranslator {

    @Override
    public PlaceholderExpr translate(String id, DataType declaredType) {
        int index = parseIndex(id);
        if (declaredType == null) {
            throw PlannerException.untypedPlaceholder(id);
        }
        ColumnType columnType = TypeMapper.toColumnType(declaredType);
        return PlaceholderExpr.tryNew(index, columnType);
    }

    private static int parseIndex(String id) {
        if (id == null || !id.startsWith(PlannerConfig.PLACEHOLDER_PREFIX)) {
            throw PlannerException.invalidPlaceholderId(id);
        }
        String digits = id.substring(PlannerConfig.PLACEHOLDER_PREFIX.length());
        if (digits.isEmpty() || !digits.chars().allMatch(Character::isDigit)) {
            throw PlannerException.invalidPlaceholderId(id);
        }
        int index;
        try {
            index = Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new PlannerException(PlannerException.Kind.INVALID_PLACEHOLDER_ID,
                "Placeholder id " + id + " is out of range", id, e);
        }
        if (index < 1) {
            throw PlannerException.invalidPlaceholderId(id);
        }
        return index;
    }
}
