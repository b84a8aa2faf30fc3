package com.provesql.compiler;

import com.provesql.column.ColumnField;
import com.provesql.column.TableRef;

import java.util.List;

/**
 * Read-only source of table schemas.
 *
 * <p>Implementations may be called repeatedly for the same table; any caching
 * belongs to the implementation.
 */
public interface SchemaAccessor {

    /**
     * Returns the columns of a table in physical order.
     *
     * @param table the table
     * @return the columns, or an empty list if the table is unknown
     */
    List<ColumnField> lookupSchema(TableRef table);
}
