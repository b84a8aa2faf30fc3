package com.provesql.expression;

import com.provesql.types.DataType;
import java.util.Objects;

/**
 * Expression representing a reference to a column.
 *
 * <p>Column references can be:
 * <ul>
 *   <li>Simple: "name", "age"</li>
 *   <li>Qualified: "users.name", "orders.id"</li>
 * </ul>
 *
 * <p>Resolution against a schema uses the column name only; the qualifier is
 * part of the display name.
 */
public final class ColumnReference implements Expression {

    private final String columnName;
    private final String qualifier;
    private final DataType dataType;
    private final boolean nullable;

    /**
     * Creates a column reference with a qualifier.
     *
     * @param columnName the column name
     * @param qualifier the table or alias qualifier (may be null)
     * @param dataType the data type of the column
     * @param nullable whether the column is nullable
     */
    public ColumnReference(String columnName, String qualifier, DataType dataType, boolean nullable) {
        this.columnName = Objects.requireNonNull(columnName, "columnName must not be null");
        this.qualifier = qualifier;
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
        this.nullable = nullable;
    }

    /**
     * Creates a non-nullable column reference without a qualifier.
     *
     * @param columnName the column name
     * @param dataType the data type of the column
     */
    public ColumnReference(String columnName, DataType dataType) {
        this(columnName, null, dataType, false);
    }

    public String columnName() {
        return columnName;
    }

    /**
     * Returns the qualifier (table or alias).
     *
     * @return the qualifier, or null if not qualified
     */
    public String qualifier() {
        return qualifier;
    }

    public boolean isQualified() {
        return qualifier != null;
    }

    /**
     * Returns the fully qualified column name.
     *
     * @return the qualified name (e.g., "table.column" or just "column")
     */
    public String qualifiedName() {
        if (qualifier != null) {
            return qualifier + "." + columnName;
        }
        return columnName;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return nullable;
    }

    @Override
    public String toSQL() {
        return qualifiedName();
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ColumnReference)) return false;
        ColumnReference that = (ColumnReference) obj;
        return nullable == that.nullable &&
               Objects.equals(columnName, that.columnName) &&
               Objects.equals(qualifier, that.qualifier) &&
               Objects.equals(dataType, that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columnName, qualifier, dataType, nullable);
    }

    // ==================== Factory Methods ====================

    /**
     * Creates a simple column reference.
     *
     * @param columnName the column name
     * @param dataType the data type
     * @return the column reference
     */
    public static ColumnReference of(String columnName, DataType dataType) {
        return new ColumnReference(columnName, dataType);
    }

    /**
     * Creates a qualified column reference.
     *
     * @param qualifier the table or alias name
     * @param columnName the column name
     * @param dataType the data type
     * @return the column reference
     */
    public static ColumnReference qualified(String qualifier, String columnName, DataType dataType) {
        return new ColumnReference(columnName, qualifier, dataType, false);
    }
}
