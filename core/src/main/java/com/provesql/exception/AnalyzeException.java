package com.provesql.exception;

import com.provesql.column.ColumnType;

/**
 * Exception thrown by a provable expression smart constructor when an operand
 * violates the node's own contract, for example {@code NOT} over a non-Boolean
 * operand or a placeholder with id 0.
 */
public class AnalyzeException extends RuntimeException {

    /**
     * Failure categories.
     */
    public enum Kind {
        INVALID_DATA_TYPE,
        DATA_TYPE_MISMATCH,
        INVALID_PLACEHOLDER_ID
    }

    private final Kind kind;

    private AnalyzeException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    private AnalyzeException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Creates an exception for an operand whose type is not the one the node requires.
     *
     * @param expected the required type
     * @param actual the operand type
     * @return the exception
     */
    public static AnalyzeException invalidDataType(ColumnType expected, ColumnType actual) {
        return new AnalyzeException(Kind.INVALID_DATA_TYPE,
            String.format("Expression has datatype %s, which was not valid, expected %s", actual, expected));
    }

    /**
     * Same as {@link #invalidDataType(ColumnType, ColumnType)}, keeping the
     * type arithmetic failure that detected the mismatch.
     *
     * @param expected the required type
     * @param actual the operand type
     * @param cause the underlying failure
     * @return the exception
     */
    public static AnalyzeException invalidDataType(ColumnType expected, ColumnType actual,
                                                   ColumnOperationException cause) {
        return new AnalyzeException(Kind.INVALID_DATA_TYPE,
            String.format("Expression has datatype %s, which was not valid, expected %s", actual, expected),
            cause);
    }

    public static AnalyzeException dataTypeMismatch(ColumnType left, ColumnType right) {
        return new AnalyzeException(Kind.DATA_TYPE_MISMATCH,
            String.format("Left side has '%s' type but right side has '%s' type", left, right));
    }

    public static AnalyzeException invalidPlaceholderId(int id) {
        return new AnalyzeException(Kind.INVALID_PLACEHOLDER_ID,
            "Placeholder id must be at least 1, got: " + id);
    }

    public Kind kind() {
        return kind;
    }
}
