package com.provesql.exception;

/**
 * Exception thrown when a source plan or expression cannot be compiled into a
 * provable plan.
 *
 * <p>The exception carries the offending fragment (a source expression, plan
 * node, data type, operator or identifier) so that callers can report exactly
 * which part of the query falls outside the provable subset.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       ProvablePlan plan = compiler.compile(logicalPlan);
 *   } catch (PlannerException e) {
 *       System.err.println(e.getUserMessage());
 *       System.err.println(e.getTechnicalMessage());
 *   }
 * </pre>
 *
 * @see com.provesql.compiler.PlanCompiler
 * @see com.provesql.compiler.ExpressionCompiler
 */
public class PlannerException extends RuntimeException {

    /**
     * Failure categories.
     */
    public enum Kind {
        COLUMN_NOT_FOUND,
        UNSUPPORTED_DATA_TYPE,
        UNSUPPORTED_BINARY_OPERATOR,
        UNSUPPORTED_LOGICAL_EXPRESSION,
        UNSUPPORTED_LOGICAL_PLAN,
        UNSUPPORTED_AGGREGATE_FUNCTION,
        INVALID_PLACEHOLDER_ID,
        UNTYPED_PLACEHOLDER,
        ANALYZE_ERROR
    }

    private final Kind kind;
    private final Object fragment;

    /**
     * Creates a planner exception.
     *
     * @param kind the failure category
     * @param message the error message
     * @param fragment the offending fragment (may be null)
     */
    public PlannerException(Kind kind, String message, Object fragment) {
        super(message);
        this.kind = kind;
        this.fragment = fragment;
    }

    /**
     * Creates a planner exception with a cause.
     *
     * @param kind the failure category
     * @param message the error message
     * @param fragment the offending fragment (may be null)
     * @param cause the underlying cause
     */
    public PlannerException(Kind kind, String message, Object fragment, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.fragment = fragment;
    }

    public static PlannerException columnNotFound(Object column) {
        return new PlannerException(Kind.COLUMN_NOT_FOUND, "Column not found: " + column, column);
    }

    public static PlannerException unsupportedDataType(Object dataType) {
        return new PlannerException(Kind.UNSUPPORTED_DATA_TYPE, "Unsupported datatype: " + dataType, dataType);
    }

    public static PlannerException unsupportedBinaryOperator(Object operator) {
        return new PlannerException(Kind.UNSUPPORTED_BINARY_OPERATOR,
            "Binary operator " + operator + " is not supported", operator);
    }

    public static PlannerException unsupportedLogicalExpression(Object expression) {
        return new PlannerException(Kind.UNSUPPORTED_LOGICAL_EXPRESSION,
            "Logical expression " + expression + " is not supported", expression);
    }

    public static PlannerException unsupportedLogicalPlan(Object plan) {
        return new PlannerException(Kind.UNSUPPORTED_LOGICAL_PLAN,
            "LogicalPlan is not supported: " + plan, plan);
    }

    public static PlannerException unsupportedAggregateFunction(Object function) {
        return new PlannerException(Kind.UNSUPPORTED_AGGREGATE_FUNCTION,
            "Aggregate function " + function + " is not supported", function);
    }

    public static PlannerException invalidPlaceholderId(String id) {
        return new PlannerException(Kind.INVALID_PLACEHOLDER_ID, "Placeholder id " + id + " is invalid", id);
    }

    public static PlannerException untypedPlaceholder(Object placeholder) {
        return new PlannerException(Kind.UNTYPED_PLACEHOLDER,
            "Placeholder " + placeholder + " is untyped", placeholder);
    }

    /**
     * Wraps an analyze failure raised while building a provable expression.
     *
     * @param cause the analyze failure
     * @param fragment the source fragment being compiled
     * @return the exception
     */
    public static PlannerException analyzeError(AnalyzeException cause, Object fragment) {
        return new PlannerException(Kind.ANALYZE_ERROR, "Analyze error: " + cause.getMessage(), fragment, cause);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Returns the offending fragment.
     *
     * @return the fragment, or null if not available
     */
    public Object fragment() {
        return fragment;
    }

    /**
     * Returns a user-friendly error message.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        switch (kind) {
            case COLUMN_NOT_FOUND:
                return "The query references a column that does not exist: " + fragment + ".";
            case UNSUPPORTED_DATA_TYPE:
                return "The query uses a data type that cannot be proven: " + fragment + ".";
            case UNSUPPORTED_BINARY_OPERATOR:
                return "The operator " + fragment + " is not supported in provable queries.";
            case UNSUPPORTED_LOGICAL_EXPRESSION:
                return "This expression is not supported in provable queries. " +
                       "Subqueries, window functions and CASE expressions cannot be proven.";
            case UNSUPPORTED_LOGICAL_PLAN:
                return "This query shape is not supported in provable queries. " +
                       "Please simplify the query.";
            case UNSUPPORTED_AGGREGATE_FUNCTION:
                return "Only SUM and COUNT aggregates are supported in provable queries.";
            case INVALID_PLACEHOLDER_ID:
            case UNTYPED_PLACEHOLDER:
                return "Query parameters must be written as $1, $2, ... and must have a known type.";
            case ANALYZE_ERROR:
            default:
                return "The query could not be analyzed: " + getMessage();
        }
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Planning Failed\n");
        sb.append("Kind: ").append(kind).append("\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (fragment != null) {
            sb.append("Fragment Type: ").append(fragment.getClass().getName()).append("\n");
            sb.append("Fragment: ").append(fragment).append("\n");
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }
}
