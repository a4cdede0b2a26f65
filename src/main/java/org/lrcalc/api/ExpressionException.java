package org.lrcalc.api;

/**
 * An exception that is thrown when an expression cannot be evaluated.
 * <p>
 * It is part of the public API and hides the internal exception types of the engine.
 */
public class ExpressionException extends Exception {

    private final ExpressionErrorCode code;
    private final String expression;

    /**
     * Constructs a new expression exception.
     * @param code The error code classifying the failure.
     * @param message The detail message.
     * @param expression The expression that failed to evaluate.
     */
    public ExpressionException(ExpressionErrorCode code, String message, String expression) {
        this(code, message, expression, null);
    }

    /**
     * Constructs a new expression exception with a cause.
     * @param code The error code classifying the failure.
     * @param message The detail message.
     * @param expression The expression that failed to evaluate.
     * @param cause The cause.
     */
    public ExpressionException(ExpressionErrorCode code, String message, String expression, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.expression = expression;
    }

    /**
     * @return The error code classifying the failure.
     */
    public ExpressionErrorCode getCode() {
        return code;
    }

    /**
     * @return The expression that failed to evaluate.
     */
    public String getExpression() {
        return expression;
    }
}
