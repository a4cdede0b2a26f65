package org.lrcalc.frontend;

import org.lrcalc.api.ExpressionErrorCode;

/**
 * Unchecked failure raised inside the lexer, the parser and the semantic actions.
 * The engine converts it into an {@link org.lrcalc.api.ExpressionException} at the API boundary.
 */
public class ExpressionError extends RuntimeException {

    private final ExpressionErrorCode code;

    /**
     * @param code The error code classifying the failure.
     * @param message The detail message.
     */
    public ExpressionError(ExpressionErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    /**
     * @param code The error code classifying the failure.
     * @param message The detail message.
     * @param cause The underlying exception.
     */
    public ExpressionError(ExpressionErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * @return The error code classifying the failure.
     */
    public ExpressionErrorCode getCode() {
        return code;
    }
}
