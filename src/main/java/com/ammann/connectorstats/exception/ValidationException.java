package com.ammann.connectorstats.exception;

/**
 * Exception indicating that a caller-supplied parameter or request body does not meet the
 * constraints of the requested operation.
 *
 * <p>Mapped to HTTP 400 (Bad Request) by {@link GlobalExceptionHandler}. Degenerate
 * statistics data (empty streams, quiet periods, flat axis domains) is never reported this
 * way; only malformed requests are.
 */
public class ValidationException extends ApiException {

    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";

    public ValidationException(String message) {
        super(VALIDATION_ERROR, message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(VALIDATION_ERROR, message, cause);
    }

    /**
     * Creates validation exception for a missing request element.
     */
    public static ValidationException missing(String name) {
        return new ValidationException(String.format("Missing required '%s'", name));
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                String.format("Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }
}
