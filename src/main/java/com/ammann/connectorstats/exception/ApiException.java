package com.ammann.connectorstats.exception;

/**
 * Base unchecked exception for errors reported to API clients.
 *
 * <p>Every instance carries the machine-readable error code that {@link GlobalExceptionHandler}
 * writes into the {@code code} field of the error response.
 */
public class ApiException extends RuntimeException
{
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private final String errorCode;

    public ApiException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ApiException(String message) {
        this(INTERNAL_ERROR, message, null);
    }

    public String getErrorCode() {
        return errorCode;
    }
}
