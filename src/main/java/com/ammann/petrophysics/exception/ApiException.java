package com.ammann.petrophysics.exception;

/**
 * Base unchecked exception for all structural errors raised by the petrophysics core
 * and its tool surface.
 *
 * <p>Subclasses represent the error taxonomy (malformed input, unresolvable curves,
 * insufficient data, invalid parameters) and are mapped to HTTP status codes by
 * {@link GlobalExceptionHandler}. Per-sample physical implausibility is never an
 * exception; it is represented by the missing-value sentinel in derived curves.
 */
public class ApiException extends RuntimeException
{
    public ApiException(String message, Throwable cause) {
        super(message, cause);
    }
    public ApiException(String message) {
        super(message);
    }

    public ApiException(Throwable cause) {
        super(cause);
    }
}
