package com.ammann.petrophysics.exception;

/**
 * Exception indicating that a client-supplied parameter or dataset does not meet
 * the structural constraints of the requested operation.
 *
 * <p>Mapped to HTTP 400 (Bad Request) by {@link GlobalExceptionHandler}. The concrete
 * failures are {@link MalformedInputException} and {@link InvalidParameterException}.
 */
public class ValidationException extends ApiException {

    public ValidationException(String message) {
        super(message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
