/* (C)2026 */
package com.ammann.petrophysics.exception;

/**
 * Raised when the number of valid samples is below the minimum a computation needs.
 *
 * <p>Mapped to HTTP 422 (Unprocessable Entity) by {@link GlobalExceptionHandler}.
 */
public class InsufficientDataException extends ApiException
{
    private final int required;
    private final int actual;

    public InsufficientDataException(String message, int required, int actual)
    {
        super(message);
        this.required = required;
        this.actual = actual;
    }

    /**
     * Creates an exception for too few valid samples of the named quantity.
     */
    public static InsufficientDataException insufficientData(String resourceType, int required, int actual)
    {
        return new InsufficientDataException(
                String.format("Insufficient %s: need at least %d, but got %d",
                        resourceType, required, actual),
                required, actual);
    }

    public int getRequired() { return required; }

    public int getActual() { return actual; }
}
