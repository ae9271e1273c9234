/* (C)2026 */
package com.ammann.petrophysics.exception;

/**
 * Raised when a dataset is structurally broken: a curve whose length differs from the
 * depth axis, a decreasing depth axis, or a LAS document without curves or data.
 */
public class MalformedInputException extends ValidationException {

    public MalformedInputException(String message) {
        super(message);
    }

    public MalformedInputException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates an exception for a curve that is not aligned with the depth axis.
     */
    public static MalformedInputException lengthMismatch(String curveName, int expected, int actual) {
        return new MalformedInputException(
                String.format("Curve '%s' has %d samples but the depth axis has %d",
                        curveName, actual, expected));
    }
}
