/* (C)2026 */
package com.ammann.petrophysics.exception;

/**
 * Raised when a physical constant or analysis setting lies outside its declared range.
 * Values are never clamped silently.
 */
public class InvalidParameterException extends ValidationException {

    public InvalidParameterException(String message) {
        super(message);
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static InvalidParameterException invalidParameter(String paramName, Object value, String expected) {
        return new InvalidParameterException(
                String.format("Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }

    /**
     * Creates validation exception for a value outside an inclusive range.
     */
    public static InvalidParameterException outOfRange(String paramName, double value, double min, double max) {
        return invalidParameter(paramName, value, String.format("a value in [%s, %s]", min, max));
    }
}
