package com.ammann.petrophysics.enumeration;

/**
 * Confidence in a statistic derived from the fraction of valid samples it was computed from.
 */
public enum ConfidenceLevel
{
    /** More than 90 percent of samples valid. */
    HIGH,
    /** More than 70 percent of samples valid. */
    MEDIUM,
    LOW;

    /**
     * @param completeness fraction of valid samples in [0.0, 1.0]
     */
    public static ConfidenceLevel fromCompleteness(double completeness) {
        if (completeness > 0.9) return HIGH;
        if (completeness > 0.7) return MEDIUM;
        return LOW;
    }
}
