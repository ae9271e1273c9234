package com.ammann.petrophysics.enumeration;

/**
 * Classification of a clean-sand interval by its mean shale volume.
 *
 * <p>Each level defines a maximum shale volume. A value is classified into the
 * best level whose ceiling it does not exceed.
 */
public enum ShaleQuality
{
    /** Shale volume of 0.15 or below. */
    EXCELLENT(0.15),
    /** Shale volume in (0.15, 0.30]. */
    GOOD(0.30),
    /** Shale volume in (0.30, 0.50]. */
    FAIR(0.50),
    /** Shale volume above 0.50. */
    POOR(1.0);

    private final double ceiling;

    ShaleQuality(double ceiling) {
        this.ceiling = ceiling;
    }

    public static ShaleQuality fromShaleVolume(double shaleVolume) {
        if (shaleVolume <= EXCELLENT.ceiling) return EXCELLENT;
        if (shaleVolume <= GOOD.ceiling) return GOOD;
        if (shaleVolume <= FAIR.ceiling) return FAIR;
        return POOR;
    }

    public double getCeiling() { return ceiling; }
}
