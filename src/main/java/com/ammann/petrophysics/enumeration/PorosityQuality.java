package com.ammann.petrophysics.enumeration;

/**
 * Classification of reservoir porosity.
 *
 * <p>Each level defines a minimum porosity (v/v). A value is classified into the
 * highest level whose threshold it meets or exceeds.
 */
public enum PorosityQuality
{
    /** Porosity of 0.18 or above. */
    EXCELLENT(0.18),
    /** Porosity in [0.12, 0.18). */
    GOOD(0.12),
    /** Porosity in [0.08, 0.12). */
    FAIR(0.08),
    /** Porosity below 0.08. */
    POOR(0.0);

    private final double threshold;

    PorosityQuality(double threshold) {
        this.threshold = threshold;
    }

    /**
     * Returns the quality corresponding to the given porosity.
     *
     * @param porosity porosity as a fraction
     * @return the highest level whose threshold the porosity meets
     */
    public static PorosityQuality fromPorosity(double porosity) {
        if (porosity >= EXCELLENT.threshold) return EXCELLENT;
        if (porosity >= GOOD.threshold) return GOOD;
        if (porosity >= FAIR.threshold) return FAIR;
        return POOR;
    }

    public double getThreshold() { return threshold; }
}
