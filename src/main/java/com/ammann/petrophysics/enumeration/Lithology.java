package com.ammann.petrophysics.enumeration;

/**
 * Matrix lithology used to scale neutron porosity readings recorded on a limestone scale.
 */
public enum Lithology
{
    /** Default. */
    SANDSTONE(0.9),
    LIMESTONE(1.0),
    CARBONATE(1.0),
    DOLOMITE(0.7);

    private final double neutronCorrectionFactor;

    Lithology(double neutronCorrectionFactor) {
        this.neutronCorrectionFactor = neutronCorrectionFactor;
    }

    public double getNeutronCorrectionFactor() { return neutronCorrectionFactor; }
}
