package com.ammann.petrophysics.enumeration;

/**
 * Transform from gamma-ray index (IGR) to shale volume.
 *
 * <p>Each transform takes an IGR already clamped to [0, 1]; the caller clamps the
 * result to [0, 1] as well.
 */
public enum ShaleVolumeMethod
{
    LARIONOV_TERTIARY("Larionov Tertiary: Vsh = 0.083 * (2^(3.7 * IGR) - 1)"),
    LARIONOV_PRE_TERTIARY("Larionov Pre-Tertiary: Vsh = 0.33 * (2^(2 * IGR) - 1)"),
    CLAVIER("Clavier: Vsh = 1.7 - sqrt(3.38 - (IGR + 0.7)^2)"),
    LINEAR("Linear: Vsh = IGR");

    private final String formula;

    ShaleVolumeMethod(String formula) {
        this.formula = formula;
    }

    public String getFormula() { return formula; }

    public double transform(double igr) {
        return switch (this) {
            case LARIONOV_TERTIARY -> 0.083 * (Math.pow(2.0, 3.7 * igr) - 1.0);
            case LARIONOV_PRE_TERTIARY -> 0.33 * (Math.pow(2.0, 2.0 * igr) - 1.0);
            case CLAVIER -> 1.7 - Math.sqrt(3.38 - Math.pow(igr + 0.7, 2));
            case LINEAR -> igr;
        };
    }
}
