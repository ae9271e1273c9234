package com.ammann.petrophysics.enumeration;

/**
 * Method used to combine density and neutron porosity into effective porosity.
 */
public enum PorosityBlendMethod
{
    /** (φD + φN) / 2 */
    ARITHMETIC,
    /** √(φD · φN), the default. */
    GEOMETRIC,
    /** 2 / (1/φD + 1/φN), zero when either input is zero. */
    HARMONIC,
    /** √((φD² + φN²) / 2), referred to as "Wyllie" in older tooling. */
    RMS;

    /**
     * Blends two non-negative porosity values.
     *
     * @param densityPorosity density porosity in v/v
     * @param neutronPorosity neutron porosity in v/v
     * @return blended porosity, not yet clamped
     */
    public double blend(double densityPorosity, double neutronPorosity) {
        return switch (this) {
            case ARITHMETIC -> (densityPorosity + neutronPorosity) / 2.0;
            case GEOMETRIC -> Math.sqrt(densityPorosity * neutronPorosity);
            case HARMONIC -> densityPorosity <= 0.0 || neutronPorosity <= 0.0
                    ? 0.0
                    : 2.0 / (1.0 / densityPorosity + 1.0 / neutronPorosity);
            case RMS -> Math.sqrt((densityPorosity * densityPorosity
                    + neutronPorosity * neutronPorosity) / 2.0);
        };
    }
}
