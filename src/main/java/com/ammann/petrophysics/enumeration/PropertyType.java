package com.ammann.petrophysics.enumeration;

/**
 * Petrophysical property a curve or summary describes, with the fixed method
 * uncertainty that enters the combined uncertainty budget.
 */
public enum PropertyType
{
    DENSITY_POROSITY(0.02),
    NEUTRON_POROSITY(0.03),
    EFFECTIVE_POROSITY(0.025),
    SHALE_VOLUME(0.05),
    WATER_SATURATION(0.15);

    private final double methodUncertainty;

    PropertyType(double methodUncertainty) {
        this.methodUncertainty = methodUncertainty;
    }

    public double getMethodUncertainty() { return methodUncertainty; }
}
