/* (C)2026 */
package com.ammann.petrophysics.model;

import com.ammann.petrophysics.enumeration.PropertyType;

/**
 * A log curve computed from one or more source curves and a {@link ParameterSet}.
 *
 * <p>A missing sample at index {@code i} in any required source curve yields a
 * missing sample at {@code i} here.
 */
public class DerivedCurve extends LogCurve {

    private final PropertyType property;
    private final String methodology;

    public DerivedCurve(String name, PropertyType property, String methodology, double[] samples) {
        super(name, "v/v", methodology, samples);
        this.property = property;
        this.methodology = methodology;
    }

    public PropertyType getProperty() { return property; }

    /** Human-readable formula with the constants that produced this curve. */
    public String getMethodology() { return methodology; }

    @Override
    DerivedCurve select(int[] indices) {
        return new DerivedCurve(getName(), property, methodology, pick(indices));
    }
}
