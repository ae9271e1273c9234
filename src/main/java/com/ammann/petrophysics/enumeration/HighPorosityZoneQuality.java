package com.ammann.petrophysics.enumeration;

/**
 * Classification of a high-porosity zone by its mean porosity.
 */
public enum HighPorosityZoneQuality
{
    EXCEPTIONAL(0.20),
    EXCELLENT(0.15),
    VERY_GOOD(0.12),
    GOOD(0.0);

    private final double threshold;

    HighPorosityZoneQuality(double threshold) {
        this.threshold = threshold;
    }

    public static HighPorosityZoneQuality fromPorosity(double porosity) {
        if (porosity >= EXCEPTIONAL.threshold) return EXCEPTIONAL;
        if (porosity >= EXCELLENT.threshold) return EXCELLENT;
        if (porosity >= VERY_GOOD.threshold) return VERY_GOOD;
        return GOOD;
    }

    public double getThreshold() { return threshold; }
}
