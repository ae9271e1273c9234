package com.ammann.petrophysics.enumeration;

/**
 * Overall reservoir quality of a well, combining a mean property with how many
 * qualifying intervals were found.
 */
public enum ReservoirQuality
{
    EXCELLENT,
    GOOD,
    FAIR,
    POOR,
    /** No analyzable data. */
    UNKNOWN;

    /**
     * Grades a well from its porosity analysis.
     *
     * @param meanPorosity      mean effective porosity
     * @param intervalCount     number of kept reservoir intervals
     * @param highPorosityZones number of kept high-porosity zones
     */
    public static ReservoirQuality fromPorosity(double meanPorosity, int intervalCount, int highPorosityZones) {
        if (meanPorosity >= 0.15 && intervalCount >= 3 && highPorosityZones >= 2) return EXCELLENT;
        if (meanPorosity >= 0.12 && intervalCount >= 2 && highPorosityZones >= 1) return GOOD;
        if (meanPorosity >= 0.08 && intervalCount >= 1) return FAIR;
        return POOR;
    }

    /**
     * Grades a well from its shale analysis.
     *
     * @param meanShaleVolume mean shale volume
     * @param netToGross      fraction of valid samples at or below the clean-sand cutoff
     * @param intervalCount   number of kept clean-sand intervals
     */
    public static ReservoirQuality fromShale(double meanShaleVolume, double netToGross, int intervalCount) {
        if (meanShaleVolume <= 0.2 && netToGross >= 0.7 && intervalCount >= 3) return EXCELLENT;
        if (meanShaleVolume <= 0.3 && netToGross >= 0.5 && intervalCount >= 2) return GOOD;
        if (meanShaleVolume <= 0.5 && netToGross >= 0.3) return FAIR;
        return POOR;
    }
}
