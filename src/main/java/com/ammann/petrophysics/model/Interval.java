/* (C)2026 */
package com.ammann.petrophysics.model;

import com.ammann.petrophysics.enumeration.IntervalKind;

/**
 * A maximal depth run of samples that satisfied a segmentation cutoff.
 *
 * <p>Permeability and net-to-gross are only defined for porosity-based runs and are
 * {@code null} for clean-sand runs. {@code qualityLabel} is {@code null} and {@code rank}
 * is 0 until the interval has been classified and ranked.
 *
 * @param kind                 rule that produced the run
 * @param topDepth             depth of the first qualifying sample
 * @param bottomDepth          depth of the last qualifying sample
 * @param thickness            bottomDepth - topDepth, always positive
 * @param meanValue            mean of the in-run values
 * @param peakValue            extreme in-run value in the qualifying direction
 * @param pointCount           number of samples in the run
 * @param permeabilityEstimate φ³/(1-φ)² x 1000 in mD, porosity runs only
 * @param netToGross           fixed-breakpoint net-to-gross, porosity runs only
 * @param meanShaleVolume      mean shale volume over the run, 0 when unknown
 * @param netPayPotential      thickness x (1 - meanShaleVolume)
 * @param qualityLabel         ordinal quality label
 * @param rank                 1-based rank within its set, 0 when unranked
 */
public record Interval(
        IntervalKind kind,
        double topDepth,
        double bottomDepth,
        double thickness,
        double meanValue,
        double peakValue,
        int pointCount,
        Double permeabilityEstimate,
        Double netToGross,
        double meanShaleVolume,
        double netPayPotential,
        String qualityLabel,
        int rank
) {
    public Interval withQualityLabel(String label) {
        return new Interval(kind, topDepth, bottomDepth, thickness, meanValue, peakValue, pointCount,
                permeabilityEstimate, netToGross, meanShaleVolume, netPayPotential, label, rank);
    }

    public Interval withRank(int newRank) {
        return new Interval(kind, topDepth, bottomDepth, thickness, meanValue, peakValue, pointCount,
                permeabilityEstimate, netToGross, meanShaleVolume, netPayPotential, qualityLabel, newRank);
    }

    /** Returns {@code true} if the two intervals share any depth in [top, bottom). */
    public boolean overlaps(Interval other) {
        return topDepth < other.bottomDepth && other.topDepth < bottomDepth;
    }
}
