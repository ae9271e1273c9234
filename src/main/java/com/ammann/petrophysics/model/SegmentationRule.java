/* (C)2026 */
package com.ammann.petrophysics.model;

import com.ammann.petrophysics.enumeration.IntervalKind;
import com.ammann.petrophysics.exception.InvalidParameterException;

/**
 * Cutoff and acceptance thresholds for one interval segmentation pass.
 *
 * <p>A closed run is kept only when its point count is strictly greater than
 * {@code minPointCount} and its thickness strictly greater than {@code minThickness}.
 *
 * @param kind          kind of run; clean-sand runs qualify at or below the cutoff,
 *                      porosity runs at or above it
 * @param cutoff        qualifying cutoff
 * @param minPointCount exclusive minimum point count
 * @param minThickness  exclusive minimum thickness in depth units
 */
public record SegmentationRule(IntervalKind kind, double cutoff, int minPointCount, double minThickness) {

    public static final double DEFAULT_RESERVOIR_CUTOFF = 0.08;
    public static final double DEFAULT_HIGH_POROSITY_CUTOFF = 0.12;
    public static final double DEFAULT_CLEAN_SAND_CUTOFF = 0.30;

    public SegmentationRule {
        if (kind == null) {
            throw InvalidParameterException.invalidParameter("kind", null, "an interval kind");
        }
        if (!Double.isFinite(cutoff)) {
            throw InvalidParameterException.invalidParameter("cutoff", cutoff, "a finite value");
        }
        if (minPointCount < 0) {
            throw InvalidParameterException.invalidParameter("minPointCount", minPointCount, "a non-negative count");
        }
        if (!Double.isFinite(minThickness) || minThickness < 0) {
            throw InvalidParameterException.invalidParameter("minThickness", minThickness, "a non-negative thickness");
        }
    }

    /** Porosity at or above the cutoff, more than 3 points and more than 3 depth units. */
    public static SegmentationRule reservoir(double porosityCutoff) {
        return new SegmentationRule(IntervalKind.RESERVOIR, porosityCutoff, 3, 3.0);
    }

    /** Shale volume at or below the cutoff, more than 3 points and more than 2 depth units. */
    public static SegmentationRule cleanSand(double shaleVolumeCutoff) {
        return new SegmentationRule(IntervalKind.CLEAN_SAND, shaleVolumeCutoff, 3, 2.0);
    }

    /** Porosity at or above the cutoff, more than 2 points and more than 1 depth unit. */
    public static SegmentationRule highPorosity(double porosityCutoff) {
        return new SegmentationRule(IntervalKind.HIGH_POROSITY, porosityCutoff, 2, 1.0);
    }

    /** Returns {@code true} if a valid sample belongs to a run. */
    public boolean qualifies(double value) {
        return kind.isPorosityBased() ? value >= cutoff : value <= cutoff;
    }

    /** Returns {@code true} if a closed run passes both acceptance thresholds. */
    public boolean accepts(int pointCount, double thickness) {
        return pointCount > minPointCount && thickness > minThickness && thickness > 0.0;
    }
}
