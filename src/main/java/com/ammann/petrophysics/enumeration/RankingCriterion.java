package com.ammann.petrophysics.enumeration;

import com.ammann.petrophysics.model.Interval;

/**
 * Composite score used to rank an interval set, highest first.
 */
public enum RankingCriterion
{
    /** Mean value times thickness. */
    VALUE_THICKNESS,
    /** Thickness times (1 - mean shale volume). */
    NET_PAY_POTENTIAL,
    /** Mean value alone. */
    MEAN_VALUE;

    public double score(Interval interval) {
        return switch (this) {
            case VALUE_THICKNESS -> interval.meanValue() * interval.thickness();
            case NET_PAY_POTENTIAL -> interval.netPayPotential();
            case MEAN_VALUE -> interval.meanValue();
        };
    }

    /** Returns the criterion the analysis pipeline applies to the given interval kind. */
    public static RankingCriterion defaultFor(IntervalKind kind) {
        return switch (kind) {
            case RESERVOIR -> VALUE_THICKNESS;
            case CLEAN_SAND -> NET_PAY_POTENTIAL;
            case HIGH_POROSITY -> MEAN_VALUE;
        };
    }
}
