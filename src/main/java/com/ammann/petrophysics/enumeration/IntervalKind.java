package com.ammann.petrophysics.enumeration;

/**
 * Kind of depth run produced by interval segmentation.
 */
public enum IntervalKind
{
    /** Effective porosity at or above the reservoir cutoff. */
    RESERVOIR(true),
    /** Effective porosity at or above the high-porosity cutoff. */
    HIGH_POROSITY(true),
    /** Shale volume at or below the clean-sand cutoff. */
    CLEAN_SAND(false);

    private final boolean porosityBased;

    IntervalKind(boolean porosityBased) {
        this.porosityBased = porosityBased;
    }

    public boolean isPorosityBased() { return porosityBased; }
}
