/* (C)2026 */
package com.ammann.petrophysics.model;

import com.ammann.petrophysics.exception.InvalidParameterException;

/**
 * Physical constants used by the derived property calculators.
 *
 * <p>Every constant has a default and an inclusive valid range. Construction with a
 * value outside its range, or a non-finite value, throws
 * {@link InvalidParameterException}; values are never clamped.
 *
 * @param matrixDensity rock matrix density in g/cc, [2.0, 3.0], default 2.65
 * @param fluidDensity  pore fluid density in g/cc, [0.5, 1.5], below matrix density, default 1.0
 * @param grClean       clean-sand gamma-ray baseline in API, [0, 500], default 25
 * @param grShale       shale gamma-ray baseline in API, [0, 500], above grClean, default 150
 * @param rw            formation water resistivity in ohm-m, [0.005, 10], default 0.1
 * @param archieA       tortuosity factor a, [0.3, 3.0], default 1.0
 * @param archieM       cementation exponent m, [1.0, 4.0], default 2.0
 * @param archieN       saturation exponent n, [1.0, 4.0], default 2.0
 */
public record ParameterSet(
        double matrixDensity,
        double fluidDensity,
        double grClean,
        double grShale,
        double rw,
        double archieA,
        double archieM,
        double archieN
) {
    public static final double DEFAULT_MATRIX_DENSITY = 2.65;
    public static final double DEFAULT_FLUID_DENSITY = 1.0;
    public static final double DEFAULT_GR_CLEAN = 25.0;
    public static final double DEFAULT_GR_SHALE = 150.0;
    public static final double DEFAULT_RW = 0.1;
    public static final double DEFAULT_ARCHIE_A = 1.0;
    public static final double DEFAULT_ARCHIE_M = 2.0;
    public static final double DEFAULT_ARCHIE_N = 2.0;

    public ParameterSet {
        requireInRange("matrixDensity", matrixDensity, 2.0, 3.0);
        requireInRange("fluidDensity", fluidDensity, 0.5, 1.5);
        requireInRange("grClean", grClean, 0.0, 500.0);
        requireInRange("grShale", grShale, 0.0, 500.0);
        requireInRange("rw", rw, 0.005, 10.0);
        requireInRange("archieA", archieA, 0.3, 3.0);
        requireInRange("archieM", archieM, 1.0, 4.0);
        requireInRange("archieN", archieN, 1.0, 4.0);

        if (fluidDensity >= matrixDensity) {
            throw InvalidParameterException.invalidParameter(
                    "fluidDensity", fluidDensity, "a value below matrixDensity " + matrixDensity);
        }
        if (grShale <= grClean) {
            throw InvalidParameterException.invalidParameter(
                    "grShale", grShale, "a value above grClean " + grClean);
        }
    }

    public static ParameterSet defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder pre-filled with this set's values. */
    public Builder toBuilder() {
        return new Builder()
                .matrixDensity(matrixDensity)
                .fluidDensity(fluidDensity)
                .gammaRayBaselines(grClean, grShale)
                .rw(rw)
                .archie(archieA, archieM, archieN);
    }

    private static void requireInRange(String name, double value, double min, double max) {
        if (!Double.isFinite(value) || value < min || value > max) {
            throw InvalidParameterException.outOfRange(name, value, min, max);
        }
    }

    /**
     * Builder starting from the documented defaults. Validation happens in {@link #build()}.
     */
    public static final class Builder {
        private double matrixDensity = DEFAULT_MATRIX_DENSITY;
        private double fluidDensity = DEFAULT_FLUID_DENSITY;
        private double grClean = DEFAULT_GR_CLEAN;
        private double grShale = DEFAULT_GR_SHALE;
        private double rw = DEFAULT_RW;
        private double archieA = DEFAULT_ARCHIE_A;
        private double archieM = DEFAULT_ARCHIE_M;
        private double archieN = DEFAULT_ARCHIE_N;

        private Builder() {}

        public Builder matrixDensity(double value) {
            this.matrixDensity = value;
            return this;
        }

        public Builder fluidDensity(double value) {
            this.fluidDensity = value;
            return this;
        }

        public Builder gammaRayBaselines(double clean, double shale) {
            this.grClean = clean;
            this.grShale = shale;
            return this;
        }

        public Builder rw(double value) {
            this.rw = value;
            return this;
        }

        public Builder archie(double a, double m, double n) {
            this.archieA = a;
            this.archieM = m;
            this.archieN = n;
            return this;
        }

        public ParameterSet build() {
            return new ParameterSet(matrixDensity, fluidDensity, grClean, grShale, rw, archieA, archieM, archieN);
        }
    }
}
