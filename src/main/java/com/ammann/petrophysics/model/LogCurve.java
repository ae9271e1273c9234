/* (C)2026 */
package com.ammann.petrophysics.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * A named, depth-aligned sequence of log samples.
 *
 * <p>Missing samples are marked, never dropped: they carry the {@link #NULL_VALUE}
 * sentinel or a non-finite value. Instances are immutable; samples are copied on the
 * way in and on the way out.
 */
public class LogCurve {

    /** Reserved marker for a missing or rejected sample. */
    public static final double NULL_VALUE = -999.25;

    private final String name;
    private final String unit;
    private final String description;
    private final double[] samples;

    public LogCurve(String name, String unit, String description, double[] samples) {
        this.name = Objects.requireNonNull(name, "name");
        this.unit = unit == null ? "" : unit;
        this.description = description == null ? "" : description;
        this.samples = Arrays.copyOf(Objects.requireNonNull(samples, "samples"), samples.length);
    }

    public LogCurve(String name, String unit, double[] samples) {
        this(name, unit, "", samples);
    }

    /**
     * Returns {@code true} if the value is the sentinel or not a finite number.
     */
    public static boolean isMissing(double value) {
        return value == NULL_VALUE || !Double.isFinite(value);
    }

    public String getName() { return name; }

    public String getUnit() { return unit; }

    public String getDescription() { return description; }

    public int size() {
        return samples.length;
    }

    public double sample(int index) {
        return samples[index];
    }

    /** Returns a copy of the samples. */
    public double[] samples() {
        return Arrays.copyOf(samples, samples.length);
    }

    /** Number of samples that are not missing. */
    public int validCount() {
        int count = 0;
        for (double value : samples) {
            if (!isMissing(value)) {
                count++;
            }
        }
        return count;
    }

    /** Returns a curve holding only the samples at the given indices. */
    LogCurve select(int[] indices) {
        return new LogCurve(name, unit, description, pick(indices));
    }

    double[] pick(int[] indices) {
        double[] selected = new double[indices.length];
        for (int i = 0; i < indices.length; i++) {
            selected[i] = samples[indices[i]];
        }
        return selected;
    }

    @Override
    public String toString() {
        return String.format("LogCurve[%s (%s), %d samples]", name, unit, samples.length);
    }
}
