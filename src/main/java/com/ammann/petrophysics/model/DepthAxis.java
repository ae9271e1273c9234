/* (C)2026 */
package com.ammann.petrophysics.model;

import com.ammann.petrophysics.exception.MalformedInputException;
import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * Ordered, non-decreasing sequence of depths that defines the sample positions shared
 * by every curve of a dataset. Immutable.
 */
public final class DepthAxis {

    private final double[] depths;

    private DepthAxis(double[] depths) {
        this.depths = depths;
    }

    /**
     * Creates a depth axis from a copy of the given values.
     *
     * @param depths depth values, finite and non-decreasing
     * @throws MalformedInputException if a depth is not finite or decreases
     */
    public static DepthAxis of(double... depths) {
        if (depths == null) {
            throw new MalformedInputException("Depth axis must not be null");
        }
        double[] copy = Arrays.copyOf(depths, depths.length);
        for (int i = 0; i < copy.length; i++) {
            if (!Double.isFinite(copy[i])) {
                throw new MalformedInputException(
                        String.format("Depth at index %d is not a finite value: %s", i, copy[i]));
            }
            if (i > 0 && copy[i] < copy[i - 1]) {
                throw new MalformedInputException(
                        String.format("Depth axis decreases at index %d (%.4f after %.4f)",
                                i, copy[i], copy[i - 1]));
            }
        }
        return new DepthAxis(copy);
    }

    /**
     * Creates a regularly sampled axis from {@code start} to {@code stop} inclusive.
     */
    public static DepthAxis regular(double start, double stop, double step) {
        if (!(step > 0) || stop < start) {
            throw new MalformedInputException(
                    String.format("Cannot build depth axis from %s to %s with step %s", start, stop, step));
        }
        int count = (int) Math.floor((stop - start) / step + 1e-9) + 1;
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = start + i * step;
        }
        return new DepthAxis(values);
    }

    public int size() {
        return depths.length;
    }

    public boolean isEmpty() {
        return depths.length == 0;
    }

    public double depthAt(int index) {
        return depths[index];
    }

    /** Shallowest depth, or {@code NaN} for an empty axis. */
    public double top() {
        return depths.length == 0 ? Double.NaN : depths[0];
    }

    /** Deepest depth, or {@code NaN} for an empty axis. */
    public double bottom() {
        return depths.length == 0 ? Double.NaN : depths[depths.length - 1];
    }

    /** Returns a copy of the depth values. */
    public double[] values() {
        return Arrays.copyOf(depths, depths.length);
    }

    /** Indices of the samples whose depth lies in the inclusive range, in order. */
    int[] indicesWithin(double start, double end) {
        return IntStream.range(0, depths.length)
                .filter(i -> depths[i] >= start && depths[i] <= end)
                .toArray();
    }

    DepthAxis select(int[] indices) {
        double[] selected = new double[indices.length];
        for (int i = 0; i < indices.length; i++) {
            selected[i] = depths[indices[i]];
        }
        return new DepthAxis(selected);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DepthAxis other && Arrays.equals(depths, other.depths);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(depths);
    }

    @Override
    public String toString() {
        return String.format("DepthAxis[%d samples, %.2f-%.2f]", depths.length, top(), bottom());
    }
}
