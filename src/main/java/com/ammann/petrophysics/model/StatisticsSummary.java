/* (C)2026 */
package com.ammann.petrophysics.model;

import com.ammann.petrophysics.enumeration.ConfidenceLevel;
import com.ammann.petrophysics.enumeration.PropertyType;

/**
 * Descriptive statistics of the valid samples of a curve, with a confidence interval
 * for the mean and a combined uncertainty budget.
 *
 * <p>Invariants: {@code validCount <= totalCount}, {@code stdDev >= 0} and
 * {@code confidenceLower <= mean <= confidenceUpper}. When fewer than three samples
 * are valid the summary is zeroed and {@code lowConfidence} is set.
 *
 * @param property            property the values describe
 * @param mean                arithmetic mean
 * @param stdDev              sample standard deviation (n - 1 denominator)
 * @param min                 smallest valid value
 * @param max                 largest valid value
 * @param median              median of the valid values
 * @param validCount          number of valid samples
 * @param totalCount          number of samples including missing ones
 * @param standardError       stdDev / sqrt(validCount)
 * @param confidenceLower     mean - t x standardError
 * @param confidenceUpper     mean + t x standardError
 * @param combinedUncertainty sqrt(standardError² + methodUncertainty²)
 * @param dataCompleteness    validCount / totalCount, 0 for an empty input
 * @param confidenceLevel     grade of dataCompleteness
 * @param lowConfidence       set when the summary is the zeroed fallback
 */
public record StatisticsSummary(
        PropertyType property,
        double mean,
        double stdDev,
        double min,
        double max,
        double median,
        int validCount,
        int totalCount,
        double standardError,
        double confidenceLower,
        double confidenceUpper,
        double combinedUncertainty,
        double dataCompleteness,
        ConfidenceLevel confidenceLevel,
        boolean lowConfidence
) {
    /** Combined uncertainty reported when too few samples are valid to estimate one. */
    public static final double FALLBACK_UNCERTAINTY = 0.1;

    /**
     * Zeroed summary for inputs with too few valid samples.
     */
    public static StatisticsSummary lowConfidence(PropertyType property, int validCount, int totalCount) {
        double completeness = totalCount == 0 ? 0.0 : (double) validCount / totalCount;
        return new StatisticsSummary(
                property, 0.0, 0.0, 0.0, 0.0, 0.0,
                validCount, totalCount,
                0.0, 0.0, 0.0,
                FALLBACK_UNCERTAINTY,
                completeness,
                ConfidenceLevel.LOW,
                true);
    }
}
