/* (C)2026 */
package com.ammann.petrophysics.service;

import com.ammann.petrophysics.enumeration.ConfidenceLevel;
import com.ammann.petrophysics.enumeration.PropertyType;
import com.ammann.petrophysics.exception.InsufficientDataException;
import com.ammann.petrophysics.model.LogCurve;
import com.ammann.petrophysics.model.StatisticsSummary;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.Arrays;

/**
 * Descriptive statistics and uncertainty for derived property curves.
 *
 * <p>Missing samples are excluded. The standard deviation is the sample estimate
 * (n - 1 denominator). The 95% confidence interval uses t = 1.96 above 30 valid
 * samples and t = 2.262 otherwise. The combined uncertainty adds the standard error
 * and the property's method uncertainty in quadrature.
 */
@ApplicationScoped
public class PetrophysicalStatisticsService
{

    private static final Logger LOG = Logger.getLogger(PetrophysicalStatisticsService.class);

    static final int MIN_SAMPLES_FOR_STATISTICS = 3;
    static final int LARGE_SAMPLE_THRESHOLD = 30;
    static final double T_LARGE_SAMPLE = 1.96;
    static final double T_SMALL_SAMPLE = 2.262;

    public StatisticsSummary summarize(LogCurve curve, PropertyType property)
    {
        return summarize(curve.samples(), property);
    }

    /**
     * Summarizes the valid samples of {@code values}.
     *
     * <p>With fewer than three valid samples the zeroed low-confidence summary is
     * returned instead of a partial estimate.
     *
     * @param values   samples, missing ones are ignored
     * @param property property the samples describe
     */
    public StatisticsSummary summarize(double[] values, PropertyType property)
    {
        double[] valid = validValues(values);
        int n = valid.length;

        if (n < MIN_SAMPLES_FOR_STATISTICS) {
            LOG.debugf("Only %d valid %s samples of %d, returning low-confidence summary",
                    (Object) Integer.valueOf(n), property, values.length);
            return StatisticsSummary.lowConfidence(property, n, values.length);
        }

        double mean = Arrays.stream(valid).average().orElse(0.0);
        double sumSquares = 0.0;
        for (double v : valid) {
            sumSquares += (v - mean) * (v - mean);
        }
        double stdDev = Math.sqrt(sumSquares / (n - 1));

        double[] sorted = valid.clone();
        Arrays.sort(sorted);
        double median = n % 2 == 0
                ? (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0
                : sorted[n / 2];

        double standardError = stdDev / Math.sqrt(n);
        double halfWidth = tValue(n) * standardError;
        double methodUncertainty = property.getMethodUncertainty();
        double combined = Math.sqrt(standardError * standardError + methodUncertainty * methodUncertainty);
        double completeness = (double) n / values.length;

        StatisticsSummary summary = new StatisticsSummary(
                property,
                mean,
                stdDev,
                sorted[0],
                sorted[n - 1],
                median,
                n,
                values.length,
                standardError,
                mean - halfWidth,
                mean + halfWidth,
                combined,
                completeness,
                ConfidenceLevel.fromCompleteness(completeness),
                false);

        LOG.debugf("%s statistics: mean=%.4f, sd=%.4f, n=%d/%d, uncertainty=%.4f",
                property, mean, stdDev, n, values.length, combined);

        return summary;
    }

    /**
     * Fails when {@code values} has fewer than {@code minimum} valid samples.
     *
     * @return the number of valid samples
     * @throws InsufficientDataException if the count is below {@code minimum}
     */
    public int requireValidCount(double[] values, int minimum, String description)
    {
        int valid = countValid(values);
        if (valid < minimum) {
            throw InsufficientDataException.insufficientData(description, minimum, valid);
        }
        return valid;
    }

    static double tValue(int validCount)
    {
        return validCount > LARGE_SAMPLE_THRESHOLD ? T_LARGE_SAMPLE : T_SMALL_SAMPLE;
    }

    static double[] validValues(double[] values)
    {
        return Arrays.stream(values).filter(v -> !LogCurve.isMissing(v)).toArray();
    }

    static int countValid(double[] values)
    {
        int count = 0;
        for (double v : values) {
            if (!LogCurve.isMissing(v)) {
                count++;
            }
        }
        return count;
    }
}
