/* (C)2026 */
package com.ammann.petrophysics.dto;

import com.ammann.petrophysics.enumeration.ConfidenceLevel;
import com.ammann.petrophysics.enumeration.PropertyType;
import com.ammann.petrophysics.model.StatisticsSummary;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Descriptive statistics and uncertainty of one property curve.
 */
@Schema(description = "Statistics of the valid samples of a property curve")
public record StatisticsSummaryDTO(
        @Schema(description = "Property the statistics describe")
        PropertyType property,

        @Schema(description = "Arithmetic mean")
        double mean,

        @Schema(description = "Sample standard deviation (n - 1)")
        double stdDev,

        @Schema(description = "Smallest valid value")
        double min,

        @Schema(description = "Largest valid value")
        double max,

        @Schema(description = "Median of the valid values")
        double median,

        @Schema(description = "Number of valid samples")
        int validCount,

        @Schema(description = "Number of samples including missing ones")
        int totalCount,

        @Schema(description = "Standard error of the mean")
        double standardError,

        @Schema(description = "Lower bound of the 95% confidence interval")
        double confidenceLower,

        @Schema(description = "Upper bound of the 95% confidence interval")
        double confidenceUpper,

        @Schema(description = "Standard error and method uncertainty combined in quadrature")
        double combinedUncertainty,

        @Schema(description = "Valid samples over total samples")
        double dataCompleteness,

        @Schema(description = "Confidence grade of the data completeness")
        ConfidenceLevel confidenceLevel,

        @Schema(description = "True when too few samples were valid and the summary is zeroed")
        boolean lowConfidence
) {
    public static StatisticsSummaryDTO from(StatisticsSummary summary) {
        return new StatisticsSummaryDTO(
                summary.property(),
                summary.mean(),
                summary.stdDev(),
                summary.min(),
                summary.max(),
                summary.median(),
                summary.validCount(),
                summary.totalCount(),
                summary.standardError(),
                summary.confidenceLower(),
                summary.confidenceUpper(),
                summary.combinedUncertainty(),
                summary.dataCompleteness(),
                summary.confidenceLevel(),
                summary.lowConfidence()
        );
    }
}
