/* (C)2026 */
package com.ammann.petrophysics.dto;

import com.ammann.petrophysics.enumeration.IntervalKind;
import com.ammann.petrophysics.model.Interval;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * A classified, ranked depth interval.
 */
@Schema(description = "Depth interval that satisfied a segmentation cutoff")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IntervalDTO(
        @Schema(description = "Segmentation rule that produced the interval")
        IntervalKind kind,

        @Schema(description = "1-based rank within its set, 1 is the primary target")
        Integer rank,

        @Schema(description = "Depth of the first qualifying sample")
        Double topDepth,

        @Schema(description = "Depth of the last qualifying sample")
        Double bottomDepth,

        @Schema(description = "Bottom minus top depth")
        Double thickness,

        @Schema(description = "Mean value over the interval")
        Double meanValue,

        @Schema(description = "Extreme value in the qualifying direction")
        Double peakValue,

        @Schema(description = "Number of samples in the interval")
        Integer pointCount,

        @Schema(description = "Permeability estimate in mD, porosity intervals only")
        Double permeabilityEstimate,

        @Schema(description = "Net-to-gross ratio, porosity intervals only")
        Double netToGross,

        @Schema(description = "Mean shale volume over the interval")
        Double meanShaleVolume,

        @Schema(description = "Thickness times (1 - mean shale volume)")
        Double netPayPotential,

        @Schema(description = "Quality label", example = "GOOD")
        String quality
) {
    public static IntervalDTO from(Interval interval) {
        if (interval == null) {
            return null;
        }
        return new IntervalDTO(
                interval.kind(),
                interval.rank(),
                interval.topDepth(),
                interval.bottomDepth(),
                interval.thickness(),
                interval.meanValue(),
                interval.peakValue(),
                interval.pointCount(),
                interval.permeabilityEstimate(),
                interval.netToGross(),
                interval.meanShaleVolume(),
                interval.netPayPotential(),
                interval.qualityLabel()
        );
    }
}
