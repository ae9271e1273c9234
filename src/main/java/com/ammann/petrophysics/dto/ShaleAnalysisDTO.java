/* (C)2026 */
package com.ammann.petrophysics.dto;

import com.ammann.petrophysics.enumeration.ReservoirQuality;
import com.ammann.petrophysics.enumeration.ShaleVolumeMethod;
import com.ammann.petrophysics.model.DepthAxis;
import com.ammann.petrophysics.service.WellAnalysisService.ShaleAnalysis;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Shale volume analysis of one well")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ShaleAnalysisDTO(
        @Schema(description = "Well name")
        String wellName,

        @Schema(description = "False when the well could not be analysed")
        boolean available,

        @Schema(description = "Why the well could not be analysed")
        String failureReason,

        @Schema(description = "Top of the analysed depth range")
        Double topDepth,

        @Schema(description = "Bottom of the analysed depth range")
        Double bottomDepth,

        @Schema(description = "Shale volume method")
        ShaleVolumeMethod method,

        @Schema(description = "Gamma-ray clean baseline used, API")
        Double grClean,

        @Schema(description = "Gamma-ray shale baseline used, API")
        Double grShale,

        @Schema(description = "Overall reservoir quality")
        ReservoirQuality quality,

        @Schema(description = "Shale volume statistics")
        StatisticsSummaryDTO shaleVolume,

        @Schema(description = "Fraction of valid samples at or below the clean-sand cutoff")
        double netToGross,

        @Schema(description = "Clean-sand intervals, best first")
        List<IntervalDTO> cleanSandIntervals,

        @Schema(description = "Highest-ranked clean-sand interval")
        IntervalDTO primaryTarget,

        @Schema(description = "Completeness of the shale volume curve")
        DataQualityDTO dataQuality,

        @Schema(description = "Analysed depths, present when curves are requested")
        double[] depths,

        @Schema(description = "Shale volume curve, present when requested")
        DerivedCurveDTO curve
) {
    public static ShaleAnalysisDTO from(ShaleAnalysis analysis, boolean includeCurves) {
        DepthAxis axis = analysis.depthAxis();
        boolean withCurves = includeCurves && analysis.available();
        return new ShaleAnalysisDTO(
                analysis.wellName(),
                analysis.available(),
                analysis.failureReason(),
                axis == null || axis.isEmpty() ? null : axis.top(),
                axis == null || axis.isEmpty() ? null : axis.bottom(),
                analysis.method(),
                analysis.baselines() == null ? null : analysis.baselines().clean(),
                analysis.baselines() == null ? null : analysis.baselines().shale(),
                analysis.quality(),
                StatisticsSummaryDTO.from(analysis.statistics()),
                analysis.netToGross(),
                analysis.cleanSandIntervals().stream().map(IntervalDTO::from).toList(),
                IntervalDTO.from(analysis.primaryTarget()),
                DataQualityDTO.from(analysis.dataQuality()),
                withCurves ? axis.values() : null,
                withCurves ? DerivedCurveDTO.from(analysis.shaleVolume()) : null
        );
    }
}
