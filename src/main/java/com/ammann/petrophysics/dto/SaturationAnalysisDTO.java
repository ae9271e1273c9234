/* (C)2026 */
package com.ammann.petrophysics.dto;

import com.ammann.petrophysics.service.WellAnalysisService.SaturationAnalysis;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Archie water saturation analysis of one well")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SaturationAnalysisDTO(
        @Schema(description = "Well name")
        String wellName,

        @Schema(description = "Water saturation statistics")
        StatisticsSummaryDTO waterSaturation,

        @Schema(description = "1 - mean water saturation")
        double hydrocarbonSaturation,

        @Schema(description = "Completeness of the water saturation curve")
        DataQualityDTO dataQuality,

        @Schema(description = "Analysed depths, present when curves are requested")
        double[] depths,

        @Schema(description = "Effective porosity and water saturation curves, present when requested")
        List<DerivedCurveDTO> curves
) {
    public static SaturationAnalysisDTO from(SaturationAnalysis analysis, boolean includeCurves) {
        return new SaturationAnalysisDTO(
                analysis.wellName(),
                StatisticsSummaryDTO.from(analysis.statistics()),
                analysis.hydrocarbonSaturation(),
                DataQualityDTO.from(analysis.dataQuality()),
                includeCurves ? analysis.depthAxis().values() : null,
                includeCurves
                        ? List.of(
                                DerivedCurveDTO.from(analysis.effectivePorosity()),
                                DerivedCurveDTO.from(analysis.waterSaturation()))
                        : null
        );
    }
}
