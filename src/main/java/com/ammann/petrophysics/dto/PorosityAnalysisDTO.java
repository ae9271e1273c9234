/* (C)2026 */
package com.ammann.petrophysics.dto;

import com.ammann.petrophysics.enumeration.ReservoirQuality;
import com.ammann.petrophysics.model.DepthAxis;
import com.ammann.petrophysics.service.WellAnalysisService.PorosityAnalysis;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Porosity analysis of one well.
 *
 * <p>Curves and depths are only present when requested. An unavailable well carries
 * its failure reason and no intervals.
 */
@Schema(description = "Porosity analysis of one well")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PorosityAnalysisDTO(
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

        @Schema(description = "Overall reservoir quality")
        ReservoirQuality quality,

        @Schema(description = "Density porosity statistics")
        StatisticsSummaryDTO densityPorosity,

        @Schema(description = "Neutron porosity statistics")
        StatisticsSummaryDTO neutronPorosity,

        @Schema(description = "Effective porosity statistics")
        StatisticsSummaryDTO effectivePorosity,

        @Schema(description = "Reservoir intervals, best first")
        List<IntervalDTO> reservoirIntervals,

        @Schema(description = "High-porosity zones, best first")
        List<IntervalDTO> highPorosityZones,

        @Schema(description = "Highest-ranked reservoir interval")
        IntervalDTO primaryTarget,

        @Schema(description = "Completeness of the effective porosity curve")
        DataQualityDTO dataQuality,

        @Schema(description = "Analysed depths, present when curves are requested")
        double[] depths,

        @Schema(description = "Derived curves, present when requested")
        List<DerivedCurveDTO> curves
) {
    public static PorosityAnalysisDTO from(PorosityAnalysis analysis, boolean includeCurves) {
        DepthAxis axis = analysis.depthAxis();
        boolean withCurves = includeCurves && analysis.available();
        return new PorosityAnalysisDTO(
                analysis.wellName(),
                analysis.available(),
                analysis.failureReason(),
                axis == null || axis.isEmpty() ? null : axis.top(),
                axis == null || axis.isEmpty() ? null : axis.bottom(),
                analysis.quality(),
                StatisticsSummaryDTO.from(analysis.densityStatistics()),
                StatisticsSummaryDTO.from(analysis.neutronStatistics()),
                StatisticsSummaryDTO.from(analysis.effectiveStatistics()),
                analysis.reservoirIntervals().stream().map(IntervalDTO::from).toList(),
                analysis.highPorosityZones().stream().map(IntervalDTO::from).toList(),
                IntervalDTO.from(analysis.primaryTarget()),
                DataQualityDTO.from(analysis.dataQuality()),
                withCurves ? axis.values() : null,
                withCurves
                        ? List.of(
                                DerivedCurveDTO.from(analysis.densityPorosity()),
                                DerivedCurveDTO.from(analysis.neutronPorosity()),
                                DerivedCurveDTO.from(analysis.effectivePorosity()))
                        : null
        );
    }
}
