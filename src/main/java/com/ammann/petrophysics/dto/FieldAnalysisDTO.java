/* (C)2026 */
package com.ammann.petrophysics.dto;

import com.ammann.petrophysics.service.FieldAnalysisService.FieldAnalysis;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Porosity analysis across several wells")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FieldAnalysisDTO(
        @Schema(description = "Number of wells analysed successfully")
        int wellsAnalyzed,

        @Schema(description = "Number of wells that could not be analysed")
        int wellsUnavailable,

        @Schema(description = "Well with the highest-scoring primary target")
        String bestWell,

        @Schema(description = "Primary target of the best well")
        IntervalDTO bestTarget,

        @Schema(description = "Per-well results in request order")
        List<PorosityAnalysisDTO> wells
) {
    public static FieldAnalysisDTO from(FieldAnalysis analysis) {
        return new FieldAnalysisDTO(
                analysis.wellsAnalyzed(),
                analysis.wellsUnavailable(),
                analysis.bestWell(),
                IntervalDTO.from(analysis.bestTarget()),
                analysis.wells().stream().map(w -> PorosityAnalysisDTO.from(w, false)).toList()
        );
    }
}
