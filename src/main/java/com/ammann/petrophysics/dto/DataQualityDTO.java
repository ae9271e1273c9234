/* (C)2026 */
package com.ammann.petrophysics.dto;

import com.ammann.petrophysics.enumeration.ConfidenceLevel;
import com.ammann.petrophysics.service.WellAnalysisService;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Completeness of the property an analysis was graded on")
public record DataQualityDTO(
        @Schema(description = "Valid samples over total samples")
        double completeness,

        @Schema(description = "Number of valid samples")
        int validSamples,

        @Schema(description = "Number of samples in the analysed range")
        int totalSamples,

        @Schema(description = "HIGH above 0.9 completeness, MEDIUM above 0.7, LOW otherwise")
        ConfidenceLevel confidence
) {
    static DataQualityDTO from(WellAnalysisService.DataQuality quality) {
        return new DataQualityDTO(
                quality.completeness(),
                quality.validSamples(),
                quality.totalSamples(),
                quality.confidence()
        );
    }
}
