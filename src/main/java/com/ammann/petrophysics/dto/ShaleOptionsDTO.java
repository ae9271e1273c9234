/* (C)2026 */
package com.ammann.petrophysics.dto;

import com.ammann.petrophysics.enumeration.ShaleVolumeMethod;
import com.ammann.petrophysics.model.ParameterSet;
import com.ammann.petrophysics.service.WellAnalysisService.ShaleAnalysisOptions;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Shale analysis options; every field is optional")
public record ShaleOptionsDTO(
        @Schema(description = "Top of the depth range")
        Double depthStart,

        @Schema(description = "Bottom of the depth range")
        Double depthEnd,

        @Schema(description = "Shale volume method")
        ShaleVolumeMethod method,

        @Schema(description = "Clean-sand shale volume cutoff")
        Double shaleCutoff,

        @Schema(description = "Estimate gamma-ray baselines from the log")
        Boolean autoBaselines,

        @Schema(description = "Physical constant overrides")
        ParameterSetDTO parameters
) {
    public ShaleAnalysisOptions toOptions(ParameterSet defaults) {
        return new ShaleAnalysisOptions(
                depthStart,
                depthEnd,
                method,
                shaleCutoff,
                Boolean.TRUE.equals(autoBaselines),
                parameters == null ? null : parameters.applyTo(defaults));
    }
}
