/* (C)2026 */
package com.ammann.petrophysics.dto;

import com.ammann.petrophysics.enumeration.Lithology;
import com.ammann.petrophysics.enumeration.PorosityBlendMethod;
import com.ammann.petrophysics.model.ParameterSet;
import com.ammann.petrophysics.service.WellAnalysisService.SaturationAnalysisOptions;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Water saturation analysis options; every field is optional")
public record SaturationOptionsDTO(
        @Schema(description = "Top of the depth range")
        Double depthStart,

        @Schema(description = "Bottom of the depth range")
        Double depthEnd,

        @Schema(description = "Neutron lithology correction")
        Lithology lithology,

        @Schema(description = "Density/neutron blend for effective porosity")
        PorosityBlendMethod blendMethod,

        @Schema(description = "Physical constant overrides")
        ParameterSetDTO parameters
) {
    public SaturationAnalysisOptions toOptions(ParameterSet defaults) {
        return new SaturationAnalysisOptions(
                depthStart,
                depthEnd,
                lithology,
                blendMethod,
                parameters == null ? null : parameters.applyTo(defaults));
    }
}
