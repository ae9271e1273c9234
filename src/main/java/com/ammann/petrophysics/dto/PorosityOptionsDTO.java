/* (C)2026 */
package com.ammann.petrophysics.dto;

import com.ammann.petrophysics.enumeration.Lithology;
import com.ammann.petrophysics.enumeration.PorosityBlendMethod;
import com.ammann.petrophysics.model.ParameterSet;
import com.ammann.petrophysics.service.WellAnalysisService.PorosityAnalysisOptions;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Porosity analysis options; every field is optional")
public record PorosityOptionsDTO(
        @Schema(description = "Top of the depth range")
        Double depthStart,

        @Schema(description = "Bottom of the depth range")
        Double depthEnd,

        @Schema(description = "Neutron lithology correction")
        Lithology lithology,

        @Schema(description = "Density/neutron blend for effective porosity")
        PorosityBlendMethod blendMethod,

        @Schema(description = "Reservoir interval porosity cutoff")
        Double porosityCutoff,

        @Schema(description = "High-porosity zone cutoff")
        Double highPorosityCutoff,

        @Schema(description = "Apply a gamma-ray shale correction when a GR curve exists")
        Boolean shaleCorrection,

        @Schema(description = "Physical constant overrides")
        ParameterSetDTO parameters
) {
    public PorosityAnalysisOptions toOptions(ParameterSet defaults) {
        return new PorosityAnalysisOptions(
                depthStart,
                depthEnd,
                lithology,
                blendMethod,
                porosityCutoff,
                highPorosityCutoff,
                Boolean.TRUE.equals(shaleCorrection),
                parameters == null ? null : parameters.applyTo(defaults));
    }
}
