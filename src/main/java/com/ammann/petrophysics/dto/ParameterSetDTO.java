/* (C)2026 */
package com.ammann.petrophysics.dto;

import com.ammann.petrophysics.model.ParameterSet;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Partial override of the configured physical constants. Unset fields keep the
 * configured value.
 */
@Schema(description = "Physical constants; omitted fields use the configured defaults")
public record ParameterSetDTO(
        @Schema(description = "Matrix density in g/cc, 2.0 to 3.0")
        Double matrixDensity,

        @Schema(description = "Fluid density in g/cc, 0.5 to 1.5")
        Double fluidDensity,

        @Schema(description = "Gamma-ray clean baseline in API")
        Double grClean,

        @Schema(description = "Gamma-ray shale baseline in API")
        Double grShale,

        @Schema(description = "Formation water resistivity in ohm.m")
        Double rw,

        @Schema(description = "Archie tortuosity factor a")
        Double archieA,

        @Schema(description = "Archie cementation exponent m")
        Double archieM,

        @Schema(description = "Archie saturation exponent n")
        Double archieN
) {
    /**
     * Applies the set fields on top of {@code base}.
     *
     * @throws com.ammann.petrophysics.exception.InvalidParameterException if a resulting value is out of range
     */
    public ParameterSet applyTo(ParameterSet base) {
        return base.toBuilder()
                .matrixDensity(valueOr(matrixDensity, base.matrixDensity()))
                .fluidDensity(valueOr(fluidDensity, base.fluidDensity()))
                .gammaRayBaselines(valueOr(grClean, base.grClean()), valueOr(grShale, base.grShale()))
                .rw(valueOr(rw, base.rw()))
                .archie(valueOr(archieA, base.archieA()), valueOr(archieM, base.archieM()),
                        valueOr(archieN, base.archieN()))
                .build();
    }

    private static double valueOr(Double value, double fallback) {
        return value == null ? fallback : value;
    }
}
