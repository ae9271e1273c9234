/* (C)2026 */
package com.ammann.petrophysics.dto;

import com.ammann.petrophysics.enumeration.PropertyType;
import com.ammann.petrophysics.model.DerivedCurve;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Derived property curve aligned with the analysis depths; -999.25 marks missing samples")
public record DerivedCurveDTO(
        @Schema(description = "Curve mnemonic", example = "PHIE")
        String name,

        @Schema(description = "Unit")
        String unit,

        @Schema(description = "Derived property")
        PropertyType property,

        @Schema(description = "Formula and constants used")
        String methodology,

        @Schema(description = "Number of non-missing samples")
        int validCount,

        @Schema(description = "Sample values")
        double[] values
) {
    public static DerivedCurveDTO from(DerivedCurve curve) {
        if (curve == null) {
            return null;
        }
        return new DerivedCurveDTO(
                curve.getName(),
                curve.getUnit(),
                curve.getProperty(),
                curve.getMethodology(),
                curve.validCount(),
                curve.samples()
        );
    }
}
