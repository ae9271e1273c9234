/* (C)2026 */
package com.ammann.petrophysics.dto;

import com.ammann.petrophysics.enumeration.PropertyType;
import com.ammann.petrophysics.model.LogCurve;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Values to summarize; null or -999.25 entries count as missing")
public record StatisticsRequestDTO(
        @Schema(description = "Property the values describe", required = true)
        PropertyType property,

        @Schema(description = "Sample values", required = true)
        List<Double> values
) {
    /** Values as a sample array, with {@code null} entries mapped to the missing sentinel. */
    public double[] samples() {
        double[] samples = new double[values.size()];
        for (int i = 0; i < samples.length; i++) {
            Double value = values.get(i);
            samples[i] = value == null ? LogCurve.NULL_VALUE : value;
        }
        return samples;
    }
}
