/* (C)2026 */
package com.ammann.petrophysics.dto;

import com.ammann.petrophysics.cache.WellAvailabilityCache.WellAvailability;
import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Wells available for analysis")
public record WellAvailabilityDTO(
        @Schema(description = "Registered well names, sorted")
        List<String> wellNames,

        @Schema(description = "Number of registered wells")
        int count,

        @Schema(description = "When the cached snapshot was taken")
        Instant asOf
) {
    public static WellAvailabilityDTO from(WellAvailability availability) {
        return new WellAvailabilityDTO(availability.wellNames(), availability.wellNames().size(),
                availability.asOf());
    }
}
