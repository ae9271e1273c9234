/* (C)2026 */
package com.ammann.petrophysics.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Wells to analyse together with shared porosity options")
public record FieldPorosityRequestDTO(
        @Schema(description = "Registered well names", required = true)
        List<String> wellNames,

        @Schema(description = "Options applied to every well")
        PorosityOptionsDTO options
) {}
