/* (C)2026 */
package com.ammann.petrophysics.dto;

import com.ammann.petrophysics.model.WellLogDataset;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Summary of a registered well")
public record WellSummaryDTO(
        @Schema(description = "Well name")
        String wellName,

        @Schema(description = "Number of depth samples")
        int sampleCount,

        @Schema(description = "Shallowest depth")
        Double topDepth,

        @Schema(description = "Deepest depth")
        Double bottomDepth,

        @Schema(description = "Curve mnemonics in file order, index curve excluded")
        List<String> curves,

        @Schema(description = "Well section header values")
        Map<String, String> wellInfo,

        @Schema(description = "True when an earlier dataset with the same name was replaced")
        boolean replaced
) {
    public static WellSummaryDTO from(WellLogDataset dataset, boolean replaced) {
        boolean empty = dataset.getDepthAxis().isEmpty();
        return new WellSummaryDTO(
                dataset.getWellName(),
                dataset.size(),
                empty ? null : dataset.getDepthAxis().top(),
                empty ? null : dataset.getDepthAxis().bottom(),
                dataset.getCurveNames(),
                dataset.getWellInfo(),
                replaced
        );
    }
}
