/* (C)2026 */
package com.ammann.petrophysics.resource;

import com.ammann.petrophysics.dto.FieldAnalysisDTO;
import com.ammann.petrophysics.dto.FieldPorosityRequestDTO;
import com.ammann.petrophysics.dto.StatisticsRequestDTO;
import com.ammann.petrophysics.dto.StatisticsSummaryDTO;
import com.ammann.petrophysics.exception.InvalidParameterException;
import com.ammann.petrophysics.model.ParameterSet;
import com.ammann.petrophysics.model.WellLogDataset;
import com.ammann.petrophysics.properties.ApiProperties;
import com.ammann.petrophysics.service.FieldAnalysisService;
import com.ammann.petrophysics.service.PetrophysicalStatisticsService;
import com.ammann.petrophysics.service.WellAnalysisService.PorosityAnalysisOptions;
import com.ammann.petrophysics.service.WellDatasetRegistry;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for multi-well analysis and standalone statistics.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Petrophysics API", description = "Field-level analysis and property statistics")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class PetrophysicsResource {

    private static final Logger LOG = Logger.getLogger(PetrophysicsResource.class);

    @Inject FieldAnalysisService fieldAnalysisService;

    @Inject PetrophysicalStatisticsService statisticsService;

    @Inject WellDatasetRegistry wellDatasetRegistry;

    @Inject ParameterSet defaultParameters;

    @POST
    @Path(ApiProperties.Field.POROSITY)
    @Operation(
            summary = "Analyze Field Porosity",
            description =
                    "Runs the porosity analysis on several registered wells concurrently and picks"
                        + " the well with the best primary target")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Field analysis completed",
                content = @Content(schema = @Schema(implementation = FieldAnalysisDTO.class))),
        @APIResponse(responseCode = "400", description = "No wells requested or invalid options"),
        @APIResponse(responseCode = "404", description = "A requested well is not registered")
    })
    public Response analyzeField(FieldPorosityRequestDTO request) {
        if (request == null || request.wellNames() == null || request.wellNames().isEmpty()) {
            throw InvalidParameterException.invalidParameter("wellNames", null, "at least one well name");
        }

        LOG.debugf("Field porosity request: wells=%s", request.wellNames());

        List<WellLogDataset> datasets = wellDatasetRegistry.requireAll(request.wellNames());
        PorosityAnalysisOptions options = request.options() == null
                ? PorosityAnalysisOptions.defaults()
                : request.options().toOptions(defaultParameters);

        var analysis = fieldAnalysisService.analyzeWells(datasets, options);
        return Response.ok(FieldAnalysisDTO.from(analysis)).build();
    }

    @POST
    @Path(ApiProperties.Statistics.BASE)
    @Operation(
            summary = "Summarize Property Values",
            description = "Computes descriptive statistics, a 95% confidence interval and combined uncertainty")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Statistics computed",
                content = @Content(schema = @Schema(implementation = StatisticsSummaryDTO.class))),
        @APIResponse(responseCode = "400", description = "Missing property or values")
    })
    public Response summarize(StatisticsRequestDTO request) {
        if (request == null || request.property() == null) {
            throw InvalidParameterException.invalidParameter("property", null, "a property type");
        }
        if (request.values() == null) {
            throw InvalidParameterException.invalidParameter("values", null, "a list of sample values");
        }

        var summary = statisticsService.summarize(request.samples(), request.property());
        return Response.ok(StatisticsSummaryDTO.from(summary)).build();
    }
}
