/* (C)2026 */
package com.ammann.petrophysics.resource;

import com.ammann.petrophysics.dto.PorosityAnalysisDTO;
import com.ammann.petrophysics.dto.PorosityOptionsDTO;
import com.ammann.petrophysics.dto.SaturationAnalysisDTO;
import com.ammann.petrophysics.dto.SaturationOptionsDTO;
import com.ammann.petrophysics.dto.ShaleAnalysisDTO;
import com.ammann.petrophysics.dto.ShaleOptionsDTO;
import com.ammann.petrophysics.dto.WellAvailabilityDTO;
import com.ammann.petrophysics.dto.WellSummaryDTO;
import com.ammann.petrophysics.model.ParameterSet;
import com.ammann.petrophysics.model.WellLogDataset;
import com.ammann.petrophysics.properties.ApiProperties;
import com.ammann.petrophysics.service.LasParsingService;
import com.ammann.petrophysics.service.WellAnalysisService;
import com.ammann.petrophysics.service.WellAnalysisService.PorosityAnalysisOptions;
import com.ammann.petrophysics.service.WellAnalysisService.SaturationAnalysisOptions;
import com.ammann.petrophysics.service.WellAnalysisService.ShaleAnalysisOptions;
import com.ammann.petrophysics.service.WellDatasetRegistry;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for registering wells and running single-well analyses.
 *
 * <p>Wells are uploaded as LAS text and kept in memory. Analysis endpoints accept
 * JSON options in which every field is optional.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Wells API", description = "Well registration and single-well petrophysical analysis")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class WellResource {

    private static final Logger LOG = Logger.getLogger(WellResource.class);

    @Inject LasParsingService lasParsingService;

    @Inject WellDatasetRegistry wellDatasetRegistry;

    @Inject WellAnalysisService wellAnalysisService;

    @Inject ParameterSet defaultParameters;

    @POST
    @Path(ApiProperties.Wells.BASE)
    @Consumes(MediaType.TEXT_PLAIN)
    @Operation(
            summary = "Register Well",
            description = "Parses LAS 2.0 text and registers the well, replacing any well of the same name")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Well registered",
                content = @Content(schema = @Schema(implementation = WellSummaryDTO.class))),
        @APIResponse(responseCode = "400", description = "Malformed LAS content"),
        @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response registerWell(
            @Parameter(description = "Well name overriding the LAS WELL header")
                    @QueryParam("wellName")
                    String wellName,
            String lasContent) {

        WellLogDataset dataset = lasParsingService.parse(lasContent, wellName);
        boolean replaced = wellDatasetRegistry.register(dataset);
        return Response.ok(WellSummaryDTO.from(dataset, replaced)).build();
    }

    @GET
    @Path(ApiProperties.Wells.BASE)
    @Operation(
            summary = "List Available Wells",
            description = "Returns the registered well names from a short-lived cache")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Available wells",
                content = @Content(schema = @Schema(implementation = WellAvailabilityDTO.class)))
    })
    public Response listWells() {
        return Response.ok(WellAvailabilityDTO.from(wellDatasetRegistry.availability())).build();
    }

    @DELETE
    @Path(ApiProperties.Wells.WELL)
    @Operation(summary = "Remove Well", description = "Removes a registered well")
    @APIResponses({
        @APIResponse(responseCode = "204", description = "Well removed"),
        @APIResponse(responseCode = "404", description = "Well not registered")
    })
    public Response removeWell(@PathParam("wellName") String wellName) {
        if (!wellDatasetRegistry.remove(wellName)) {
            throw new NotFoundException("Well '" + wellName + "' is not registered");
        }
        return Response.noContent().build();
    }

    @POST
    @Path(ApiProperties.Wells.POROSITY)
    @Operation(
            summary = "Analyze Porosity",
            description =
                    "Computes density, neutron and effective porosity, ranks reservoir intervals and"
                        + " high-porosity zones and grades the well")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Porosity analysis completed",
                content = @Content(schema = @Schema(implementation = PorosityAnalysisDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid options"),
        @APIResponse(responseCode = "404", description = "Well or required curve not found"),
        @APIResponse(responseCode = "422", description = "Too few valid samples")
    })
    public Response analyzePorosity(
            @PathParam("wellName") String wellName,
            @Parameter(description = "Include derived curves and depths in the response")
                    @QueryParam("includeCurves")
                    @DefaultValue("false")
                    boolean includeCurves,
            PorosityOptionsDTO options) {

        LOG.debugf("Porosity analysis request: well=%s, options=%s", wellName, options);

        WellLogDataset dataset = wellDatasetRegistry.require(wellName);
        PorosityAnalysisOptions opts = options == null
                ? PorosityAnalysisOptions.defaults()
                : options.toOptions(defaultParameters);
        var analysis = wellAnalysisService.analyzePorosity(dataset, opts);
        return Response.ok(PorosityAnalysisDTO.from(analysis, includeCurves)).build();
    }

    @POST
    @Path(ApiProperties.Wells.SHALE)
    @Operation(
            summary = "Analyze Shale Volume",
            description = "Computes shale volume from gamma ray, ranks clean-sand intervals and grades the well")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Shale analysis completed",
                content = @Content(schema = @Schema(implementation = ShaleAnalysisDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid options"),
        @APIResponse(responseCode = "404", description = "Well or gamma-ray curve not found"),
        @APIResponse(responseCode = "422", description = "Too few valid samples")
    })
    public Response analyzeShale(
            @PathParam("wellName") String wellName,
            @Parameter(description = "Include the shale volume curve and depths in the response")
                    @QueryParam("includeCurves")
                    @DefaultValue("false")
                    boolean includeCurves,
            ShaleOptionsDTO options) {

        LOG.debugf("Shale analysis request: well=%s, options=%s", wellName, options);

        WellLogDataset dataset = wellDatasetRegistry.require(wellName);
        ShaleAnalysisOptions opts = options == null
                ? ShaleAnalysisOptions.defaults()
                : options.toOptions(defaultParameters);
        var analysis = wellAnalysisService.analyzeShale(dataset, opts);
        return Response.ok(ShaleAnalysisDTO.from(analysis, includeCurves)).build();
    }

    @POST
    @Path(ApiProperties.Wells.SATURATION)
    @Operation(
            summary = "Analyze Water Saturation",
            description = "Computes Archie water saturation from resistivity and effective porosity")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Saturation analysis completed",
                content = @Content(schema = @Schema(implementation = SaturationAnalysisDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid options"),
        @APIResponse(responseCode = "404", description = "Well or required curve not found"),
        @APIResponse(responseCode = "422", description = "Too few valid samples")
    })
    public Response analyzeSaturation(
            @PathParam("wellName") String wellName,
            @Parameter(description = "Include derived curves and depths in the response")
                    @QueryParam("includeCurves")
                    @DefaultValue("false")
                    boolean includeCurves,
            SaturationOptionsDTO options) {

        LOG.debugf("Saturation analysis request: well=%s, options=%s", wellName, options);

        WellLogDataset dataset = wellDatasetRegistry.require(wellName);
        SaturationAnalysisOptions opts = options == null
                ? SaturationAnalysisOptions.defaults()
                : options.toOptions(defaultParameters);
        var analysis = wellAnalysisService.analyzeSaturation(dataset, opts);
        return Response.ok(SaturationAnalysisDTO.from(analysis, includeCurves)).build();
    }
}
