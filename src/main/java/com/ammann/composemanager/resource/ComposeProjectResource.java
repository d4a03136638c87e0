package com.ammann.composemanager.resource;

import com.ammann.composemanager.dto.ConflictsResponseDTO;
import com.ammann.composemanager.dto.DiscoveredFileDTO;
import com.ammann.composemanager.dto.RefreshResultDTO;
import com.ammann.composemanager.dto.UnifiedProjectDTO;
import com.ammann.composemanager.properties.ApiProperties;
import com.ammann.composemanager.service.ComposeFileCacheService;
import com.ammann.composemanager.service.ConflictResolutionService;
import com.ammann.composemanager.service.PathValidator;
import com.ammann.composemanager.service.ProjectMatchingService;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.validation.constraints.NotBlank;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import java.security.Principal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.enums.SchemaType;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.RestQuery;

/**
 * REST Resource for compose project discovery.
 *
 * <p>Read-only: lists unified projects, discovered compose files and naming conflicts, and
 * triggers rescans of the compose root.</p>
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Compose.BASE)
@Tag(name = "Compose Discovery", description = "Compose file discovery and project matching")
@Produces(MediaType.APPLICATION_JSON)
public class ComposeProjectResource {

    static final String ANONYMOUS_USER = "anonymous";

    @Inject Logger logger;

    @Inject ProjectMatchingService matchingService;

    @Inject ComposeFileCacheService cacheService;

    @Inject ConflictResolutionService conflictService;

    @Inject PathValidator pathValidator;

    @GET
    @Path(ApiProperties.Compose.PROJECTS)
    @Operation(
            summary = "List projects",
            description =
                    "Returns live compose projects merged with the compose files discovered on"
                            + " disk, including the actions available for each project")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Unified project list",
                content =
                        @Content(
                                mediaType = MediaType.APPLICATION_JSON,
                                schema =
                                        @Schema(
                                                type = SchemaType.ARRAY,
                                                implementation = UnifiedProjectDTO.class))),
        @APIResponse(responseCode = "500", description = "Docker daemon error"),
        @APIResponse(responseCode = "503", description = "Compose root not accessible")
    })
    public Uni<List<UnifiedProjectDTO>> listProjects(
            @Parameter(description = "Discard cached compose files before matching")
                    @RestQuery("refresh")
                    @DefaultValue("false")
                    boolean refresh,
            @Context SecurityContext securityContext) {

        String userId = userId(securityContext);
        logger.debugf("Listing projects for %s (refresh=%s)", userId, refresh);
        if (refresh) {
            cacheService.invalidate();
        }
        return matchingService.getUnifiedProjects(userId);
    }

    @GET
    @Path(ApiProperties.Compose.FILES)
    @Operation(
            summary = "List compose files",
            description = "Returns every valid compose file found below the compose root")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Discovered compose files",
                content =
                        @Content(
                                mediaType = MediaType.APPLICATION_JSON,
                                schema =
                                        @Schema(
                                                type = SchemaType.ARRAY,
                                                implementation = DiscoveredFileDTO.class))),
        @APIResponse(responseCode = "503", description = "Compose root not accessible")
    })
    public List<DiscoveredFileDTO> listFiles() {
        return cacheService.getOrScan();
    }

    @GET
    @Path(ApiProperties.Compose.FILE_BY_PATH)
    @Operation(
            summary = "Get compose file",
            description = "Returns a single discovered compose file by its path")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Discovered compose file",
                content =
                        @Content(
                                mediaType = MediaType.APPLICATION_JSON,
                                schema = @Schema(implementation = DiscoveredFileDTO.class))),
        @APIResponse(responseCode = "400", description = "Path outside the compose root"),
        @APIResponse(responseCode = "404", description = "Compose file not discovered"),
        @APIResponse(responseCode = "503", description = "Compose root not accessible")
    })
    public Response getFile(
            @Parameter(description = "Absolute path of the compose file", required = true)
                    @RestQuery("path")
                    @NotBlank(message = "path is required")
                    String path) {

        if (!pathValidator.isValid(path)) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("error", "Bad Request", "message", "Invalid file path"))
                    .build();
        }

        String normalized = pathValidator.normalize(path);
        return cacheService.getOrScan().stream()
                .filter(file -> file.filePath().equals(normalized))
                .findFirst()
                .map(file -> Response.ok(file).build())
                .orElseGet(
                        () ->
                                Response.status(Response.Status.NOT_FOUND)
                                        .entity(
                                                Map.of(
                                                        "error", "Not Found",
                                                        "message",
                                                                "Compose file not found: "
                                                                        + normalized))
                                        .build());
    }

    @GET
    @Path(ApiProperties.Compose.CONFLICTS)
    @Operation(
            summary = "List conflicts",
            description = "Returns projects with more than one active compose file")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Detected conflicts",
                content =
                        @Content(
                                mediaType = MediaType.APPLICATION_JSON,
                                schema = @Schema(implementation = ConflictsResponseDTO.class))),
        @APIResponse(responseCode = "503", description = "Compose root not accessible")
    })
    public ConflictsResponseDTO listConflicts() {
        return ConflictsResponseDTO.of(
                conflictService.resolve(cacheService.getOrScan()).conflictErrors());
    }

    @POST
    @Path(ApiProperties.Compose.REFRESH)
    @Operation(
            summary = "Rescan compose files",
            description = "Discards the cached scan and scans the compose root again")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Rescan finished",
                content =
                        @Content(
                                mediaType = MediaType.APPLICATION_JSON,
                                schema = @Schema(implementation = RefreshResultDTO.class))),
        @APIResponse(responseCode = "503", description = "Compose root not accessible")
    })
    public RefreshResultDTO refresh() {
        logger.info("Manual compose rescan requested");
        cacheService.invalidate();
        List<DiscoveredFileDTO> files = cacheService.getOrScan(true);
        return new RefreshResultDTO(
                files.size(),
                String.format("Compose file cache refreshed: %d files found", files.size()),
                Instant.now());
    }

    private static String userId(SecurityContext securityContext) {
        if (securityContext == null) {
            return ANONYMOUS_USER;
        }
        Principal principal = securityContext.getUserPrincipal();
        if (principal == null || principal.getName() == null || principal.getName().isBlank()) {
            return ANONYMOUS_USER;
        }
        return principal.getName();
    }
}
