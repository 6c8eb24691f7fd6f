package teranet.mapdev.forge.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import teranet.mapdev.forge.dto.ErrorResponseDto;
import teranet.mapdev.forge.dto.InspectionResultDto;
import teranet.mapdev.forge.dto.SourceUploadResponseDto;
import teranet.mapdev.forge.model.RegisteredSource;
import teranet.mapdev.forge.service.SchemaInspectorService;
import teranet.mapdev.forge.service.SourceNotFoundException;
import teranet.mapdev.forge.service.SourceReadException;
import teranet.mapdev.forge.service.SourceRegistryService;
import teranet.mapdev.forge.service.TransformAnalysisService;

import java.util.ArrayList;
import java.util.List;

/**
 * Controller for dataset sources.
 * Registers delimited files under dataset tags and reports their inspected schema.
 */
@RestController
@RequestMapping("/api/v1/forge/sources")
@CrossOrigin(origins = "*", maxAge = 3600)
@Tag(name = "Sources", description = "Dataset upload and schema inspection")
public class SourceController {

    private static final Logger logger = LoggerFactory.getLogger(SourceController.class);

    @Autowired
    private SourceRegistryService sourceRegistryService;

    @Autowired
    private SchemaInspectorService schemaInspectorService;

    @Autowired
    private TransformAnalysisService transformAnalysisService;

    /**
     * Upload a delimited file for a dataset tag
     */
    @PostMapping(value = "/{tag}", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(
        summary = "Upload a dataset source",
        description = "Store a CSV/TSV file (optionally .gz or .zip) under a dataset tag and inspect its schema. "
                + "Tag 'a' is the primary dataset; any other tag is a right-hand dataset for joins."
    )
    @ApiResponse(responseCode = "200", description = "Source registered and inspected")
    @ApiResponse(responseCode = "400", description = "Invalid tag, file or file format")
    @ApiResponse(responseCode = "500", description = "Source could not be stored or read")
    public ResponseEntity<?> uploadSource(
            @PathVariable String tag,
            @Parameter(
                description = "Delimited file to register",
                required = true,
                content = @Content(mediaType = MediaType.MULTIPART_FORM_DATA_VALUE)
            )
            @RequestParam("file") MultipartFile file) {

        logger.info("Registering source for dataset {}: {}", tag, file.getOriginalFilename());

        try {
            SourceUploadResponseDto response = sourceRegistryService.upload(tag, file);
            logger.info("Source for dataset {} {}", tag, response.getStatus().toLowerCase());
            return ResponseEntity.ok(response);

        } catch (IllegalArgumentException e) {
            logger.warn("Validation error: {}", e.getMessage());
            return ResponseEntity.badRequest().body(new ErrorResponseDto("Validation Error", e.getMessage()));

        } catch (SourceReadException e) {
            logger.error("Registered source for dataset {} could not be read", tag, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponseDto("Source Read Error", e.getMessage()));

        } catch (Exception e) {
            logger.error("Failed to register source for dataset {}: {}", tag, file.getOriginalFilename(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponseDto("Processing Error", "Failed to register file: " + e.getMessage()));
        }
    }

    /**
     * List registered sources with their schema
     */
    @GetMapping
    @Operation(
        summary = "List dataset sources",
        description = "Registered sources, primary dataset first, with columns, sample rows and inferred types"
    )
    @ApiResponse(responseCode = "200", description = "Sources listed")
    @ApiResponse(responseCode = "500", description = "A source could not be read")
    public ResponseEntity<?> listSources() {
        try {
            List<InspectionResultDto> inspections = new ArrayList<>();
            for (RegisteredSource source : sourceRegistryService.list()) {
                inspections.add(schemaInspectorService.inspect(source));
            }
            return ResponseEntity.ok(inspections);

        } catch (SourceReadException e) {
            logger.error("Failed to read source {}", e.getSource(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponseDto("Source Read Error", e.getMessage()));
        }
    }

    /**
     * Inspect a single registered source
     */
    @GetMapping("/{tag}")
    @Operation(
        summary = "Inspect a dataset source",
        description = "Columns, sample rows and inferred column types of one registered source"
    )
    @ApiResponse(responseCode = "200", description = "Source inspected")
    @ApiResponse(responseCode = "404", description = "No source registered for the tag")
    @ApiResponse(responseCode = "500", description = "Source could not be read")
    public ResponseEntity<?> inspectSource(@PathVariable String tag) {
        try {
            return ResponseEntity.ok(transformAnalysisService.inspect(tag));

        } catch (SourceNotFoundException e) {
            logger.warn("Inspection requested for unknown dataset {}", tag);
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(new ErrorResponseDto("Not Found", e.getMessage()));

        } catch (SourceReadException e) {
            logger.error("Failed to read source {}", tag, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponseDto("Source Read Error", e.getMessage()));
        }
    }

    /**
     * Forget a registered source
     */
    @DeleteMapping("/{tag}")
    @Operation(summary = "Remove a dataset source", description = "Forget a source and delete its stored file")
    @ApiResponse(responseCode = "204", description = "Source removed")
    @ApiResponse(responseCode = "404", description = "No source registered for the tag")
    @ApiResponse(responseCode = "500", description = "Stored file could not be deleted")
    public ResponseEntity<?> removeSource(@PathVariable String tag) {
        try {
            if (!sourceRegistryService.remove(tag)) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(new ErrorResponseDto("Not Found", "No source registered for dataset " + tag));
            }
            return ResponseEntity.noContent().build();

        } catch (Exception e) {
            logger.error("Failed to remove source for dataset {}", tag, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponseDto("Processing Error", "Failed to remove source: " + e.getMessage()));
        }
    }
}
