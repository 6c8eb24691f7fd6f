package teranet.mapdev.forge.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import teranet.mapdev.forge.dto.AnalysisRequestDto;
import teranet.mapdev.forge.dto.ErrorResponseDto;
import teranet.mapdev.forge.dto.OperatorCatalogDto;
import teranet.mapdev.forge.model.ComputedColumnType;
import teranet.mapdev.forge.model.FilterOperator;
import teranet.mapdev.forge.model.JoinType;
import teranet.mapdev.forge.model.UiSpec;
import teranet.mapdev.forge.service.SourceReadException;
import teranet.mapdev.forge.service.TransformAnalysisService;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Controller for transform operations over the registered sources:
 * normalization, validation, join health, preview and combined analysis.
 */
@RestController
@RequestMapping("/api/v1/forge/transform")
@CrossOrigin(origins = "*", maxAge = 3600)
@Tag(name = "Transform", description = "Transform validation, join health and preview")
public class TransformController {

    private static final Logger logger = LoggerFactory.getLogger(TransformController.class);

    @Autowired
    private TransformAnalysisService transformAnalysisService;

    @PostMapping("/normalize")
    @Operation(
        summary = "Normalize a transform",
        description = "Migrate legacy filter and join fields, sync column descriptors with the current schemas "
                + "and seed missing join keys"
    )
    @ApiResponse(responseCode = "200", description = "Normalized transform")
    @ApiResponse(responseCode = "500", description = "A source could not be read")
    public ResponseEntity<?> normalize(@RequestBody AnalysisRequestDto request) {
        return handle("normalize", () -> transformAnalysisService.normalize(request.getTransform()));
    }

    @PostMapping("/validate")
    @Operation(summary = "Validate a transform", description = "Static checks against the discovered schemas")
    @ApiResponse(responseCode = "200", description = "Errors and warnings")
    @ApiResponse(responseCode = "500", description = "A source could not be read")
    public ResponseEntity<?> validate(@RequestBody AnalysisRequestDto request) {
        return handle("validate", () -> transformAnalysisService.validate(request));
    }

    @PostMapping("/preview")
    @Operation(summary = "Preview a transform", description = "Run the transform over source samples")
    @ApiResponse(responseCode = "200", description = "Preview rows and columns")
    @ApiResponse(responseCode = "500", description = "A source could not be read")
    public ResponseEntity<?> preview(@RequestBody AnalysisRequestDto request) {
        return handle("preview", () -> transformAnalysisService.preview(request));
    }

    @PostMapping("/join-health")
    @Operation(
        summary = "Join health report",
        description = "Blank, duplicate and match rates of the join keys, computed over source samples"
    )
    @ApiResponse(responseCode = "200", description = "Metrics per executable join step")
    @ApiResponse(responseCode = "500", description = "A source could not be read")
    public ResponseEntity<?> joinHealth(@RequestBody AnalysisRequestDto request) {
        return handle("join health", () -> transformAnalysisService.joinHealth(request));
    }

    @PostMapping("/analyze")
    @Operation(
        summary = "Analyze a transform",
        description = "Validation, join health and preview in one call. Join health and preview failures "
                + "are reported as warnings"
    )
    @ApiResponse(responseCode = "200", description = "Combined analysis")
    @ApiResponse(responseCode = "500", description = "A source could not be read")
    public ResponseEntity<?> analyze(@RequestBody AnalysisRequestDto request) {
        return handle("analyze", () -> transformAnalysisService.analyze(request));
    }

    @GetMapping("/operators")
    @Operation(
        summary = "Supported names",
        description = "Filter operators, computed column types, join types and UI templates"
    )
    @ApiResponse(responseCode = "200", description = "Catalog of supported names")
    public ResponseEntity<OperatorCatalogDto> operators() {
        List<String> filterOperators = Arrays.stream(FilterOperator.values())
                .filter(op -> op != FilterOperator.UNKNOWN)
                .map(FilterOperator::getName)
                .collect(Collectors.toList());
        List<String> computedTypes = Arrays.stream(ComputedColumnType.values())
                .map(ComputedColumnType::getName)
                .collect(Collectors.toList());
        List<String> joinTypes = Arrays.stream(JoinType.values())
                .map(JoinType::getName)
                .collect(Collectors.toList());
        List<String> templates = UiSpec.TEMPLATES.stream().sorted().collect(Collectors.toList());
        return ResponseEntity.ok(new OperatorCatalogDto(filterOperators, computedTypes, joinTypes, templates));
    }

    private ResponseEntity<?> handle(String operation, Callable<?> action) {
        logger.info("Transform {} requested", operation);
        try {
            return ResponseEntity.ok(action.call());

        } catch (IllegalArgumentException e) {
            logger.warn("Validation error: {}", e.getMessage());
            return ResponseEntity.badRequest().body(new ErrorResponseDto("Validation Error", e.getMessage()));

        } catch (SourceReadException e) {
            logger.error("Transform {} failed reading source {}", operation, e.getSource(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponseDto("Source Read Error", e.getMessage()));

        } catch (Exception e) {
            logger.error("Transform {} failed", operation, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponseDto("Processing Error", "Failed to " + operation + ": " + e.getMessage()));
        }
    }
}
