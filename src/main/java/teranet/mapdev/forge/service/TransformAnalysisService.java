package teranet.mapdev.forge.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import teranet.mapdev.forge.config.ForgeConfig;
import teranet.mapdev.forge.dto.AnalysisRequestDto;
import teranet.mapdev.forge.dto.AnalysisResponseDto;
import teranet.mapdev.forge.dto.InspectionResultDto;
import teranet.mapdev.forge.dto.JoinHealthDto;
import teranet.mapdev.forge.dto.PreviewDto;
import teranet.mapdev.forge.dto.ValidationResultDto;
import teranet.mapdev.forge.model.ColumnDescriptor;
import teranet.mapdev.forge.model.DatasetSample;
import teranet.mapdev.forge.model.JoinStep;
import teranet.mapdev.forge.model.RegisteredSource;
import teranet.mapdev.forge.model.TransformSpec;
import teranet.mapdev.forge.model.UiSpec;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point of the transform engine over the registered sources.
 *
 * Every incoming transform is normalized once (legacy fields migrated,
 * joins canonicalized against the registered right-hand datasets) before
 * validation, join health or preview run over it.
 */
@Service
public class TransformAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(TransformAnalysisService.class);

    public static final String STATUS_VALID = "VALID";
    public static final String STATUS_INVALID = "INVALID";

    private final ForgeConfig forgeConfig;
    private final SourceRegistryService sourceRegistryService;
    private final SchemaInspectorService schemaInspectorService;
    private final TransformNormalizer transformNormalizer;
    private final ColumnSyncService columnSyncService;
    private final JoinKeySuggestionService joinKeySuggestionService;
    private final ConfigValidatorService configValidatorService;
    private final JoinHealthService joinHealthService;
    private final TransformPreviewService transformPreviewService;

    public TransformAnalysisService(ForgeConfig forgeConfig,
            SourceRegistryService sourceRegistryService,
            SchemaInspectorService schemaInspectorService,
            TransformNormalizer transformNormalizer,
            ColumnSyncService columnSyncService,
            JoinKeySuggestionService joinKeySuggestionService,
            ConfigValidatorService configValidatorService,
            JoinHealthService joinHealthService,
            TransformPreviewService transformPreviewService) {
        this.forgeConfig = forgeConfig;
        this.sourceRegistryService = sourceRegistryService;
        this.schemaInspectorService = schemaInspectorService;
        this.transformNormalizer = transformNormalizer;
        this.columnSyncService = columnSyncService;
        this.joinKeySuggestionService = joinKeySuggestionService;
        this.configValidatorService = configValidatorService;
        this.joinHealthService = joinHealthService;
        this.transformPreviewService = transformPreviewService;
    }

    // ========================================
    // ENGINE OPERATIONS
    // ========================================

    /**
     * Header, sample rows and column types of a registered source.
     *
     * @throws SourceNotFoundException if the tag is not registered
     * @throws SourceReadException     if the file cannot be read
     */
    public InspectionResultDto inspect(String tag) {
        return schemaInspectorService.inspect(sourceRegistryService.require(tag));
    }

    /**
     * Static validation of a transform against the given schemas.
     */
    public ValidationResultDto validate(Map<String, List<String>> schemas, TransformSpec transform, UiSpec ui) {
        return configValidatorService.validate(schemas, transform, ui);
    }

    /**
     * Join health over samples of at most {@code rowCap} rows per dataset.
     * Right-hand datasets not referenced by an executable step are not read.
     */
    public JoinHealthDto joinHealth(RegisteredSource primary,
            Map<String, RegisteredSource> rights,
            List<JoinStep> steps,
            int rowCap) {
        DatasetSample primarySample = schemaInspectorService.loadSample(primary, rowCap);
        Map<String, List<Map<String, String>>> rightRows = new LinkedHashMap<>();
        loadRightSamples(rights, steps, rowCap).forEach((tag, sample) -> rightRows.put(tag, sample.getRows()));
        return joinHealthService.compute(primarySample.getRows(), rightRows, steps);
    }

    /**
     * Preview of a normalized transform. The primary dataset is read up to the
     * preview row cap, which is also the limit when the transform sets none.
     *
     * @param sources      registered sources by tag (primary under "a", may be absent)
     * @param transform    normalized transform
     * @param outputRowCap rows returned
     */
    public PreviewDto preview(Map<String, RegisteredSource> sources, TransformSpec transform, int outputRowCap) {
        int rowCap = forgeConfig.getPreviewMaxRows();
        RegisteredSource primary = sources.get(ColumnDescriptor.PRIMARY_SOURCE);
        DatasetSample primarySample = primary == null
                ? DatasetSample.empty()
                : schemaInspectorService.loadSample(primary, rowCap);

        Map<String, RegisteredSource> rights = new LinkedHashMap<>(sources);
        rights.remove(ColumnDescriptor.PRIMARY_SOURCE);
        Map<String, DatasetSample> rightSamples = loadRightSamples(rights, transform.getJoins(), rowCap);

        return transformPreviewService.preview(primarySample, rightSamples, transform, rowCap, outputRowCap);
    }

    // ========================================
    // REQUEST-LEVEL OPERATIONS
    // ========================================

    /**
     * Migrate legacy fields, sync column descriptors with the current schemas
     * and seed missing join keys.
     */
    public TransformSpec normalize(TransformSpec transform) {
        TransformSpec normalized = transformNormalizer.normalize(transform, sourceRegistryService.rightTags());
        Map<String, List<String>> schemas = currentSchemas();
        columnSyncService.sync(normalized, schemas);
        joinKeySuggestionService.seedJoinKeys(normalized, schemas);
        return normalized;
    }

    public ValidationResultDto validate(AnalysisRequestDto request) {
        TransformSpec transform = prepare(request);
        return validate(currentSchemas(), transform, request.getUi());
    }

    public JoinHealthDto joinHealth(AnalysisRequestDto request) {
        TransformSpec transform = prepare(request);
        return joinHealthForRegistered(transform);
    }

    public PreviewDto preview(AnalysisRequestDto request) {
        TransformSpec transform = prepare(request);
        return preview(registeredSources(), transform, outputRows(request));
    }

    /**
     * Validation, join health and preview in one pass. Join health and
     * preview are guarded separately: a failure of either is reported as a
     * warning and leaves its section null.
     */
    public AnalysisResponseDto analyze(AnalysisRequestDto request) {
        TransformSpec transform = prepare(request);
        ValidationResultDto validation = validate(currentSchemas(), transform, request.getUi());

        JoinHealthDto health = null;
        try {
            health = joinHealthForRegistered(transform);
        } catch (RuntimeException e) {
            logger.warn("Join health report failed: {}", e.getMessage(), e);
            validation.getWarnings().add("Join health report failed: " + e.getMessage());
        }

        PreviewDto preview = null;
        try {
            preview = preview(registeredSources(), transform, outputRows(request));
        } catch (RuntimeException e) {
            logger.warn("Sample output failed: {}", e.getMessage(), e);
            validation.getWarnings().add("Sample output failed: " + e.getMessage());
        }

        String status = validation.hasErrors() ? STATUS_INVALID : STATUS_VALID;
        logger.info("Analysis finished: {} ({} error(s), {} warning(s))",
                status, validation.getErrors().size(), validation.getWarnings().size());
        return new AnalysisResponseDto(status, validation, health, preview);
    }

    /**
     * Header columns per registered dataset tag, primary first.
     *
     * @throws SourceReadException if a source cannot be read
     */
    public Map<String, List<String>> currentSchemas() {
        Map<String, List<String>> schemas = new LinkedHashMap<>();
        for (RegisteredSource source : sourceRegistryService.list()) {
            schemas.put(source.getTag(), schemaInspectorService.inspect(source).getColumns());
        }
        return schemas;
    }

    private JoinHealthDto joinHealthForRegistered(TransformSpec transform) {
        Map<String, RegisteredSource> sources = registeredSources();
        RegisteredSource primary = sources.remove(ColumnDescriptor.PRIMARY_SOURCE);
        if (primary == null) {
            return new JoinHealthDto();
        }
        return joinHealth(primary, sources, transform.getJoins(), forgeConfig.getAnalysisMaxRows());
    }

    private TransformSpec prepare(AnalysisRequestDto request) {
        return transformNormalizer.normalize(request.getTransform(), sourceRegistryService.rightTags());
    }

    private Map<String, RegisteredSource> registeredSources() {
        Map<String, RegisteredSource> sources = new LinkedHashMap<>();
        sourceRegistryService.list().forEach(source -> sources.put(source.getTag(), source));
        return sources;
    }

    private Map<String, DatasetSample> loadRightSamples(Map<String, RegisteredSource> rights,
            List<JoinStep> steps, int rowCap) {
        Map<String, DatasetSample> samples = new LinkedHashMap<>();
        if (steps == null) {
            return samples;
        }
        for (JoinStep step : steps) {
            RegisteredSource source = rights.get(step.getRight());
            if (step.isExecutable() && source != null && !samples.containsKey(step.getRight())) {
                samples.put(step.getRight(), schemaInspectorService.loadSample(source, rowCap));
            }
        }
        return samples;
    }

    private int outputRows(AnalysisRequestDto request) {
        Integer requested = request.getOutputRows();
        return requested == null || requested < 1 ? forgeConfig.getPreviewOutputRows() : requested;
    }
}
