package teranet.mapdev.forge.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import teranet.mapdev.forge.config.ForgeConfig;
import teranet.mapdev.forge.dto.InspectionResultDto;
import teranet.mapdev.forge.model.ColumnType;
import teranet.mapdev.forge.model.DatasetSample;
import teranet.mapdev.forge.model.RegisteredSource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads bounded samples from registered sources and reports their schema.
 *
 * Inspection results are cached per source identity (tag + content checksum).
 * Re-registering a tag evicts its entries. Concurrent writers of the same
 * identity produce the same result, so last-writer-wins is sufficient.
 */
@Service
public class SchemaInspectorService {

    private static final Logger logger = LoggerFactory.getLogger(SchemaInspectorService.class);

    private final ForgeConfig forgeConfig;
    private final SourceFileService sourceFileService;
    private final CsvParsingService csvParsingService;
    private final ColumnTypeInferenceService columnTypeInferenceService;

    // Cache: "tag:checksum" -> inspection result
    private final Map<String, InspectionResultDto> inspectionCache = new ConcurrentHashMap<>();

    public SchemaInspectorService(ForgeConfig forgeConfig,
            SourceFileService sourceFileService,
            CsvParsingService csvParsingService,
            ColumnTypeInferenceService columnTypeInferenceService) {
        this.forgeConfig = forgeConfig;
        this.sourceFileService = sourceFileService;
        this.csvParsingService = csvParsingService;
        this.columnTypeInferenceService = columnTypeInferenceService;
    }

    /**
     * Inspect a registered source: header, first rows (inspect row cap) and column types.
     *
     * @param source the registered source
     * @return the inspection result, cached by source identity
     * @throws SourceReadException if the file cannot be read
     */
    public InspectionResultDto inspect(RegisteredSource source) {
        InspectionResultDto cached = inspectionCache.get(source.identity());
        if (cached != null) {
            logger.debug("Returning cached inspection for {}", source.identity());
            return cached;
        }

        char delimiter = detectDelimiter(source.getTag(), source.getPath());
        DatasetSample sample = loadSample(source.getTag(), source.getPath(), delimiter,
                forgeConfig.getInspectMaxRows());
        Map<String, ColumnType> types = columnTypeInferenceService.inferTypes(sample);

        InspectionResultDto result = new InspectionResultDto(
                source.getTag(),
                source.getFileName(),
                String.valueOf(delimiter),
                new ArrayList<>(sample.getColumns()),
                sample.getRows(),
                types);
        inspectionCache.put(source.identity(), result);

        logger.info("Inspected source {} ({}): {} columns, delimiter '{}'",
                source.getTag(), source.getFileName(), sample.getColumns().size(), printable(delimiter));
        return result;
    }

    /**
     * Load up to maxRows rows of a registered source, detecting its delimiter.
     *
     * @throws SourceReadException if the file cannot be read
     */
    public DatasetSample loadSample(RegisteredSource source, int maxRows) {
        char delimiter = detectDelimiter(source.getTag(), source.getPath());
        return loadSample(source.getTag(), source.getPath(), delimiter, maxRows);
    }

    /**
     * Drop every cached inspection of a dataset tag.
     *
     * @param tag dataset tag
     */
    public void evict(String tag) {
        String prefix = tag + ":";
        int before = inspectionCache.size();
        inspectionCache.keySet().removeIf(key -> key.startsWith(prefix));
        logger.debug("Evicted {} cached inspection(s) for {}", before - inspectionCache.size(), tag);
    }

    char detectDelimiter(String tag, Path path) {
        int sniffBytes = Math.max(1, forgeConfig.getSniffBytes());
        try (InputStream in = sourceFileService.openDecompressed(path)) {
            byte[] buffer = in.readNBytes(sniffBytes);
            boolean truncated = buffer.length == sniffBytes && in.read() != -1;
            String text = new String(buffer, StandardCharsets.UTF_8);
            return csvParsingService.detectDelimiter(text, truncated);
        } catch (IOException e) {
            throw new SourceReadException(tag, e);
        }
    }

    private DatasetSample loadSample(String tag, Path path, char delimiter, int maxRows) {
        try (InputStream in = sourceFileService.openDecompressed(path);
                BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            return csvParsingService.readSample(reader, delimiter, Math.max(0, maxRows));
        } catch (IOException e) {
            throw new SourceReadException(tag, e);
        }
    }

    private String printable(char delimiter) {
        return delimiter == '\t' ? "\\t" : String.valueOf(delimiter);
    }
}
