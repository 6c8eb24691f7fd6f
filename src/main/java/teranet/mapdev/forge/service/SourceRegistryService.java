package teranet.mapdev.forge.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;
import teranet.mapdev.forge.config.ForgeConfig;
import teranet.mapdev.forge.dto.InspectionResultDto;
import teranet.mapdev.forge.dto.SourceUploadResponseDto;
import teranet.mapdev.forge.model.ColumnDescriptor;
import teranet.mapdev.forge.model.RegisteredSource;
import teranet.mapdev.forge.util.UploadValidationUtil;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Registry of delimited sources by dataset tag.
 *
 * Uploads are stored under {@code <upload-directory>/<tag>/}. Re-uploading
 * identical content (same file name and checksum) keeps the registration
 * and its cached inspection; anything else replaces the source and evicts
 * the cached inspection of the tag.
 *
 * Tags are ordered with the primary dataset "a" first, then alphabetically.
 * That order is the declaration order of right-hand datasets.
 */
@Service
public class SourceRegistryService {

    private static final Logger logger = LoggerFactory.getLogger(SourceRegistryService.class);

    private static final Comparator<String> TAG_ORDER = Comparator
            .comparing((String tag) -> !ColumnDescriptor.PRIMARY_SOURCE.equals(tag))
            .thenComparing(Comparator.naturalOrder());

    private final ForgeConfig forgeConfig;
    private final SourceFileService sourceFileService;
    private final SchemaInspectorService schemaInspectorService;

    private final Map<String, RegisteredSource> sources = new ConcurrentHashMap<>();

    public SourceRegistryService(ForgeConfig forgeConfig,
            SourceFileService sourceFileService,
            SchemaInspectorService schemaInspectorService) {
        this.forgeConfig = forgeConfig;
        this.sourceFileService = sourceFileService;
        this.schemaInspectorService = schemaInspectorService;
    }

    /**
     * Store an uploaded file under a dataset tag and inspect it.
     *
     * @param tag  dataset tag
     * @param file the uploaded file
     * @return registration outcome with the inspection
     * @throws IllegalArgumentException for an invalid tag or upload
     * @throws IOException              if the file cannot be stored
     * @throws SourceReadException      if the uploaded file cannot be parsed; the
     *                                  dataset's current registration is kept
     */
    public SourceUploadResponseDto upload(String tag, MultipartFile file) throws IOException {
        UploadValidationUtil.validateTag(tag);
        UploadValidationUtil.validateFile(file, forgeConfig.getAllowedExtensionsArray());
        String fileName = UploadValidationUtil.validateAndGetFilename(file);

        Path tagDirectory = Paths.get(forgeConfig.getUploadDirectory(), tag);
        Files.createDirectories(tagDirectory);

        // staged name keeps the upload's extensions so compressed files are detected
        Path incoming = Files.createTempFile(tagDirectory, "upload-", "-" + fileName);
        try {
            try (InputStream in = file.getInputStream()) {
                Files.copy(in, incoming, StandardCopyOption.REPLACE_EXISTING);
            }
            String checksum = sourceFileService.calculateChecksum(incoming);

            RegisteredSource existing = sources.get(tag);
            if (existing != null && checksum.equals(existing.getChecksum())
                    && fileName.equals(existing.getFileName()) && Files.exists(existing.getPath())) {
                logger.info("Upload for dataset {} is identical to the registered file {}", tag, fileName);
                return SourceUploadResponseDto.unchanged(tag, fileName, existing.getFileSizeBytes(),
                        schemaInspectorService.inspect(existing));
            }

            // an unreadable upload fails here and leaves the current registration untouched
            RegisteredSource staged = new RegisteredSource(tag, fileName, incoming, checksum,
                    Files.size(incoming), LocalDateTime.now());
            schemaInspectorService.evict(tag);
            InspectionResultDto inspection = schemaInspectorService.inspect(staged);

            Path target = tagDirectory.resolve(fileName);
            Files.move(incoming, target, StandardCopyOption.REPLACE_EXISTING);
            if (existing != null && !existing.getPath().equals(target) && isManaged(existing.getPath())) {
                Files.deleteIfExists(existing.getPath());
            }

            RegisteredSource source = put(tag, fileName, target, checksum);
            return SourceUploadResponseDto.registered(tag, fileName, source.getFileSizeBytes(), inspection);
        } finally {
            Files.deleteIfExists(incoming);
        }
    }

    /**
     * Register a file already on disk under a dataset tag (it is not copied).
     *
     * @throws IOException if the file cannot be read
     */
    public RegisteredSource register(String tag, Path path) throws IOException {
        UploadValidationUtil.validateTag(tag);
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Source file not found: " + path);
        }
        String checksum = sourceFileService.calculateChecksum(path);
        schemaInspectorService.evict(tag);
        return put(tag, path.getFileName().toString(), path, checksum);
    }

    private RegisteredSource put(String tag, String fileName, Path path, String checksum) throws IOException {
        RegisteredSource source = new RegisteredSource(tag, fileName, path, checksum, Files.size(path),
                LocalDateTime.now());
        sources.put(tag, source);
        logger.info("Registered source {} for dataset {} ({} bytes, checksum {})",
                fileName, tag, source.getFileSizeBytes(), checksum);
        return source;
    }

    public Optional<RegisteredSource> find(String tag) {
        return Optional.ofNullable(sources.get(tag));
    }

    /**
     * @throws SourceNotFoundException when nothing is registered under the tag
     */
    public RegisteredSource require(String tag) {
        return find(tag).orElseThrow(() -> new SourceNotFoundException(tag));
    }

    /**
     * Registered sources, primary dataset first, then by tag.
     */
    public List<RegisteredSource> list() {
        return sources.values().stream()
                .sorted(Comparator.comparing(RegisteredSource::getTag, TAG_ORDER))
                .collect(Collectors.toList());
    }

    /**
     * Tags of the registered right-hand datasets, in declaration order.
     */
    public List<String> rightTags() {
        List<String> tags = new ArrayList<>();
        for (RegisteredSource source : list()) {
            if (!ColumnDescriptor.PRIMARY_SOURCE.equals(source.getTag())) {
                tags.add(source.getTag());
            }
        }
        return tags;
    }

    /**
     * Forget a source. Files stored by {@link #upload} are deleted.
     *
     * @return true when a source was registered under the tag
     * @throws IOException if the stored file cannot be deleted
     */
    public boolean remove(String tag) throws IOException {
        RegisteredSource removed = sources.remove(tag);
        if (removed == null) {
            return false;
        }
        schemaInspectorService.evict(tag);
        if (isManaged(removed.getPath())) {
            Files.deleteIfExists(removed.getPath());
        }
        logger.info("Removed source {} for dataset {}", removed.getFileName(), tag);
        return true;
    }

    private boolean isManaged(Path path) {
        Path uploads = Paths.get(forgeConfig.getUploadDirectory()).toAbsolutePath().normalize();
        return path.toAbsolutePath().normalize().startsWith(uploads);
    }
}
