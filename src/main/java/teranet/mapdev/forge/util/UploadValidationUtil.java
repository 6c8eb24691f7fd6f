package teranet.mapdev.forge.util;

import org.springframework.web.multipart.MultipartFile;

import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Utility class for validating source uploads.
 * Every check throws IllegalArgumentException with a message fit for the client.
 */
public class UploadValidationUtil {

    private static final Pattern TAG_PATTERN = Pattern.compile("[a-z][a-z0-9_]{0,31}");

    private UploadValidationUtil() {
        // Private constructor to prevent instantiation
    }

    /**
     * Validates that the file is not null and not empty.
     *
     * @param file the file to validate
     * @throws IllegalArgumentException if file is null or empty
     */
    public static void validateFileNotEmpty(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("File is empty or not provided");
        }
    }

    /**
     * Validates that the file has a usable filename and returns its last path segment.
     *
     * @param file the file to validate
     * @return the filename without any client-side directory part
     * @throws IllegalArgumentException if filename is null or empty
     */
    public static String validateAndGetFilename(MultipartFile file) {
        String filename = file.getOriginalFilename();
        if (filename == null || filename.trim().isEmpty()) {
            throw new IllegalArgumentException("Invalid filename");
        }
        String name = filename.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1).trim();
        if (name.isEmpty() || name.equals(".") || name.equals("..")) {
            throw new IllegalArgumentException("Invalid filename");
        }
        return name;
    }

    /**
     * Validates that the file has one of the allowed extensions.
     *
     * @param file              the file to validate
     * @param allowedExtensions allowed file extensions (without dot, e.g. "csv", "gz")
     * @throws IllegalArgumentException if file extension is not allowed
     */
    public static void validateFileExtension(MultipartFile file, String... allowedExtensions) {
        String filename = validateAndGetFilename(file);
        String lowerCaseFilename = filename.toLowerCase(Locale.ROOT);

        boolean isValid = Arrays.stream(allowedExtensions)
                .filter(ext -> ext != null && !ext.isBlank())
                .anyMatch(ext -> lowerCaseFilename.endsWith("." + ext.trim().toLowerCase(Locale.ROOT)));

        if (!isValid) {
            String allowedTypes = Arrays.stream(allowedExtensions)
                    .filter(ext -> ext != null && !ext.isBlank())
                    .map(ext -> ext.trim().toUpperCase(Locale.ROOT))
                    .reduce((a, b) -> a + ", " + b)
                    .orElse("unknown");
            throw new IllegalArgumentException(
                    String.format("Invalid file type. Expected %s file but received '%s'. Please upload a valid file.",
                            allowedTypes, filename));
        }
    }

    /**
     * Comprehensive upload validation: file present and with an allowed extension.
     */
    public static void validateFile(MultipartFile file, String... allowedExtensions) {
        validateFileNotEmpty(file);
        validateFileExtension(file, allowedExtensions);
    }

    /**
     * Validates a dataset tag: lowercase letter first, then lowercase letters,
     * digits or underscores, at most 32 characters, and no "__" (reserved as
     * the joined column prefix separator).
     *
     * @param tag the dataset tag
     * @return the tag
     * @throws IllegalArgumentException if the tag is not valid
     */
    public static String validateTag(String tag) {
        if (tag == null || !TAG_PATTERN.matcher(tag).matches() || tag.contains("__")) {
            throw new IllegalArgumentException(String.format(
                    "Invalid dataset tag '%s'. Use a lowercase letter followed by lowercase letters, digits "
                            + "or single underscores (max 32 characters).", tag));
        }
        return tag;
    }
}
