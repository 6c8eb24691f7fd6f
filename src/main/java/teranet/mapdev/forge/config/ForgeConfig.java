package teranet.mapdev.forge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Row caps and source handling settings.
 *
 * Maps directly to properties in application.properties:
 * - forge.inspect-max-rows
 * - forge.analysis-max-rows
 * - forge.preview-max-rows
 * - forge.preview-output-rows
 * - forge.sniff-bytes
 * - forge.upload-directory
 * - forge.allowed-extensions
 */
@Configuration
@ConfigurationProperties(prefix = "forge")
@Data
public class ForgeConfig {

    // ========================================
    // ROW CAPS
    // ========================================

    /** Rows kept when a source is inspected for its schema (forge.inspect-max-rows) */
    private int inspectMaxRows = 25;

    /** Rows read per dataset for join health (forge.analysis-max-rows) */
    private int analysisMaxRows = 5000;

    /**
     * Rows read per dataset for the preview; also the default transform
     * limit (forge.preview-max-rows)
     */
    private int previewMaxRows = 2000;

    /** Rows returned in a preview, applied after the transform limit (forge.preview-output-rows) */
    private int previewOutputRows = 30;

    // ========================================
    // SOURCE HANDLING
    // ========================================

    /** Leading bytes examined for delimiter detection (forge.sniff-bytes) */
    private int sniffBytes = 64 * 1024;

    /** Directory where uploaded sources are stored (forge.upload-directory) */
    private String uploadDirectory = System.getProperty("java.io.tmpdir") + "/transform-forge";

    /** Accepted upload extensions, comma-separated (forge.allowed-extensions) */
    private String allowedExtensions = "csv,tsv,txt,gz,zip";

    /**
     * Get the allowed extensions as an array.
     * Splits the comma-separated string and trims whitespace.
     *
     * @return Array of extensions without dots
     */
    public String[] getAllowedExtensionsArray() {
        if (allowedExtensions == null || allowedExtensions.trim().isEmpty()) {
            return new String[0];
        }
        return allowedExtensions.trim().split("\\s*,\\s*");
    }
}
