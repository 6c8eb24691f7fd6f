package teranet.mapdev.forge.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.zip.GZIPInputStream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Service responsible for source file checksums and compression handling.
 *
 * Features:
 * - SHA-256 checksum calculation, used as the content identity of a source
 * - Support for compressed files (.gz, .zip)
 * - Automatic decompression stream wrapping
 *
 * This service is stateless and can be safely used concurrently.
 */
@Service
public class SourceFileService {

    private static final Logger logger = LoggerFactory.getLogger(SourceFileService.class);

    /**
     * Calculate SHA-256 checksum of a stored source file (compressed bytes as stored).
     *
     * @param path the file to calculate checksum for
     * @return SHA-256 checksum as hexadecimal string
     * @throws IOException if file cannot be read
     */
    public String calculateChecksum(Path path) throws IOException {
        logger.debug("Calculating SHA-256 checksum for file: {}", path);

        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm is not available", e);
        }

        try (InputStream inputStream = Files.newInputStream(path)) {
            byte[] buffer = new byte[8192];
            int bytesRead;

            while ((bytesRead = inputStream.read(buffer)) != -1) {
                digest.update(buffer, 0, bytesRead);
            }
        }

        return bytesToHex(digest.digest());
    }

    /**
     * Open a decompressed input stream for a source file.
     * Automatically detects and handles:
     * - .gz files → GZIPInputStream
     * - .zip files → ZipInputStream positioned at the first delimited entry
     * - plain files → file input stream
     *
     * @param path the file to open
     * @return decompressed InputStream (caller closes)
     * @throws IOException if the file cannot be opened or a zip holds no delimited entry
     */
    public InputStream openDecompressed(Path path) throws IOException {
        String filename = path.getFileName().toString().toLowerCase(Locale.ROOT);
        InputStream inputStream = Files.newInputStream(path);
        try {
            if (filename.endsWith(".gz")) {
                logger.debug("Decompressing GZIP file: {}", path);
                return new GZIPInputStream(inputStream);
            }
            if (filename.endsWith(".zip")) {
                logger.debug("Decompressing ZIP file: {}", path);
                ZipInputStream zipStream = new ZipInputStream(inputStream);
                ZipEntry entry;
                while ((entry = zipStream.getNextEntry()) != null) {
                    if (!entry.isDirectory() && isDelimitedEntry(entry.getName())) {
                        logger.debug("Found delimited entry in ZIP: {}", entry.getName());
                        return zipStream;
                    }
                }
                zipStream.close();
                throw new IOException("No CSV/TSV entry found in ZIP file: " + path.getFileName());
            }
            return inputStream;

        } catch (IOException | RuntimeException e) {
            try {
                inputStream.close();
            } catch (IOException closeError) {
                e.addSuppressed(closeError);
            }
            throw e;
        }
    }

    private boolean isDelimitedEntry(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.endsWith(".csv") || lower.endsWith(".tsv") || lower.endsWith(".txt");
    }

    private String bytesToHex(byte[] bytes) {
        StringBuilder hexString = new StringBuilder();

        for (byte b : bytes) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }

        return hexString.toString();
    }
}
