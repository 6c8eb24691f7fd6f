package teranet.mapdev.forge.service;

/**
 * Raised when a registered source cannot be read.
 * Reported as a single top-level failure, distinct from configuration errors.
 */
public class SourceReadException extends RuntimeException {

    private final String source;

    public SourceReadException(String source, Throwable cause) {
        super("Failed to read source " + source + ": " + cause.getMessage(), cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
