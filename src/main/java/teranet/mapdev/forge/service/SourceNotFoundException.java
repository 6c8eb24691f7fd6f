package teranet.mapdev.forge.service;

/**
 * Raised when a dataset tag has no registered source.
 */
public class SourceNotFoundException extends RuntimeException {

    private final String tag;

    public SourceNotFoundException(String tag) {
        super("No source registered for dataset " + tag);
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
