package seqio;

/**
 * Thrown for missing or mutually exclusive options, before any input is touched.
 */
public class ConfigurationException extends SeqIOException {
    public ConfigurationException(final String message) {
        super(message);
    }
}
