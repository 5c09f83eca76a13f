package seqio;

/**
 * Thrown when a file format could neither be determined from the file name nor from the content,
 * or when an explicitly requested format is not supported.
 */
public class UnknownFileTypeException extends SeqIOException {
    public UnknownFileTypeException(final String message) {
        super(message);
    }
}
