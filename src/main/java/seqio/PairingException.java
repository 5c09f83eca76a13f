package seqio;

/**
 * Thrown when two read streams that should be in lock-step are not: unequal record counts,
 * mismatching names or a mate without partner.
 */
public class PairingException extends SeqIOException {
    public PairingException(final String message) {
        super(message);
    }
}
