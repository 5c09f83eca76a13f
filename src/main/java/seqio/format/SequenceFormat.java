package seqio.format;

import seqio.record.Sequence;

/**
 * Renders a read as text in one sequence file format.
 */
public interface SequenceFormat {
    /**
     * @return the complete entry for the read, including the final newline
     */
    String format(final Sequence read);
}
