package seqio;

/**
 * Thrown when a record in an input file (FASTA, FASTQ, QUAL or SAM/BAM) is malformed.
 */
public class FormatException extends SeqIOException {
    public FormatException(final String message) {
        super(message);
    }
}
