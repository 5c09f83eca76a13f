package seqio.format;

import seqio.record.Sequence;

/**
 * FASTA output of colorspace reads: the primer base is written in front of the color calls.
 */
public class ColorspaceFastaFormat extends FastaFormat {

    public ColorspaceFastaFormat(final Integer lineLength) {
        super(lineLength);
    }

    @Override
    public String format(final Sequence read) {
        return formatEntry(read.getName(), FormatUtil.primer(read) + read.getSequence());
    }
}
