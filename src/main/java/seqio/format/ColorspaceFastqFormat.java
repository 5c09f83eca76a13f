package seqio.format;

import seqio.record.Sequence;

/**
 * FASTQ output of colorspace reads: the primer base is written in front of the color calls, the qualities
 * are written unchanged.
 */
public class ColorspaceFastqFormat extends FastqFormat {

    @Override
    public String format(final Sequence read) {
        return formatEntry(read.getName(), FormatUtil.primer(read) + read.getSequence(), read.getQualities(), read.getName2());
    }
}
