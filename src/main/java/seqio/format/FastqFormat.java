package seqio.format;

import seqio.FormatException;
import seqio.record.ReadNames;
import seqio.record.Sequence;

/**
 * FASTQ output. The secondary header of the '+' line is written as read.
 */
public class FastqFormat implements SequenceFormat {

    @Override
    public String format(final Sequence read) {
        return formatEntry(read.getName(), read.getSequence(), read.getQualities(), read.getName2());
    }

    protected String formatEntry(final String name, final String sequence, final String qualities, final String name2) {
        if (qualities == null) {
            throw new FormatException("Cannot write read '" + ReadNames.truncate(name) + "' as FASTQ: it has no quality values.");
        }
        return new StringBuilder(name.length() + name2.length() + 2 * sequence.length() + 6)
                .append('@').append(name).append('\n')
                .append(sequence).append("\n+")
                .append(name2).append('\n')
                .append(qualities).append('\n')
                .toString();
    }
}
