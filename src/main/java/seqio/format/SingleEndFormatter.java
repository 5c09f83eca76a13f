package seqio.format;

import seqio.record.Sequence;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Writes single-end reads to one destination. A second read, if given, is ignored.
 */
public class SingleEndFormatter extends SequenceFormatter {

    public SingleEndFormatter(final SequenceFormat sequenceFormat, final String file1) {
        super(sequenceFormat, file1);
    }

    @Override
    public void format(final Map<String, List<String>> result, final Sequence read1, final Sequence read2) {
        entries(result, file1).add(sequenceFormat.format(read1));
        written++;
        read1Bp += read1.length();
    }

    @Override
    public List<String> getDestinations() {
        return Collections.singletonList(file1);
    }
}
