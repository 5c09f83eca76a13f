package seqio.format;

import com.google.common.base.Preconditions;
import seqio.record.Sequence;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Writes both reads of each pair, first then second, to the same destination.
 */
public class InterleavedFormatter extends SequenceFormatter {

    public InterleavedFormatter(final SequenceFormat sequenceFormat, final String file1) {
        super(sequenceFormat, file1);
    }

    @Override
    public void format(final Map<String, List<String>> result, final Sequence read1, final Sequence read2) {
        Preconditions.checkArgument(read2 != null, "Interleaved output requires two reads");
        final List<String> entries = entries(result, file1);
        entries.add(sequenceFormat.format(read1));
        entries.add(sequenceFormat.format(read2));
        written++;
        read1Bp += read1.length();
        read2Bp += read2.length();
    }

    @Override
    public List<String> getDestinations() {
        return Collections.singletonList(file1);
    }
}
