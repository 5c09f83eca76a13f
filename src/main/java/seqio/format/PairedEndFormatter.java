package seqio.format;

import com.google.common.base.Preconditions;
import seqio.record.Sequence;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Writes the first reads of pairs to one destination and the second reads to another.
 */
public class PairedEndFormatter extends SequenceFormatter {
    private final String file2;

    public PairedEndFormatter(final SequenceFormat sequenceFormat, final String file1, final String file2) {
        super(sequenceFormat, file1);
        this.file2 = file2;
    }

    @Override
    public void format(final Map<String, List<String>> result, final Sequence read1, final Sequence read2) {
        Preconditions.checkArgument(read2 != null, "Paired-end output requires two reads");
        entries(result, file1).add(sequenceFormat.format(read1));
        entries(result, file2).add(sequenceFormat.format(read2));
        written++;
        read1Bp += read1.length();
        read2Bp += read2.length();
    }

    @Override
    public List<String> getDestinations() {
        return Arrays.asList(file1, file2);
    }
}
