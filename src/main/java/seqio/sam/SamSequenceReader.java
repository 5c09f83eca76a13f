package seqio.sam;

import htsjdk.samtools.SAMRecord;
import seqio.record.Sequence;

import java.io.Closeable;
import java.util.Iterator;

/**
 * Reads a SAM/BAM file as single-end data: all records, or only the first or only the second reads of pairs.
 */
public class SamSequenceReader extends AbstractSamSequenceReader<Sequence> {
    private final SamReadSelection selection;

    public SamSequenceReader(final Iterator<SAMRecord> records, final Closeable source, final SamReadSelection selection) {
        super(records, source);
        this.selection = selection;
    }

    public SamReadSelection getSelection() {
        return selection;
    }

    @Override
    protected Sequence readNext() {
        while (records.hasNext()) {
            final SAMRecord record = records.next();
            if (selection.accept(record)) {
                return toSequence(record);
            }
        }
        return null;
    }
}
