package seqio.pair;

import seqio.io.AbstractRecordReader;
import seqio.io.RecordReader;
import seqio.record.ReadPair;
import seqio.record.Sequence;

/**
 * Presents one mate of every pair of a paired reader as single-end data. The pairs are still read and
 * validated in full; only the other mate is dropped.
 */
public class SingleMateReader extends AbstractRecordReader<Sequence> {
    private final RecordReader<ReadPair> pairs;
    private final int mate;

    /**
     * @param pairs the paired reader, owned by this reader from now on
     * @param mate 1 for the first reads, 2 for the second reads
     */
    public SingleMateReader(final RecordReader<ReadPair> pairs, final int mate) {
        if (mate != 1 && mate != 2) {
            throw new IllegalArgumentException("Mate must be 1 or 2, not " + mate);
        }
        this.pairs = pairs;
        this.mate = mate;
    }

    public int getMate() {
        return mate;
    }

    @Override
    public boolean deliversQualities() {
        return pairs.deliversQualities();
    }

    @Override
    protected Sequence readNext() {
        return pairs.hasNext() ? pairs.next().getRead(mate) : null;
    }

    @Override
    protected void doClose() {
        pairs.close();
    }
}
