package seqio.record;

/**
 * The two mates of one sequenced fragment.
 */
public final class ReadPair {
    private final Sequence read1;
    private final Sequence read2;

    public ReadPair(final Sequence read1, final Sequence read2) {
        this.read1 = read1;
        this.read2 = read2;
    }

    public Sequence getRead1() { return read1; }

    public Sequence getRead2() { return read2; }

    /** @param mate 1 or 2 */
    public Sequence getRead(final int mate) {
        switch (mate) {
            case 1: return read1;
            case 2: return read2;
            default: throw new IllegalArgumentException("Mate must be 1 or 2, not " + mate);
        }
    }

    @Override
    public String toString() {
        return "ReadPair(" + read1 + ", " + read2 + ")";
    }
}
