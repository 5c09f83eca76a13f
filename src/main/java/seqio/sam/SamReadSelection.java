package seqio.sam;

import htsjdk.samtools.SAMRecord;

/**
 * Which records of a SAM/BAM file to read when it is read as single-end data.
 */
public enum SamReadSelection {
    /** Every record. */
    ALL {
        @Override
        public boolean accept(final SAMRecord record) {
            return true;
        }
    },
    /** Only records flagged as the first read of a pair. */
    FIRST_OF_PAIR {
        @Override
        public boolean accept(final SAMRecord record) {
            return AbstractSamSequenceReader.isFirstOfPair(record);
        }
    },
    /** Only records flagged as the second read of a pair. */
    SECOND_OF_PAIR {
        @Override
        public boolean accept(final SAMRecord record) {
            return AbstractSamSequenceReader.isSecondOfPair(record);
        }
    };

    public abstract boolean accept(final SAMRecord record);

    /** @param singleInputRead 1, 2, or null for all records */
    public static SamReadSelection forMate(final Integer singleInputRead) {
        if (singleInputRead == null) return ALL;
        switch (singleInputRead) {
            case 1: return FIRST_OF_PAIR;
            case 2: return SECOND_OF_PAIR;
            default: throw new IllegalArgumentException("Mate must be 1 or 2, not " + singleInputRead);
        }
    }
}
