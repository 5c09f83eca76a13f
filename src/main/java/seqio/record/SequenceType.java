package seqio.record;

/**
 * How raw record fields read from a file are turned into a {@link Sequence}.
 */
public enum SequenceType {
    /** Plain nucleotide (or protein) sequences. */
    BASE_SPACE {
        @Override
        public Sequence create(final String name, final String sequence, final String qualities, final String name2) {
            return new Sequence(name, sequence, qualities, name2);
        }
    },

    /** Colorspace reads: the first character of the sequence is the primer base. */
    COLORSPACE {
        @Override
        public Sequence create(final String name, final String sequence, final String qualities, final String name2) {
            final String primer = sequence.substring(0, Math.min(1, sequence.length()));
            return Sequence.colorspace(name, sequence.substring(primer.length()), qualities, primer, name2);
        }
    },

    /**
     * Colorspace reads as written by the SRA toolkit, which emits one quality value too many: the first
     * quality character belongs to the primer and is discarded.
     */
    SRA_COLORSPACE {
        @Override
        public Sequence create(final String name, final String sequence, final String qualities, final String name2) {
            final String trimmed = (qualities == null || qualities.isEmpty()) ? qualities : qualities.substring(1);
            return COLORSPACE.create(name, sequence, trimmed, name2);
        }
    };

    public abstract Sequence create(final String name, final String sequence, final String qualities, final String name2);

    public Sequence create(final String name, final String sequence, final String qualities) {
        return create(name, sequence, qualities, "");
    }

    public boolean isColorspace() {
        return this != BASE_SPACE;
    }

    public static SequenceType forColorspace(final boolean colorspace) {
        return colorspace ? COLORSPACE : BASE_SPACE;
    }
}
