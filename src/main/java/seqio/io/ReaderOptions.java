package seqio.io;

/**
 * What to open and how: the inputs, an optional explicit format and the colorspace, interleaving and mate
 * selection flags. Instances are immutable; use {@link #builder(InputSource)}.
 */
public final class ReaderOptions {
    private final InputSource input;
    private final InputSource input2;
    private final InputSource qualityFile;
    private final FileFormat format;
    private final boolean colorspace;
    private final boolean interleaved;
    private final Integer singleInputRead;

    private ReaderOptions(final Builder builder) {
        this.input = builder.input;
        this.input2 = builder.input2;
        this.qualityFile = builder.qualityFile;
        this.format = builder.format;
        this.colorspace = builder.colorspace;
        this.interleaved = builder.interleaved;
        this.singleInputRead = builder.singleInputRead;
    }

    public static Builder builder(final InputSource input) {
        return new Builder().input(input);
    }

    /** The single-end input, or the first reads of two-file paired-end data. */
    public InputSource getInput() { return input; }

    /** The second reads of two-file paired-end data, or null. */
    public InputSource getInput2() { return input2; }

    /** QUAL file with the qualities for a FASTA input, or null. */
    public InputSource getQualityFile() { return qualityFile; }

    /** Explicit input format, or null to detect it. */
    public FileFormat getFormat() { return format; }

    public boolean isColorspace() { return colorspace; }

    /** Whether the input holds paired-end data in one file (interleaved text, or name-sorted SAM/BAM). */
    public boolean isInterleaved() { return interleaved; }

    /** For paired input in one file: 1 or 2 to read only that mate, null to read pairs. */
    public Integer getSingleInputRead() { return singleInputRead; }

    /** @return true if these options yield read pairs rather than single reads */
    public boolean isPairedOutput() {
        return input2 != null || (interleaved && singleInputRead == null);
    }

    public static final class Builder {
        private InputSource input;
        private InputSource input2;
        private InputSource qualityFile;
        private FileFormat format;
        private boolean colorspace = false;
        private boolean interleaved = false;
        private Integer singleInputRead;

        private Builder() {}

        public Builder input(final InputSource input) { this.input = input; return this; }

        public Builder input2(final InputSource input2) { this.input2 = input2; return this; }

        public Builder qualityFile(final InputSource qualityFile) { this.qualityFile = qualityFile; return this; }

        public Builder format(final FileFormat format) { this.format = format; return this; }

        /** Parses the format name with {@link FileFormat#fromName(String)}; null clears the format. */
        public Builder format(final String formatName) {
            this.format = formatName == null ? null : FileFormat.fromName(formatName);
            return this;
        }

        public Builder colorspace(final boolean colorspace) { this.colorspace = colorspace; return this; }

        public Builder interleaved(final boolean interleaved) { this.interleaved = interleaved; return this; }

        public Builder singleInputRead(final Integer singleInputRead) { this.singleInputRead = singleInputRead; return this; }

        public ReaderOptions build() {
            return new ReaderOptions(this);
        }
    }
}
