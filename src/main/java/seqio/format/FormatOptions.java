package seqio.format;

import seqio.io.FileFormat;

/**
 * How to write reads: an explicit output format (else detected from the file name), colorspace, whether
 * the reads carry qualities and the FASTA line length. Instances are immutable; use {@link #builder()}.
 */
public final class FormatOptions {
    private final FileFormat format;
    private final boolean colorspace;
    private final Boolean qualities;
    private final Integer lineLength;

    private FormatOptions(final Builder builder) {
        this.format = builder.format;
        this.colorspace = builder.colorspace;
        this.qualities = builder.qualities;
        this.lineLength = builder.lineLength;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Explicit output format, or null to detect it from the file name. */
    public FileFormat getFormat() { return format; }

    public boolean isColorspace() { return colorspace; }

    /**
     * Whether the reads to be written have qualities: TRUE, FALSE, or null if that is not known. When known,
     * an unrecognized file name falls back to FASTQ or FASTA instead of failing.
     */
    public Boolean getQualities() { return qualities; }

    /** Maximum FASTA line length, or null to not wrap. */
    public Integer getLineLength() { return lineLength; }

    public static final class Builder {
        private FileFormat format;
        private boolean colorspace = false;
        private Boolean qualities;
        private Integer lineLength;

        private Builder() {}

        public Builder format(final FileFormat format) { this.format = format; return this; }

        /** Parses the format name with {@link FileFormat#fromName(String)}; null clears the format. */
        public Builder format(final String formatName) {
            this.format = formatName == null ? null : FileFormat.fromName(formatName);
            return this;
        }

        public Builder colorspace(final boolean colorspace) { this.colorspace = colorspace; return this; }

        public Builder qualities(final Boolean qualities) { this.qualities = qualities; return this; }

        public Builder lineLength(final Integer lineLength) { this.lineLength = lineLength; return this; }

        public FormatOptions build() {
            return new FormatOptions(this);
        }
    }
}
