package seqio.io;

import seqio.UnknownFileTypeException;

/**
 * The sequence file formats that can be read. Colorspace is an orthogonal flag and is not part of the format.
 */
public enum FileFormat {
    FASTA("fasta"),
    FASTQ("fastq"),
    /** FASTQ as written by fastq-dump for colorspace runs; only valid together with colorspace. */
    SRA_FASTQ("sra-fastq"),
    SAM("sam"),
    BAM("bam");

    private final String formatName;

    FileFormat(final String formatName) {
        this.formatName = formatName;
    }

    public String getFormatName() {
        return formatName;
    }

    public boolean isAlignmentFormat() {
        return this == SAM || this == BAM;
    }

    /**
     * Parses a format name such as "fasta" or "sra-fastq", ignoring case. Enum constant names ("SRA_FASTQ")
     * are accepted as well.
     *
     * @throws UnknownFileTypeException if the name is not recognized
     */
    public static FileFormat fromName(final String name) {
        for (final FileFormat format : values()) {
            if (format.formatName.equalsIgnoreCase(name) || format.name().equalsIgnoreCase(name)) {
                return format;
            }
        }
        throw new UnknownFileTypeException(String.format(
                "File format '%s' is unknown (expected 'sra-fastq' (only for colorspace), 'fasta', 'fastq', 'sam', or 'bam').",
                name));
    }

    @Override
    public String toString() {
        return formatName;
    }
}
