/*
 * The MIT License
 *
 * Copyright (c) 2024 The Broad Institute
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package seqio.io;

import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.RuntimeIOException;
import seqio.UnknownFileTypeException;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Determines the format of a sequence file from its name or, for streams, from its first significant line.
 */
public final class FormatDetection {
    private static final Log log = Log.getInstance(FormatDetection.class);

    /** Compression suffixes that are removed before the extension is examined. */
    public static final List<String> COMPRESSION_SUFFIXES = Arrays.asList(".gz", ".bz2", ".xz");

    private static final List<String> FASTA_EXTENSIONS = Arrays.asList(".fasta", ".fa", ".fna", ".csfasta", ".csfa");
    private static final List<String> FASTQ_EXTENSIONS = Arrays.asList(".fastq", ".fq");
    private static final String ILLUMINA_SEQUENCE_SUFFIX = "_sequence";

    private FormatDetection() {}

    /** The outcome of content sniffing: the format, if any, and a reader that still starts at the sniffed line. */
    public static final class SniffResult {
        private final FileFormat format;
        private final BufferedReader reader;

        SniffResult(final FileFormat format, final BufferedReader reader) {
            this.format = format;
            this.reader = reader;
        }

        /** @return the detected format, or null if the content did not identify one */
        public FileFormat getFormat() { return format; }

        /** @return the reader to parse from; the consumed line is pushed back into it */
        public BufferedReader getReader() { return reader; }
    }

    /**
     * Detects the format from a file name.
     *
     * @param name the file name, possibly with a compression suffix; may be null
     * @param raiseOnFailure whether to throw when the format cannot be determined
     * @return the format, or null if it could not be determined and raiseOnFailure is false
     * @throws UnknownFileTypeException if the format could not be determined and raiseOnFailure is true
     */
    public static FileFormat guessFormatFromName(final String name, final boolean raiseOnFailure) {
        String extension = "";
        if (name != null && !name.isEmpty()) {
            final String[] parts = splitExtensionCompressed(name);
            final String stem = parts[0];
            extension = parts[1].toLowerCase(Locale.ROOT);
            if (FASTA_EXTENSIONS.contains(extension)) {
                return FileFormat.FASTA;
            } else if (FASTQ_EXTENSIONS.contains(extension) ||
                    (extension.equals(".txt") && stem.endsWith(ILLUMINA_SEQUENCE_SUFFIX))) {
                return FileFormat.FASTQ;
            } else if (extension.equals(".sam")) {
                return FileFormat.SAM;
            } else if (extension.equals(".bam")) {
                return FileFormat.BAM;
            }
        }
        if (raiseOnFailure) {
            throw new UnknownFileTypeException(String.format(
                    "Could not determine whether file '%s' is FASTA or FASTQ: file name extension '%s' not recognized",
                    name, extension));
        }
        return null;
    }

    public static FileFormat guessFormatFromName(final String name) {
        return guessFormatFromName(name, false);
    }

    /**
     * Splits a file name into stem and extension after removing a compression suffix, e.g.
     * "reads.fastq.gz" becomes {"reads", ".fastq"}. The extension is empty if the file name has none.
     */
    static String[] splitExtensionCompressed(final String name) {
        String stripped = name;
        final String lower = name.toLowerCase(Locale.ROOT);
        for (final String suffix : COMPRESSION_SUFFIXES) {
            if (lower.endsWith(suffix)) {
                stripped = name.substring(0, name.length() - suffix.length());
                break;
            }
        }
        final int baseStart = Math.max(stripped.lastIndexOf('/'), stripped.lastIndexOf('\\')) + 1;
        final int dot = stripped.lastIndexOf('.');
        if (dot <= baseStart) {
            return new String[]{stripped, ""};
        }
        return new String[]{stripped.substring(0, dot), stripped.substring(dot)};
    }

    /**
     * Reads lines from the reader until the first one that is not a '#' comment and classifies it:
     * '&gt;' means FASTA and '@' means FASTQ. That line is pushed back into the returned reader, so the
     * parser still sees it as the first line of the first record. The comment lines are consumed.
     */
    public static SniffResult sniff(final BufferedReader reader) {
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.startsWith("#")) {
                    continue;
                }
                final FileFormat format;
                if (line.startsWith(">")) {
                    format = FileFormat.FASTA;
                } else if (line.startsWith("@")) {
                    format = FileFormat.FASTQ;
                } else {
                    format = null;
                }
                log.debug("Detected format ", format, " from first line of input");
                return new SniffResult(format, new BufferedReader(new PrependedLineReader(line, reader)));
            }
        } catch (final IOException e) {
            throw new RuntimeIOException("Error while reading first line of input", e);
        }
        return new SniffResult(null, reader);
    }
}
