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
package seqio.format;

import htsjdk.samtools.util.Log;
import seqio.ConfigurationException;
import seqio.UnknownFileTypeException;
import seqio.io.FileFormat;
import seqio.io.FormatDetection;

/**
 * Chooses the output format for a file and creates the formatter that routes reads to the output files.
 */
public final class SequenceFormatterFactory {
    private static final Log log = Log.getInstance(SequenceFormatterFactory.class);

    private SequenceFormatterFactory() {}

    /**
     * Returns the format to write the given file in.
     * <p>
     * An explicit format wins. Otherwise the format is detected from the file name; if that fails and
     * {@link FormatOptions#getQualities()} is known, FASTQ is chosen for reads with qualities and FASTA for
     * reads without.
     * </p>
     *
     * @throws UnknownFileTypeException if no format can be determined, or if it is neither FASTA nor FASTQ
     * @throws ConfigurationException if FASTQ is requested for reads without qualities
     */
    public static SequenceFormat getFormat(final String path, final FormatOptions options) {
        final Boolean qualities = options.getQualities();
        FileFormat format = options.getFormat();
        if (format == null) {
            format = FormatDetection.guessFormatFromName(path, qualities == null);
        }
        if (format == null) {
            if (Boolean.TRUE.equals(qualities)) {
                format = FileFormat.FASTQ;
            } else if (Boolean.FALSE.equals(qualities)) {
                format = FileFormat.FASTA;
            }
            log.debug("Output format of ", path, " not recognized from its name, using ", format);
        }
        if (format == null) {
            throw new UnknownFileTypeException("Could not determine file type.");
        }
        if (format == FileFormat.FASTQ && Boolean.FALSE.equals(qualities)) {
            throw new ConfigurationException("Output format cannot be FASTQ since no quality values are available.");
        }

        switch (format) {
            case FASTA:
                return options.isColorspace()
                        ? new ColorspaceFastaFormat(options.getLineLength())
                        : new FastaFormat(options.getLineLength());
            case FASTQ:
                return options.isColorspace() ? new ColorspaceFastqFormat() : new FastqFormat();
            default:
                throw new UnknownFileTypeException(String.format(
                        "File format '%s' is unknown (expected 'fasta' or 'fastq').", format.getFormatName()));
        }
    }

    /**
     * Creates a formatter whose format is chosen by {@link #getFormat(String, FormatOptions)} for file1.
     *
     * @param file1 the output file, or the file for first reads
     * @param file2 the file for second reads, or null
     * @param interleaved whether pairs are written alternately to file1
     * @throws ConfigurationException if both file2 and interleaved are given
     */
    public static SequenceFormatter createSeqFormatter(final String file1, final String file2, final boolean interleaved,
                                                       final FormatOptions options) {
        if (file2 != null && interleaved) {
            throw new ConfigurationException("Interleaved output cannot be combined with a second output file.");
        }
        final SequenceFormat format = getFormat(file1, options);
        if (file2 != null) {
            return new PairedEndFormatter(format, file1, file2);
        } else if (interleaved) {
            return new InterleavedFormatter(format, file1);
        } else {
            return new SingleEndFormatter(format, file1);
        }
    }

    public static SequenceFormatter createSeqFormatter(final String file1, final FormatOptions options) {
        return createSeqFormatter(file1, null, false, options);
    }
}
