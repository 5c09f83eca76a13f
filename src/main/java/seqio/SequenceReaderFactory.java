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
package seqio;

import htsjdk.samtools.SAMRecordIterator;
import htsjdk.samtools.SamReader;
import htsjdk.samtools.util.CloserUtil;
import htsjdk.samtools.util.Log;
import seqio.fasta.FastaQualReader;
import seqio.fasta.FastaReader;
import seqio.fastq.FastqParser;
import seqio.fastq.FastqSequenceReader;
import seqio.io.FileFormat;
import seqio.io.FormatDetection;
import seqio.io.InputSource;
import seqio.io.ReaderOptions;
import seqio.io.RecordReader;
import seqio.pair.InterleavedSequenceReader;
import seqio.pair.PairedSequenceReader;
import seqio.pair.SingleMateReader;
import seqio.record.ReadPair;
import seqio.record.Sequence;
import seqio.record.SequenceType;
import seqio.sam.PairedEndSamReader;
import seqio.sam.SamReadSelection;
import seqio.sam.SamSequenceReader;

import java.io.BufferedReader;

/**
 * Opens the reader that matches a set of {@link ReaderOptions}.
 * <p>
 * The input format is taken from the options if given, otherwise from the file name extension, otherwise
 * from the first line of the content. Colorspace is never detected and must be requested. Depending on the
 * options the reader yields single reads ({@link Sequence}) or pairs ({@link ReadPair}):
 * </p>
 * <ul>
 *     <li>a second input gives pairs from two files;</li>
 *     <li>a quality file gives single reads from FASTA + QUAL;</li>
 *     <li>interleaved gives pairs from one file (text, or name-sorted SAM/BAM), or one mate of each pair when
 *     a single input read is selected;</li>
 *     <li>otherwise single reads, for SAM/BAM optionally restricted to the first or second reads.</li>
 * </ul>
 */
public final class SequenceReaderFactory {
    private static final Log log = Log.getInstance(SequenceReaderFactory.class);

    private SequenceReaderFactory() {}

    /**
     * Opens a reader for the given options.
     *
     * @return a reader of {@link Sequence}s if {@link ReaderOptions#isPairedOutput()} is false, else a reader of {@link ReadPair}s
     * @throws ConfigurationException if the options are inconsistent
     * @throws UnknownFileTypeException if the input format cannot be determined or is not supported
     */
    public static RecordReader<?> openReader(final ReaderOptions options) {
        validate(options);
        final boolean colorspace = options.isColorspace();

        if (options.getInput2() != null) {
            final RecordReader<Sequence> reader1 = openSingleFile(options.getInput(), options.getFormat(), colorspace);
            final RecordReader<Sequence> reader2;
            try {
                reader2 = openSingleFile(options.getInput2(), options.getFormat(), colorspace);
            } catch (final RuntimeException e) {
                reader1.close();
                throw e;
            }
            return new PairedSequenceReader(reader1, reader2);
        }

        if (options.getQualityFile() != null) {
            log.debug("Reading sequences from ", options.getInput(), " and qualities from ", options.getQualityFile());
            final BufferedReader fasta = options.getInput().openBufferedReader();
            final BufferedReader qual;
            try {
                qual = options.getQualityFile().openBufferedReader();
            } catch (final RuntimeException e) {
                CloserUtil.close(fasta);
                throw e;
            }
            return new FastaQualReader(fasta, qual, SequenceType.forColorspace(colorspace));
        }

        return openFile(options.getInput(), options.getFormat(), colorspace, options.isInterleaved(), options.getSingleInputRead());
    }

    /**
     * Opens a reader of single reads.
     *
     * @throws ConfigurationException if the options describe paired output
     */
    @SuppressWarnings("unchecked")
    public static RecordReader<Sequence> openSingleEndReader(final ReaderOptions options) {
        if (options.isPairedOutput()) {
            throw new ConfigurationException("The options describe paired-end input; use a paired reader or select a single input read.");
        }
        return (RecordReader<Sequence>) openReader(options);
    }

    /**
     * Opens a reader of read pairs.
     *
     * @throws ConfigurationException if the options do not describe paired output
     */
    @SuppressWarnings("unchecked")
    public static RecordReader<ReadPair> openPairedReader(final ReaderOptions options) {
        if (!options.isPairedOutput()) {
            throw new ConfigurationException("The options describe single-end input; give a second input or set interleaved without a single input read.");
        }
        return (RecordReader<ReadPair>) openReader(options);
    }

    static void validate(final ReaderOptions options) {
        if (options.getInput() == null) {
            throw new ConfigurationException("An input is required.");
        }
        if (options.isInterleaved() && (options.getInput2() != null || options.getQualityFile() != null)) {
            throw new ConfigurationException("When interleaved is set, a second input and a quality file must not be given.");
        }
        if (options.getInput2() != null && options.getQualityFile() != null) {
            throw new ConfigurationException("Setting both a second input and a quality file is not supported.");
        }
        final Integer mate = options.getSingleInputRead();
        if (mate != null && mate != 1 && mate != 2) {
            throw new ConfigurationException("The single input read must be 1 or 2, not " + mate + ".");
        }
    }

    @SuppressWarnings("unchecked")
    private static RecordReader<Sequence> openSingleFile(final InputSource source, final FileFormat format, final boolean colorspace) {
        return (RecordReader<Sequence>) openFile(source, format, colorspace, false, null);
    }

    private static RecordReader<?> openFile(final InputSource source, final FileFormat explicitFormat, final boolean colorspace,
                                            final boolean interleaved, final Integer singleInputRead) {
        FileFormat format = explicitFormat;
        BufferedReader sniffed = null;
        if (format == null) {
            format = FormatDetection.guessFormatFromName(source.getDetectableName());
        }
        if (format == null) {
            final FormatDetection.SniffResult result = FormatDetection.sniff(source.openBufferedReader());
            sniffed = result.getReader();
            format = result.getFormat();
            if (format == null) {
                CloserUtil.close(sniffed);
                throw new UnknownFileTypeException(String.format(
                        "Could not determine the format of '%s' from its name or its first line (expected FASTA or FASTQ).", source));
            }
        }
        log.debug("Opening ", source, " as ", format, colorspace ? " (colorspace)" : "");

        if (format.isAlignmentFormat()) {
            if (colorspace) {
                throw new ConfigurationException("SAM/BAM format is not currently supported for colorspace reads");
            }
            return openAlignmentFile(source, interleaved, singleInputRead);
        }
        if (format == FileFormat.SRA_FASTQ && !colorspace) {
            CloserUtil.close(sniffed);
            throw unknownFormat(format);
        }

        final RecordReader<Sequence> reader = openTextFile(source, sniffed, format, colorspace);
        if (!interleaved) {
            return reader;
        }
        final InterleavedSequenceReader pairs = new InterleavedSequenceReader(reader);
        return singleInputRead == null ? pairs : new SingleMateReader(pairs, singleInputRead);
    }

    private static RecordReader<?> openAlignmentFile(final InputSource source, final boolean interleaved, final Integer singleInputRead) {
        final SamReader samReader = source.openSamReader();
        final SAMRecordIterator records = samReader.iterator();
        if (singleInputRead != null) {
            return new SamSequenceReader(records, samReader, SamReadSelection.forMate(singleInputRead));
        }
        if (interleaved) {
            return new PairedEndSamReader(records, samReader);
        }
        return new SamSequenceReader(records, samReader, SamReadSelection.ALL);
    }

    private static RecordReader<Sequence> openTextFile(final InputSource source, final BufferedReader sniffed,
                                                       final FileFormat format, final boolean colorspace) {
        final BufferedReader text = sniffed != null ? sniffed : source.openBufferedReader();
        switch (format) {
            case FASTA:
                return new FastaReader(text, SequenceType.forColorspace(colorspace), false);
            case FASTQ:
                final FastqParser parser = new FastqParser(text, source.getName());
                return new FastqSequenceReader(parser, parser, SequenceType.forColorspace(colorspace));
            case SRA_FASTQ:
                final FastqParser sraParser = new FastqParser(text, source.getName());
                return new FastqSequenceReader(sraParser, sraParser, SequenceType.SRA_COLORSPACE);
            default:
                CloserUtil.close(text);
                throw unknownFormat(format);
        }
    }

    private static UnknownFileTypeException unknownFormat(final FileFormat format) {
        return new UnknownFileTypeException(String.format(
                "File format '%s' is unknown (expected 'sra-fastq' (only for colorspace), 'fasta', 'fastq', 'sam', or 'bam').",
                format.getFormatName()));
    }
}
