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
package seqio.tools;

import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.ProgressLogger;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.barclay.help.DocumentedFeature;
import seqio.SequenceReaderFactory;
import seqio.UnknownFileTypeException;
import seqio.cmdline.CommandLineProgram;
import seqio.cmdline.StandardOptionDefinitions;
import seqio.cmdline.programgroups.SequenceDataProgramGroup;
import seqio.format.FormatOptions;
import seqio.format.SequenceFormatter;
import seqio.format.SequenceFormatterFactory;
import seqio.io.FileFormat;
import seqio.io.InputSource;
import seqio.io.ReaderOptions;
import seqio.io.RecordReader;
import seqio.record.ReadPair;
import seqio.record.Sequence;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads single-end or paired-end reads in any supported input layout and writes them as FASTA or FASTQ.
 */
@CommandLineProgramProperties(
        summary = "<p>" + ConvertSequences.USAGE_SUMMARY + ".</p>" + ConvertSequences.USAGE_DETAILS,
        oneLineSummary = ConvertSequences.USAGE_SUMMARY,
        programGroup = SequenceDataProgramGroup.class)
@DocumentedFeature
public class ConvertSequences extends CommandLineProgram {
    static final String USAGE_SUMMARY = "Converts reads between FASTA, FASTQ, FASTA/QUAL and SAM/BAM files";
    static final String USAGE_DETAILS = "<p>Input may be a single file, two files holding the first and second reads of pairs, " +
            "a FASTA file with a separate QUAL file, an interleaved FASTA/FASTQ file or a name-sorted SAM/BAM file. " +
            "The input format is taken from INPUT_FORMAT, else from the file name extension, else from the first line " +
            "of the file. Colorspace data must be requested with COLORSPACE.</p>" +
            "<p>The output format is taken from OUTPUT_FORMAT, else from the output file name. If the name is not " +
            "recognized, FASTQ is written when the input has qualities and FASTA otherwise.</p>" +
            "<h4>Usage example:</h4>" +
            "<pre>" +
            "java -jar seqio.jar ConvertSequences \\<br />" +
            "     -I reads_1.fastq.gz \\<br />" +
            "     --INPUT2 reads_2.fastq.gz \\<br />" +
            "     -O reads.fasta \\<br />" +
            "     --INTERLEAVED_OUTPUT true" +
            "</pre>";

    private static final Log log = Log.getInstance(ConvertSequences.class);

    @Argument(shortName = StandardOptionDefinitions.INPUT_SHORT_NAME,
            doc = "Input file (optionally gzipped) for single-end data, or the first reads of paired-end data. Use - for standard input.")
    public String INPUT;

    @Argument(doc = "Input file with the second reads of paired-end data.", optional = true)
    public String INPUT2;

    @Argument(shortName = "Q", doc = "QUAL file with the quality values of a FASTA INPUT.", optional = true)
    public String QUALITY_FILE;

    @Argument(shortName = StandardOptionDefinitions.INPUT_FORMAT_SHORT_NAME,
            doc = "Input format: fasta, fastq, sra-fastq (colorspace only), sam or bam. Detected if not given.", optional = true)
    public String INPUT_FORMAT;

    @Argument(shortName = "CS", doc = "Whether the reads are in colorspace.")
    public boolean COLORSPACE = false;

    @Argument(doc = "Whether INPUT holds both reads of each pair, one after the other (a name-sorted file for SAM/BAM).")
    public boolean INTERLEAVED = false;

    @Argument(doc = "With INTERLEAVED input, read only the first (1) or second (2) read of each pair.", optional = true)
    public Integer SINGLE_INPUT_READ;

    @Argument(shortName = StandardOptionDefinitions.OUTPUT_SHORT_NAME,
            doc = "Output file for single-end data, the first reads of pairs, or both reads with INTERLEAVED_OUTPUT.")
    public File OUTPUT;

    @Argument(doc = "Output file for the second reads of pairs.", optional = true)
    public File OUTPUT2;

    @Argument(shortName = StandardOptionDefinitions.OUTPUT_FORMAT_SHORT_NAME,
            doc = "Output format: fasta or fastq. Detected from the OUTPUT file name if not given.", optional = true)
    public String OUTPUT_FORMAT;

    @Argument(doc = "Whether to write both reads of each pair to OUTPUT, one after the other.")
    public boolean INTERLEAVED_OUTPUT = false;

    @Argument(doc = "Maximum number of residues per line of FASTA output. Sequences are not wrapped if not given.", optional = true)
    public Integer LINE_LENGTH;

    @Argument(doc = "Number of reads (or pairs) formatted in memory before they are written.")
    public int BATCH_SIZE = 1000;

    @Override
    protected String[] customCommandLineValidation() {
        final List<String> errors = new ArrayList<>();
        if (INTERLEAVED && (INPUT2 != null || QUALITY_FILE != null)) {
            errors.add("INPUT2 and QUALITY_FILE cannot be used with INTERLEAVED input.");
        }
        if (INPUT2 != null && QUALITY_FILE != null) {
            errors.add("INPUT2 and QUALITY_FILE cannot be used together.");
        }
        if (SINGLE_INPUT_READ != null) {
            if (!INTERLEAVED) errors.add("SINGLE_INPUT_READ requires INTERLEAVED input.");
            if (SINGLE_INPUT_READ != 1 && SINGLE_INPUT_READ != 2) errors.add("SINGLE_INPUT_READ must be 1 or 2.");
        }
        if (OUTPUT2 != null && INTERLEAVED_OUTPUT) {
            errors.add("OUTPUT2 and INTERLEAVED_OUTPUT cannot be used together.");
        }
        final boolean pairedInput = INPUT2 != null || (INTERLEAVED && SINGLE_INPUT_READ == null);
        if (pairedInput && OUTPUT2 == null && !INTERLEAVED_OUTPUT) {
            errors.add("Paired-end input requires OUTPUT2 or INTERLEAVED_OUTPUT.");
        } else if (!pairedInput && (OUTPUT2 != null || INTERLEAVED_OUTPUT)) {
            errors.add("OUTPUT2 and INTERLEAVED_OUTPUT require paired-end input.");
        }
        if (LINE_LENGTH != null && LINE_LENGTH < 1) errors.add("LINE_LENGTH must be > 0");
        if (BATCH_SIZE < 1) errors.add("BATCH_SIZE must be > 0");
        errors.addAll(checkFormatName("INPUT_FORMAT", INPUT_FORMAT));
        errors.addAll(checkFormatName("OUTPUT_FORMAT", OUTPUT_FORMAT));
        return errors.isEmpty() ? null : errors.toArray(new String[0]);
    }

    private static List<String> checkFormatName(final String argumentName, final String value) {
        final List<String> errors = new ArrayList<>();
        if (value != null) {
            try {
                FileFormat.fromName(value);
            } catch (final UnknownFileTypeException e) {
                errors.add(argumentName + ": " + e.getMessage());
            }
        }
        return errors;
    }

    @Override
    protected int doWork() {
        final ReaderOptions options = ReaderOptions.builder(InputSource.of(INPUT))
                .input2(INPUT2 == null ? null : InputSource.of(INPUT2))
                .qualityFile(QUALITY_FILE == null ? null : InputSource.of(QUALITY_FILE))
                .format(INPUT_FORMAT)
                .colorspace(COLORSPACE)
                .interleaved(INTERLEAVED)
                .singleInputRead(SINGLE_INPUT_READ)
                .build();
        final ProgressLogger progress = new ProgressLogger(log, 1000000, "Converted", options.isPairedOutput() ? "pairs" : "reads");

        final SequenceFormatter formatter;
        if (options.isPairedOutput()) {
            try (final RecordReader<ReadPair> reader = SequenceReaderFactory.openPairedReader(options)) {
                formatter = createFormatter(reader.deliversQualities());
                try (final OutputBatch batch = new OutputBatch(formatter.getDestinations(), BATCH_SIZE)) {
                    for (final ReadPair pair : reader) {
                        formatter.format(batch.getBuffer(), pair.getRead1(), pair.getRead2());
                        batch.added();
                        progress.record(null, 0);
                    }
                }
            }
        } else {
            try (final RecordReader<Sequence> reader = SequenceReaderFactory.openSingleEndReader(options)) {
                formatter = createFormatter(reader.deliversQualities());
                try (final OutputBatch batch = new OutputBatch(formatter.getDestinations(), BATCH_SIZE)) {
                    for (final Sequence read : reader) {
                        formatter.format(batch.getBuffer(), read);
                        batch.added();
                        progress.record(null, 0);
                    }
                }
            }
        }

        final long[] bp = formatter.getWrittenBp();
        if (options.isPairedOutput()) {
            log.info("Wrote ", formatter.getWritten(), " pairs (", bp[0], " bp in first reads, ", bp[1], " bp in second reads) to ",
                    formatter.getDestinations());
        } else {
            log.info("Wrote ", formatter.getWritten(), " reads (", bp[0], " bp) to ", formatter.getDestinations());
        }
        return 0;
    }

    private SequenceFormatter createFormatter(final boolean qualities) {
        final FormatOptions formatOptions = FormatOptions.builder()
                .format(OUTPUT_FORMAT)
                .colorspace(COLORSPACE)
                .qualities(qualities)
                .lineLength(LINE_LENGTH)
                .build();
        return SequenceFormatterFactory.createSeqFormatter(
                OUTPUT.getPath(), OUTPUT2 == null ? null : OUTPUT2.getPath(), INTERLEAVED_OUTPUT, formatOptions);
    }
}
