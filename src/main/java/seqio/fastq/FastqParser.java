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
package seqio.fastq;

import htsjdk.samtools.fastq.FastqConstants;
import htsjdk.samtools.fastq.FastqRecord;
import htsjdk.samtools.util.CloserUtil;
import htsjdk.samtools.util.RuntimeIOException;
import seqio.FormatException;
import seqio.io.AbstractRecordReader;
import seqio.record.ReadNames;

import java.io.BufferedReader;
import java.io.IOException;

/**
 * A lenient four-line FASTQ tokenizer.
 * <p>
 * Only the record structure is checked here: the {@code @} and {@code +} markers and that all four lines are
 * present. Sequence and quality lines may be empty, and their lengths may differ (colorspace FASTQ carries
 * the primer base on the sequence line only); lengths are validated when the read is built.
 * </p>
 */
public class FastqParser extends AbstractRecordReader<FastqRecord> {
    private final BufferedReader reader;
    private final String source;
    private int lineNumber = 0;

    /**
     * @param reader the FASTQ text, owned by this parser from now on
     * @param source name used in error messages, may be null
     */
    public FastqParser(final BufferedReader reader, final String source) {
        this.reader = reader;
        this.source = source == null ? "<unnamed input>" : source;
    }

    @Override
    public boolean deliversQualities() {
        return true;
    }

    @Override
    protected FastqRecord readNext() {
        String header = readLine();
        // blank lines between records (and at the end of the file) are tolerated
        while (header != null && header.trim().isEmpty()) {
            header = readLine();
        }
        if (header == null) return null;
        if (!header.startsWith(FastqConstants.SEQUENCE_HEADER)) {
            throw new FormatException(error("Sequence header must start with " + FastqConstants.SEQUENCE_HEADER + ": " + ReadNames.truncate(header)));
        }
        final String sequence = requireLine("sequence line", header);
        final String qualityHeader = requireLine("quality header", header);
        if (!qualityHeader.startsWith(FastqConstants.QUALITY_HEADER)) {
            throw new FormatException(error("Quality header must start with " + FastqConstants.QUALITY_HEADER + ": " + ReadNames.truncate(qualityHeader)));
        }
        final String qualities = requireLine("quality line", header);
        return new FastqRecord(header.substring(1), sequence, qualityHeader.substring(1), qualities);
    }

    private String requireLine(final String what, final String header) {
        final String line = readLine();
        if (line == null) {
            throw new FormatException(error("Premature end of file: missing " + what + " of read " + ReadNames.truncate(header.substring(1))));
        }
        return line;
    }

    private String readLine() {
        try {
            final String line = reader.readLine();
            if (line != null) lineNumber++;
            return line;
        } catch (final IOException e) {
            throw new RuntimeIOException(error("Error reading FASTQ input"), e);
        }
    }

    private String error(final String message) {
        return message + " at line " + lineNumber + " in " + source;
    }

    @Override
    protected void doClose() {
        CloserUtil.close(reader);
    }
}
