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
package seqio.fasta;

import htsjdk.samtools.util.CloserUtil;
import htsjdk.samtools.util.RuntimeIOException;
import seqio.FormatException;
import seqio.io.AbstractRecordReader;
import seqio.record.ReadNames;
import seqio.record.Sequence;
import seqio.record.SequenceType;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads FASTA entries one at a time.
 * <p>
 * Sequence lines are concatenated up to the next header. Blank lines and lines starting with '#' (as found in
 * csfasta files) are skipped. Lines are stripped of surrounding whitespace, which also removes DOS line
 * breaks. The reads have no qualities.
 * </p>
 */
public class FastaReader extends AbstractRecordReader<Sequence> {
    private final BufferedReader reader;
    private final SequenceType sequenceType;
    private final String delimiter;

    private final List<String> lines = new ArrayList<>();
    private String currentName = null;
    private int lineNumber = 0;
    private boolean endOfInput = false;

    public FastaReader(final BufferedReader reader) {
        this(reader, SequenceType.BASE_SPACE, false);
    }

    /**
     * @param reader the FASTA text, owned by this reader from now on
     * @param sequenceType how to build reads; colorspace types split the primer off every entry
     * @param keepLinebreaks join the lines of an entry with newlines instead of concatenating them
     */
    public FastaReader(final BufferedReader reader, final SequenceType sequenceType, final boolean keepLinebreaks) {
        this.reader = reader;
        this.sequenceType = sequenceType;
        this.delimiter = keepLinebreaks ? "\n" : "";
    }

    @Override
    public boolean deliversQualities() {
        return false;
    }

    @Override
    protected Sequence readNext() {
        if (endOfInput) return null;
        String line;
        while ((line = readLine()) != null) {
            lineNumber++;
            line = line.trim();
            if (line.isEmpty()) continue;

            if (line.charAt(0) == '>') {
                final Sequence previous = currentName == null ? null : buildCurrent();
                currentName = line.substring(1);
                lines.clear();
                if (previous != null) return previous;
            } else if (line.charAt(0) == '#') {
                continue;
            } else if (currentName != null) {
                lines.add(line);
            } else {
                throw new FormatException(String.format(
                        "At line %d: Expected '>' at beginning of FASTA record, but got '%s'.",
                        lineNumber, ReadNames.truncate(line)));
            }
        }

        endOfInput = true;
        if (currentName == null) return null;
        final Sequence last = buildCurrent();
        currentName = null;
        lines.clear();
        return last;
    }

    private Sequence buildCurrent() {
        return sequenceType.create(currentName, String.join(delimiter, lines), null);
    }

    private String readLine() {
        try {
            return reader.readLine();
        } catch (final IOException e) {
            throw new RuntimeIOException("Error reading FASTA input at line " + (lineNumber + 1), e);
        }
    }

    @Override
    protected void doClose() {
        CloserUtil.close(reader);
    }
}
