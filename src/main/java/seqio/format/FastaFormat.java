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

import seqio.record.Sequence;

/**
 * FASTA output, optionally with the sequence wrapped to a maximum line length.
 */
public class FastaFormat implements SequenceFormat {
    private final int lineLength;

    /** Writes every sequence on a single line. */
    public FastaFormat() {
        this(null);
    }

    /**
     * @param lineLength maximum number of residues per line, or null (or a value below 1) to not wrap
     */
    public FastaFormat(final Integer lineLength) {
        this.lineLength = (lineLength == null || lineLength < 1) ? 0 : lineLength;
    }

    public int getLineLength() {
        return lineLength;
    }

    @Override
    public String format(final Sequence read) {
        return formatEntry(read.getName(), read.getSequence());
    }

    protected String formatEntry(final String name, final String sequence) {
        final StringBuilder builder = new StringBuilder(name.length() + sequence.length() + 3);
        builder.append('>').append(name).append('\n');
        if (lineLength == 0 || sequence.length() <= lineLength) {
            builder.append(sequence);
        } else {
            for (int start = 0; start < sequence.length(); start += lineLength) {
                if (start > 0) builder.append('\n');
                builder.append(sequence, start, Math.min(start + lineLength, sequence.length()));
            }
        }
        return builder.append('\n').toString();
    }
}
