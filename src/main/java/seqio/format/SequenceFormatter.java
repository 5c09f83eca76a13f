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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Formats reads (single or paired) for one or two output destinations and keeps count of what was written.
 * <p>
 * Formatted entries are appended to a caller supplied buffer that maps each destination to the entries
 * destined for it, so that a caller can collect a batch of reads and write each file in one go.
 * </p>
 */
public abstract class SequenceFormatter {
    protected final SequenceFormat sequenceFormat;
    protected final String file1;

    protected long written = 0;
    protected long read1Bp = 0;
    protected long read2Bp = 0;

    protected SequenceFormatter(final SequenceFormat sequenceFormat, final String file1) {
        this.sequenceFormat = sequenceFormat;
        this.file1 = file1;
    }

    /**
     * Formats a read, or a pair of reads, into the buffer.
     *
     * @param result maps destinations to formatted entries; missing destinations are added
     * @param read1 the read, or the first read of a pair
     * @param read2 the second read of a pair, or null for single-end data
     */
    public abstract void format(final Map<String, List<String>> result, final Sequence read1, final Sequence read2);

    public void format(final Map<String, List<String>> result, final Sequence read) {
        format(result, read, null);
    }

    protected static List<String> entries(final Map<String, List<String>> result, final String destination) {
        return result.computeIfAbsent(destination, d -> new ArrayList<>());
    }

    public SequenceFormat getSequenceFormat() { return sequenceFormat; }

    /** @return the destinations this formatter writes to */
    public abstract List<String> getDestinations();

    /** Number of reads (single-end) or pairs (paired-end) formatted so far. */
    public long getWritten() { return written; }

    public long getRead1Bp() { return read1Bp; }

    public long getRead2Bp() { return read2Bp; }

    /** @return {read 1 bases, read 2 bases} written so far */
    public long[] getWrittenBp() {
        return new long[]{read1Bp, read2Bp};
    }
}
