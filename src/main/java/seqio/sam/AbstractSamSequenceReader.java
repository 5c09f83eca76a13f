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
package seqio.sam;

import htsjdk.samtools.SAMRecord;
import htsjdk.samtools.SAMUtils;
import htsjdk.samtools.util.CloserUtil;
import htsjdk.samtools.util.StringUtil;
import seqio.io.AbstractRecordReader;
import seqio.record.Sequence;

import java.io.Closeable;
import java.util.Iterator;

/**
 * Common base of the readers that take their reads from decoded SAM/BAM records.
 * <p>
 * Decoding is done elsewhere, normally by an htsjdk {@link htsjdk.samtools.SamReader}; this class only sees an
 * iterator of records. Secondary and supplementary alignments are not expected in the input.
 * </p>
 */
public abstract class AbstractSamSequenceReader<T> extends AbstractRecordReader<T> {
    protected final Iterator<SAMRecord> records;
    private final Closeable source;

    /**
     * @param records the decoded records
     * @param source closed together with this reader, e.g. the {@link htsjdk.samtools.SamReader}
     */
    protected AbstractSamSequenceReader(final Iterator<SAMRecord> records, final Closeable source) {
        this.records = records;
        this.source = source;
    }

    @Override
    public boolean deliversQualities() {
        return true;
    }

    /** Converts a record to a read; qualities are encoded as phred + 33, or null if the record has none. */
    protected Sequence toSequence(final SAMRecord record) {
        final byte[] bases = record.getReadBases();
        final byte[] quals = record.getBaseQualities();
        final String qualities = (quals.length == 0 && bases.length > 0) ? null : SAMUtils.phredToFastq(quals);
        return new Sequence(record.getReadName(), StringUtil.bytesToString(bases), qualities);
    }

    static boolean isFirstOfPair(final SAMRecord record) {
        return record.getReadPairedFlag() && record.getFirstOfPairFlag();
    }

    static boolean isSecondOfPair(final SAMRecord record) {
        return record.getReadPairedFlag() && record.getSecondOfPairFlag();
    }

    @Override
    protected void doClose() {
        if (records instanceof Closeable) {
            CloserUtil.close(records);
        }
        CloserUtil.close(source);
    }
}
