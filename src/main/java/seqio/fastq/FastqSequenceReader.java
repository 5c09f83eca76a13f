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

import com.google.common.base.Strings;
import htsjdk.samtools.fastq.FastqRecord;
import htsjdk.samtools.util.CloserUtil;
import seqio.io.AbstractRecordReader;
import seqio.record.Sequence;
import seqio.record.SequenceType;

import java.io.Closeable;
import java.util.Iterator;

/**
 * Turns tokenized FASTQ records into {@link Sequence}s.
 * <p>
 * Tokenizing is left to the supplied iterator, normally a {@link FastqParser}. The {@link SequenceType}
 * decides whether the primer is split off and whether the first quality value is dropped.
 * </p>
 */
public class FastqSequenceReader extends AbstractRecordReader<Sequence> {
    private final Iterator<FastqRecord> records;
    private final Closeable source;
    private final SequenceType sequenceType;

    /**
     * @param records the tokenized records
     * @param source closed together with this reader; usually the tokenizer itself
     * @param sequenceType how to build reads from the record fields
     */
    public FastqSequenceReader(final Iterator<FastqRecord> records, final Closeable source, final SequenceType sequenceType) {
        this.records = records;
        this.source = source;
        this.sequenceType = sequenceType;
    }

    public SequenceType getSequenceType() {
        return sequenceType;
    }

    @Override
    public boolean deliversQualities() {
        return true;
    }

    @Override
    protected Sequence readNext() {
        if (!records.hasNext()) return null;
        final FastqRecord record = records.next();
        // FastqRecord stores empty fields as null
        return sequenceType.create(Strings.nullToEmpty(record.getReadName()), Strings.nullToEmpty(record.getReadString()),
                Strings.nullToEmpty(record.getBaseQualityString()), Strings.nullToEmpty(record.getBaseQualityHeader()));
    }

    @Override
    protected void doClose() {
        CloserUtil.close(source);
    }
}
