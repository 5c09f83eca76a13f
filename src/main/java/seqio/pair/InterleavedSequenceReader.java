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
package seqio.pair;

import seqio.PairingException;
import seqio.io.AbstractRecordReader;
import seqio.io.RecordReader;
import seqio.record.ReadNames;
import seqio.record.ReadPair;
import seqio.record.Sequence;

/**
 * Reads paired-end data stored as consecutive reads of a single file.
 * <p>
 * Every two reads form a pair and must have matching names. An odd number of reads is an error, reported
 * when the unpaired last read is reached.
 * </p>
 */
public class InterleavedSequenceReader extends AbstractRecordReader<ReadPair> {
    private final RecordReader<Sequence> reader;

    public InterleavedSequenceReader(final RecordReader<Sequence> reader) {
        this.reader = reader;
    }

    @Override
    public boolean deliversQualities() {
        return reader.deliversQualities();
    }

    @Override
    protected ReadPair readNext() {
        if (!reader.hasNext()) return null;
        final Sequence read1 = reader.next();
        if (!reader.hasNext()) {
            throw new PairingException(String.format(
                    "Interleaved input file incomplete: Last record '%s' has no partner.", ReadNames.truncate(read1.getName())));
        }
        final Sequence read2 = reader.next();
        if (!ReadNames.namesMatch(read1, read2)) {
            throw new PairingException(String.format(
                    "Reads are improperly paired. Name '%s' (first) does not match '%s' (second).",
                    ReadNames.truncate(read1.getName()), ReadNames.truncate(read2.getName())));
        }
        return new ReadPair(read1, read2);
    }

    @Override
    protected void doClose() {
        reader.close();
    }
}
