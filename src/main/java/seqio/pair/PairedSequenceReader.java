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
 * Reads paired-end data from two files, one per mate, and checks that the two stay in step.
 * <p>
 * Both files must contain the same number of reads, and the names of the reads in each pair must match
 * (see {@link ReadNames#namesMatch(String, String)}). Exactly one read is pulled from each file per pair.
 * </p>
 */
public class PairedSequenceReader extends AbstractRecordReader<ReadPair> {
    private final RecordReader<Sequence> reader1;
    private final RecordReader<Sequence> reader2;

    public PairedSequenceReader(final RecordReader<Sequence> reader1, final RecordReader<Sequence> reader2) {
        this.reader1 = reader1;
        this.reader2 = reader2;
    }

    @Override
    public boolean deliversQualities() {
        return reader1.deliversQualities();
    }

    @Override
    protected ReadPair readNext() {
        if (!reader1.hasNext()) {
            if (reader2.hasNext()) {
                throw new PairingException("Reads are improperly paired. There are more reads in file 2 than in file 1.");
            }
            return null;
        }
        final Sequence read1 = reader1.next();
        if (!reader2.hasNext()) {
            throw new PairingException("Reads are improperly paired. There are more reads in file 1 than in file 2.");
        }
        final Sequence read2 = reader2.next();
        if (!ReadNames.namesMatch(read1, read2)) {
            throw new PairingException(String.format(
                    "Reads are improperly paired. Read name '%s' in file 1 does not match '%s' in file 2.",
                    ReadNames.truncate(read1.getName()), ReadNames.truncate(read2.getName())));
        }
        return new ReadPair(read1, read2);
    }

    @Override
    protected void doClose() {
        try {
            reader1.close();
        } finally {
            reader2.close();
        }
    }
}
