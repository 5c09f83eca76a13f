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
import seqio.PairingException;
import seqio.record.ReadNames;
import seqio.record.ReadPair;

import java.io.Closeable;
import java.util.Iterator;

/**
 * Reads pairs from a name-sorted SAM/BAM file.
 * <p>
 * Each two consecutive records must share a read name and be flagged first and second of pair, in either
 * order; the first-of-pair read is always returned as read 1.
 * </p>
 */
public class PairedEndSamReader extends AbstractSamSequenceReader<ReadPair> {

    public PairedEndSamReader(final Iterator<SAMRecord> records, final Closeable source) {
        super(records, source);
    }

    @Override
    protected ReadPair readNext() {
        if (!records.hasNext()) return null;
        final SAMRecord first = records.next();
        if (!records.hasNext()) {
            throw new PairingException(String.format(
                    "Read '%s' is the last record in paired-end SAM/BAM file and has no partner; make sure your file is " +
                            "name-sorted and does not contain any secondary/supplementary alignments.",
                    ReadNames.truncate(first.getReadName())));
        }
        final SAMRecord second = records.next();
        if (!first.getReadName().equals(second.getReadName())) {
            throw new PairingException(String.format(
                    "Consecutive reads '%s', '%s' in paired-end SAM/BAM file do not have the same name; make sure your file " +
                            "is name-sorted and does not contain any secondary/supplementary alignments.",
                    ReadNames.truncate(first.getReadName()), ReadNames.truncate(second.getReadName())));
        }

        if (isFirstOfPair(first) && isSecondOfPair(second)) {
            return new ReadPair(toSequence(first), toSequence(second));
        } else if (isFirstOfPair(second) && isSecondOfPair(first)) {
            return new ReadPair(toSequence(second), toSequence(first));
        }
        throw new PairingException(String.format(
                "Consecutive reads named '%s' in paired-end SAM/BAM file are not flagged as first and second of pair.",
                ReadNames.truncate(first.getReadName())));
    }
}
