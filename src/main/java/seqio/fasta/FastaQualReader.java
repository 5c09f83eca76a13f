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

import seqio.FormatException;
import seqio.io.AbstractRecordReader;
import seqio.io.QualityValueTable;
import seqio.record.ReadNames;
import seqio.record.Sequence;
import seqio.record.SequenceType;

import java.io.BufferedReader;

/**
 * Reads sequences from a (cs)FASTA file together with their qualities from a QUAL file.
 * <p>
 * The QUAL file is FASTA-shaped, with whitespace separated decimal quality values instead of residues. Both
 * files are read in lock-step and the names of corresponding entries must be identical.
 * </p>
 */
public class FastaQualReader extends AbstractRecordReader<Sequence> {
    private final FastaReader fastaReader;
    private final FastaReader qualReader;
    private final SequenceType sequenceType;
    private final QualityValueTable qualityTable = QualityValueTable.getInstance();

    public FastaQualReader(final BufferedReader fasta, final BufferedReader qual, final SequenceType sequenceType) {
        this.fastaReader = new FastaReader(fasta, SequenceType.BASE_SPACE, false);
        this.qualReader = new FastaReader(qual, SequenceType.BASE_SPACE, true);
        this.sequenceType = sequenceType;
    }

    @Override
    public boolean deliversQualities() {
        return true;
    }

    @Override
    protected Sequence readNext() {
        final boolean hasRead = fastaReader.hasNext();
        final boolean hasQual = qualReader.hasNext();
        if (!hasRead && !hasQual) return null;
        if (hasRead != hasQual) {
            throw new FormatException(String.format("The FASTA and QUAL files do not contain the same number of reads: " +
                    "there are more reads in the %s file.", hasRead ? "FASTA" : "QUAL"));
        }

        final Sequence read = fastaReader.next();
        final Sequence qual = qualReader.next();
        if (!read.getName().equals(qual.getName())) {
            throw new FormatException(String.format("The read names in the FASTA and QUAL file do not match ('%s' != '%s')",
                    ReadNames.truncate(read.getName()), ReadNames.truncate(qual.getName())));
        }
        return sequenceType.create(read.getName(), read.getSequence(), decodeQualities(read.getName(), qual.getSequence()));
    }

    private String decodeQualities(final String readName, final String values) {
        final String trimmed = values.trim();
        if (trimmed.isEmpty()) return "";
        final String[] tokens = trimmed.split("\\s+");
        final StringBuilder qualities = new StringBuilder(tokens.length);
        for (final String token : tokens) {
            final Character c = qualityTable.decode(token);
            if (c == null) {
                throw new FormatException(String.format("Within read named '%s': Found invalid quality value '%s'",
                        ReadNames.truncate(readName), ReadNames.truncate(token)));
            }
            qualities.append(c.charValue());
        }
        return qualities.toString();
    }

    @Override
    protected void doClose() {
        try {
            fastaReader.close();
        } finally {
            qualReader.close();
        }
    }
}
