package seqio.pair;

import org.testng.Assert;
import org.testng.annotations.Test;
import seqio.fasta.FastaReader;
import seqio.record.Sequence;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class SingleMateReaderTest {
    private static final String INTERLEAVED = ">r1/1\nAC\n>r1/2\nTT\n>r2/1\nGG\n>r2/2\nCC\n";

    private static List<String> sequences(final int mate) {
        final List<String> sequences = new ArrayList<>();
        try (final SingleMateReader reader = new SingleMateReader(
                new InterleavedSequenceReader(PairedSequenceReaderTest.fasta(INTERLEAVED)), mate)) {
            Assert.assertEquals(reader.getMate(), mate);
            for (final Sequence read : reader) {
                sequences.add(read.getSequence());
            }
        }
        return sequences;
    }

    @Test
    public void testFirstMate() {
        Assert.assertEquals(sequences(1), Arrays.asList("AC", "GG"));
    }

    @Test
    public void testSecondMate() {
        Assert.assertEquals(sequences(2), Arrays.asList("TT", "CC"));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testInvalidMate() {
        new SingleMateReader(new InterleavedSequenceReader(PairedSequenceReaderTest.fasta("")), 3);
    }

    @Test
    public void testCloseReachesUnderlyingReader() {
        final FastaReader fasta = PairedSequenceReaderTest.fasta(INTERLEAVED);
        final SingleMateReader reader = new SingleMateReader(new InterleavedSequenceReader(fasta), 1);
        reader.close();
        Assert.assertTrue(fasta.isClosed());
    }
}
