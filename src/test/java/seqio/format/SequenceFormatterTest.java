package seqio.format;

import org.testng.Assert;
import org.testng.annotations.Test;
import seqio.record.Sequence;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class SequenceFormatterTest {
    private final Sequence read1 = new Sequence("r/1", "ACGT");
    private final Sequence read2 = new Sequence("r/2", "GG");

    @Test
    public void testSingleEnd() {
        final SingleEndFormatter formatter = new SingleEndFormatter(new FastaFormat(), "out.fasta");
        final Map<String, List<String>> result = new HashMap<>();
        formatter.format(result, read1);
        formatter.format(result, read2);
        Assert.assertEquals(result.get("out.fasta"), Arrays.asList(">r/1\nACGT\n", ">r/2\nGG\n"));
        Assert.assertEquals(formatter.getWritten(), 2);
        Assert.assertEquals(formatter.getWrittenBp(), new long[]{6, 0});
        Assert.assertEquals(formatter.getDestinations(), Collections.singletonList("out.fasta"));
    }

    @Test
    public void testPairedEnd() {
        final PairedEndFormatter formatter = new PairedEndFormatter(new FastaFormat(), "out.1.fasta", "out.2.fasta");
        final Map<String, List<String>> result = new HashMap<>();
        formatter.format(result, read1, read2);
        Assert.assertEquals(result.get("out.1.fasta"), Collections.singletonList(">r/1\nACGT\n"));
        Assert.assertEquals(result.get("out.2.fasta"), Collections.singletonList(">r/2\nGG\n"));
        Assert.assertEquals(formatter.getWritten(), 1);
        Assert.assertEquals(formatter.getRead1Bp(), 4);
        Assert.assertEquals(formatter.getRead2Bp(), 2);
        Assert.assertEquals(formatter.getDestinations(), Arrays.asList("out.1.fasta", "out.2.fasta"));
    }

    @Test
    public void testInterleaved() {
        final InterleavedFormatter formatter = new InterleavedFormatter(new FastaFormat(), "out.fasta");
        final Map<String, List<String>> result = new HashMap<>();
        formatter.format(result, read1, read2);
        Assert.assertEquals(result.get("out.fasta"), Arrays.asList(">r/1\nACGT\n", ">r/2\nGG\n"));
        Assert.assertEquals(formatter.getWritten(), 1);
        Assert.assertEquals(formatter.getWrittenBp(), new long[]{4, 2});
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testPairedEndRequiresTwoReads() {
        new PairedEndFormatter(new FastaFormat(), "a.fasta", "b.fasta").format(new HashMap<>(), read1);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testInterleavedRequiresTwoReads() {
        new InterleavedFormatter(new FastaFormat(), "a.fasta").format(new HashMap<>(), read1);
    }
}
