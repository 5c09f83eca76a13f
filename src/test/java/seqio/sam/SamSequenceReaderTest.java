package seqio.sam;

import htsjdk.samtools.SAMRecord;
import htsjdk.samtools.SAMRecordSetBuilder;
import htsjdk.samtools.SamReader;
import htsjdk.samtools.SamReaderFactory;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;
import seqio.PairingException;
import seqio.record.ReadPair;
import seqio.record.Sequence;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class SamSequenceReaderTest {
    private static final File TEST_DATA_DIR = new File("testdata/seqio/io");

    private static SamReader open(final String name) {
        return SamReaderFactory.makeDefault().open(new File(TEST_DATA_DIR, name));
    }

    private static List<Sequence> readSequences(final String name, final SamReadSelection selection) {
        final SamReader samReader = open(name);
        final List<Sequence> reads = new ArrayList<>();
        try (final SamSequenceReader reader = new SamSequenceReader(samReader.iterator(), samReader, selection)) {
            Assert.assertEquals(reader.getSelection(), selection);
            reader.forEachRemaining(reads::add);
        }
        return reads;
    }

    private static List<ReadPair> readPairs(final String name) {
        final SamReader samReader = open(name);
        final List<ReadPair> pairs = new ArrayList<>();
        try (final PairedEndSamReader reader = new PairedEndSamReader(samReader.iterator(), samReader)) {
            reader.forEachRemaining(pairs::add);
        }
        return pairs;
    }

    @Test
    public void testAllRecords() {
        final List<Sequence> reads = readSequences("paired.sam", SamReadSelection.ALL);
        Assert.assertEquals(reads.size(), 5);
        Assert.assertEquals(reads.get(0), new Sequence("pair1", "ACGT", "IIII"));
        Assert.assertEquals(reads.get(2), new Sequence("pair2", "CCAA", "####"));
    }

    @Test
    public void testRecordWithoutQualities() {
        final Sequence single = readSequences("paired.sam", SamReadSelection.ALL).get(4);
        Assert.assertEquals(single.getName(), "single");
        Assert.assertEquals(single.getSequence(), "AAAA");
        Assert.assertNull(single.getQualities());
    }

    @DataProvider(name = "selections")
    public Object[][] selections() {
        return new Object[][] {
                {SamReadSelection.FIRST_OF_PAIR, "ACGT", "GGCC"},
                {SamReadSelection.SECOND_OF_PAIR, "TTTT", "CCAA"},
        };
    }

    @Test(dataProvider = "selections")
    public void testMateSelection(final SamReadSelection selection, final String first, final String second) {
        final List<Sequence> reads = readSequences("paired.sam", selection);
        Assert.assertEquals(reads.size(), 2);
        Assert.assertEquals(reads.get(0).getSequence(), first);
        Assert.assertEquals(reads.get(1).getSequence(), second);
    }

    @Test
    public void testForMate() {
        Assert.assertEquals(SamReadSelection.forMate(null), SamReadSelection.ALL);
        Assert.assertEquals(SamReadSelection.forMate(1), SamReadSelection.FIRST_OF_PAIR);
        Assert.assertEquals(SamReadSelection.forMate(2), SamReadSelection.SECOND_OF_PAIR);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testForInvalidMate() {
        SamReadSelection.forMate(0);
    }

    @Test
    public void testPairsAreOrderedByFlag() {
        final SamReader samReader = open("paired.sam");
        try (final PairedEndSamReader reader = new PairedEndSamReader(samReader.iterator(), samReader)) {
            final ReadPair first = reader.next();
            Assert.assertEquals(first.getRead1().getSequence(), "ACGT");
            Assert.assertEquals(first.getRead2().getSequence(), "TTTT");

            // the second pair is stored second-of-pair first
            final ReadPair second = reader.next();
            Assert.assertEquals(second.getRead1().getSequence(), "GGCC");
            Assert.assertEquals(second.getRead2().getSequence(), "CCAA");
            Assert.assertTrue(reader.deliversQualities());
        }
    }

    @Test(expectedExceptions = PairingException.class, expectedExceptionsMessageRegExp = "Read 'pair2' is the last record.*")
    public void testDanglingRecord() {
        readPairs("paired_dangling.sam");
    }

    @Test(expectedExceptions = PairingException.class,
            expectedExceptionsMessageRegExp = "Consecutive reads 'pair1', 'pair2' in paired-end SAM/BAM file do not have the same name.*")
    public void testNameMismatch() {
        readPairs("paired_mismatch.sam");
    }

    @Test(expectedExceptions = PairingException.class, expectedExceptionsMessageRegExp = ".*not flagged as first and second of pair\\.")
    public void testUnpairedFlags() {
        final SAMRecordSetBuilder builder = new SAMRecordSetBuilder();
        builder.addUnmappedFragment("frag");
        builder.addUnmappedFragment("frag");
        final List<SAMRecord> records = new ArrayList<>();
        builder.iterator().forEachRemaining(records::add);
        try (final PairedEndSamReader reader = new PairedEndSamReader(records.iterator(), null)) {
            reader.next();
        }
    }

    @Test
    public void testEmptyStream() {
        try (final SamSequenceReader reader = new SamSequenceReader(Collections.<SAMRecord>emptyIterator(), null, SamReadSelection.ALL)) {
            Assert.assertFalse(reader.hasNext());
        }
    }
}
