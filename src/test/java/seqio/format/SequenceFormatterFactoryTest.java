package seqio.format;

import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;
import seqio.ConfigurationException;
import seqio.UnknownFileTypeException;
import seqio.io.FileFormat;

public class SequenceFormatterFactoryTest {

    private static FormatOptions qualities(final Boolean qualities) {
        return FormatOptions.builder().qualities(qualities).build();
    }

    @DataProvider(name = "formats")
    public Object[][] formats() {
        return new Object[][] {
                {"out.fasta", FormatOptions.builder().build(), FastaFormat.class},
                {"out.fastq.gz", FormatOptions.builder().build(), FastqFormat.class},
                {"out.fa", FormatOptions.builder().colorspace(true).build(), ColorspaceFastaFormat.class},
                {"out.fq", FormatOptions.builder().colorspace(true).build(), ColorspaceFastqFormat.class},
                {"out.txt", qualities(true), FastqFormat.class},
                {"out.txt", qualities(false), FastaFormat.class},
                {"out", qualities(false), FastaFormat.class},
                {"out.fasta", qualities(true), FastaFormat.class},
                {"out.txt", FormatOptions.builder().format(FileFormat.FASTQ).build(), FastqFormat.class},
                {"out.fastq", FormatOptions.builder().format("fasta").build(), FastaFormat.class},
        };
    }

    @Test(dataProvider = "formats")
    public void testGetFormat(final String path, final FormatOptions options, final Class<?> expected) {
        Assert.assertEquals(SequenceFormatterFactory.getFormat(path, options).getClass(), expected);
    }

    @Test
    public void testLineLength() {
        final SequenceFormat format = SequenceFormatterFactory.getFormat("out.fasta", FormatOptions.builder().lineLength(60).build());
        Assert.assertEquals(((FastaFormat) format).getLineLength(), 60);
    }

    @Test(expectedExceptions = UnknownFileTypeException.class, expectedExceptionsMessageRegExp = "Could not determine whether file 'out.txt'.*")
    public void testUnknownExtension() {
        SequenceFormatterFactory.getFormat("out.txt", FormatOptions.builder().build());
    }

    @Test(expectedExceptions = ConfigurationException.class,
            expectedExceptionsMessageRegExp = "Output format cannot be FASTQ since no quality values are available\\.")
    public void testFastqWithoutQualities() {
        SequenceFormatterFactory.getFormat("out.fastq", qualities(false));
    }

    @Test(expectedExceptions = UnknownFileTypeException.class, expectedExceptionsMessageRegExp = "File format 'sam' is unknown \\(expected 'fasta' or 'fastq'\\)\\.")
    public void testAlignmentOutput() {
        SequenceFormatterFactory.getFormat("out.sam", qualities(true));
    }

    @Test
    public void testCreateSeqFormatter() {
        final FormatOptions options = FormatOptions.builder().build();
        Assert.assertTrue(SequenceFormatterFactory.createSeqFormatter("out.fasta", options) instanceof SingleEndFormatter);
        Assert.assertTrue(SequenceFormatterFactory.createSeqFormatter("out.fasta", "out2.fasta", false, options) instanceof PairedEndFormatter);
        Assert.assertTrue(SequenceFormatterFactory.createSeqFormatter("out.fasta", null, true, options) instanceof InterleavedFormatter);
    }

    @Test(expectedExceptions = ConfigurationException.class)
    public void testPairedAndInterleavedOutput() {
        SequenceFormatterFactory.createSeqFormatter("out.fasta", "out2.fasta", true, FormatOptions.builder().build());
    }
}
