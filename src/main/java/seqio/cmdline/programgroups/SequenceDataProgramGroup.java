package seqio.cmdline.programgroups;

import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;

/**
 * Tools that read or write sequence records in FASTA, FASTQ, FASTA/QUAL or SAM/BAM format
 */
public class SequenceDataProgramGroup implements CommandLineProgramGroup {
    public static final String NAME = "Sequence File Tools";
    public static final String DESCRIPTION = "Tools for converting and extracting reads in FASTA, FASTQ, FASTA/QUAL and SAM/BAM format";

    @Override
    public String getName() { return NAME; }

    @Override
    public String getDescription() { return DESCRIPTION; }
}
