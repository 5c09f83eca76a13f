package seqio.cmdline;

/**
 * Short names shared by the arguments of several command line programs.
 */
public class StandardOptionDefinitions {
    public static final String INPUT_SHORT_NAME = "I";
    public static final String OUTPUT_SHORT_NAME = "O";
    public static final String INPUT_FORMAT_SHORT_NAME = "IF";
    public static final String OUTPUT_FORMAT_SHORT_NAME = "OF";
}
