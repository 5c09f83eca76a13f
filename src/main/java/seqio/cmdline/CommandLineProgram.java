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
package seqio.cmdline;

import htsjdk.samtools.SamReaderFactory;
import htsjdk.samtools.ValidationStringency;
import htsjdk.samtools.util.Log;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.ArgumentCollection;
import org.broadinstitute.barclay.argparser.CommandLineArgumentParser;
import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.barclay.argparser.SpecialArgumentsCollection;

/**
 * Base class of the seqio tools.
 *
 * Subclasses are annotated with @CommandLineProgramProperties, declare their arguments as @Argument fields,
 * check combinations of arguments in {@link #customCommandLineValidation()} and do their work in {@link #doWork()}.
 * Exceptions thrown by doWork() are not caught.
 */
public abstract class CommandLineProgram {
    private final Log log = Log.getInstance(getClass());

    @Argument(doc = "Logging verbosity.", common = true)
    public Log.LogLevel VERBOSITY = Log.LogLevel.INFO;

    @Argument(doc = "Whether to skip logging the command line and the run time.", common = true)
    public boolean QUIET = false;

    @Argument(doc = "Validation stringency applied to SAM/BAM input. SILENT skips the checks of fields that are not converted.",
            common = true)
    public ValidationStringency VALIDATION_STRINGENCY = ValidationStringency.DEFAULT_STRINGENCY;

    @ArgumentCollection(doc = "Arguments understood by the parser itself, such as --help and --version.")
    public SpecialArgumentsCollection specialArguments = new SpecialArgumentsCollection();

    /**
     * Runs the program once the arguments are parsed and validated.
     * @return the exit status
     */
    protected abstract int doWork();

    /**
     * @return null if the parsed arguments are consistent, otherwise the messages describing what is wrong
     */
    protected String[] customCommandLineValidation() {
        return null;
    }

    /**
     * Parses the arguments and runs the program.
     * @return the exit status of {@link #doWork()}, or 1 if the arguments are invalid or only help was requested
     */
    public int instanceMain(final String[] argv) {
        final CommandLineArgumentParser parser = new CommandLineArgumentParser(this);
        try {
            if (!parser.parseArguments(System.err, argv)) {
                return 1;
            }
        } catch (final CommandLineException e) {
            System.err.print(parser.usage(false, false));
            System.err.println(e.getMessage());
            return 1;
        }
        final String[] errors = customCommandLineValidation();
        if (errors != null) {
            System.err.print(parser.usage(false, false));
            for (final String error : errors) {
                System.err.println(error);
            }
            return 1;
        }

        Log.setGlobalLogLevel(VERBOSITY);
        SamReaderFactory.setDefaultValidationStringency(VALIDATION_STRINGENCY);
        if (!QUIET) {
            log.info(parser.getCommandLine());
        }
        final long startMillis = System.currentTimeMillis();
        try {
            return doWork();
        } finally {
            if (!QUIET) {
                log.info(getClass().getSimpleName(), " done in ",
                        String.format("%.2f", (System.currentTimeMillis() - startMillis) / 1000d), " s");
            }
        }
    }
}
