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

import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import seqio.SeqIOException;
import seqio.tools.ConvertSequences;

import java.lang.reflect.InvocationTargetException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Entry point of the seqio jar: {@code seqio <program> [arguments]}.
 */
public class SeqIOCommandLine {
    static final String COMMAND_LINE_NAME = "seqio";

    private static final List<Class<? extends CommandLineProgram>> PROGRAMS =
            Collections.singletonList(ConvertSequences.class);

    private final Map<String, Class<? extends CommandLineProgram>> programsByName = new TreeMap<>();

    public SeqIOCommandLine() {
        for (final Class<? extends CommandLineProgram> program : PROGRAMS) {
            programsByName.put(program.getSimpleName(), program);
        }
    }

    public static void main(final String[] args) {
        System.exit(new SeqIOCommandLine().instanceMain(args));
    }

    /**
     * Runs the program named by the first argument with the remaining arguments.
     * @return the exit status of the program, or 1 if no known program was named
     */
    public int instanceMain(final String[] args) {
        if (args.length == 0 || args[0].equals("-h") || args[0].equals("--help")) {
            System.err.print(usage());
            return 1;
        }
        final Class<? extends CommandLineProgram> program = programsByName.get(args[0]);
        if (program == null) {
            System.err.print(usage());
            System.err.println(String.format("'%s' is not a %s program.", args[0], COMMAND_LINE_NAME));
            return 1;
        }
        return newInstance(program).instanceMain(Arrays.copyOfRange(args, 1, args.length));
    }

    String usage() {
        final StringBuilder builder = new StringBuilder("USAGE: ").append(COMMAND_LINE_NAME).append(" <program> [-h]\n\nPrograms:\n");
        for (final Map.Entry<String, Class<? extends CommandLineProgram>> entry : programsByName.entrySet()) {
            final CommandLineProgramProperties properties = entry.getValue().getAnnotation(CommandLineProgramProperties.class);
            builder.append(String.format("    %-30s%s\n", entry.getKey(), properties.oneLineSummary()));
        }
        return builder.toString();
    }

    private static CommandLineProgram newInstance(final Class<? extends CommandLineProgram> program) {
        try {
            return program.getDeclaredConstructor().newInstance();
        } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
            throw new SeqIOException("Could not create " + program.getSimpleName(), e);
        }
    }
}
