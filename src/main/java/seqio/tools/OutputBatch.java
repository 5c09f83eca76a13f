package seqio.tools;

import htsjdk.samtools.util.IOUtil;
import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.RuntimeIOException;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Collects formatted entries per destination and appends them to the output files every {@code batchSize} records.
 * All writers are closed when the batch is closed, and the ones already opened are closed if opening a later
 * one fails.
 */
class OutputBatch implements Closeable {
    private static final Log log = Log.getInstance(OutputBatch.class);

    private final Map<String, List<String>> buffer = new LinkedHashMap<>();
    private final Map<String, BufferedWriter> writers = new LinkedHashMap<>();
    private final int batchSize;
    private int pending = 0;

    OutputBatch(final List<String> destinations, final int batchSize) {
        this(destinations, batchSize, OutputBatch::openWriter);
    }

    OutputBatch(final List<String> destinations, final int batchSize, final Function<String, BufferedWriter> opener) {
        this.batchSize = batchSize;
        try {
            for (final String destination : destinations) {
                writers.put(destination, opener.apply(destination));
            }
        } catch (final RuntimeException e) {
            final RuntimeIOException closeFailure = closeWriters();
            if (closeFailure != null) e.addSuppressed(closeFailure);
            throw e;
        }
    }

    private static BufferedWriter openWriter(final String destination) {
        final File file = new File(destination);
        IOUtil.assertFileIsWritable(file);
        return IOUtil.openFileForBufferedWriting(file);
    }

    Map<String, List<String>> getBuffer() {
        return buffer;
    }

    void added() {
        if (++pending >= batchSize) {
            flush();
        }
    }

    private void flush() {
        for (final Map.Entry<String, List<String>> entry : buffer.entrySet()) {
            final BufferedWriter writer = writers.get(entry.getKey());
            try {
                for (final String formatted : entry.getValue()) {
                    writer.write(formatted);
                }
            } catch (final IOException e) {
                throw new RuntimeIOException("Error writing to " + entry.getKey(), e);
            }
        }
        log.debug("Wrote batch of ", pending, " records");
        buffer.clear();
        pending = 0;
    }

    /** Closes every writer, returning the first failure with later ones suppressed, or null. */
    private RuntimeIOException closeWriters() {
        RuntimeIOException failure = null;
        for (final Map.Entry<String, BufferedWriter> entry : writers.entrySet()) {
            try {
                entry.getValue().close();
            } catch (final IOException e) {
                final RuntimeIOException closeError = new RuntimeIOException("Error closing " + entry.getKey(), e);
                if (failure == null) {
                    failure = closeError;
                } else {
                    failure.addSuppressed(closeError);
                }
            }
        }
        return failure;
    }

    @Override
    public void close() {
        RuntimeException failure = null;
        try {
            flush();
        } catch (final RuntimeException e) {
            failure = e;
        }
        final RuntimeIOException closeFailure = closeWriters();
        if (failure == null) {
            failure = closeFailure;
        } else if (closeFailure != null) {
            failure.addSuppressed(closeFailure);
        }
        if (failure != null) throw failure;
    }
}
