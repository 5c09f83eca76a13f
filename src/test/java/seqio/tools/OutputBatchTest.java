package seqio.tools;

import htsjdk.samtools.util.RuntimeIOException;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

public class OutputBatchTest {

    /** Records what was written and whether it was closed; optionally fails on close. */
    private static class TrackingWriter extends StringWriter {
        private final boolean failOnClose;
        boolean closed = false;

        TrackingWriter(final boolean failOnClose) {
            this.failOnClose = failOnClose;
        }

        @Override
        public void close() throws IOException {
            closed = true;
            if (failOnClose) throw new IOException("disk full");
        }
    }

    @Test
    public void testWritesInBatches() {
        final TrackingWriter out = new TrackingWriter(false);
        try (final OutputBatch batch = new OutputBatch(Collections.singletonList("out"), 2, d -> new BufferedWriter(out))) {
            batch.getBuffer().computeIfAbsent("out", d -> new ArrayList<>()).add(">a\nAC\n");
            batch.added();
            batch.getBuffer().computeIfAbsent("out", d -> new ArrayList<>()).add(">b\nGT\n");
            batch.added();
            batch.getBuffer().computeIfAbsent("out", d -> new ArrayList<>()).add(">c\nTT\n");
            batch.added();
        }
        Assert.assertTrue(out.closed);
        Assert.assertEquals(out.toString(), ">a\nAC\n>b\nGT\n>c\nTT\n");
    }

    @Test
    public void testOpenedWritersAreClosedWhenOpeningFails() {
        final TrackingWriter first = new TrackingWriter(false);
        try {
            new OutputBatch(Arrays.asList("first", "second"), 10, destination -> {
                if (destination.equals("second")) throw new RuntimeIOException("Cannot open second");
                return new BufferedWriter(first);
            });
            Assert.fail("Opening the second output should have failed");
        } catch (final RuntimeIOException e) {
            Assert.assertEquals(e.getMessage(), "Cannot open second");
        }
        Assert.assertTrue(first.closed);
    }

    @Test
    public void testAllWritersAreClosedWhenOneFailsToClose() {
        final Map<String, TrackingWriter> writers = new HashMap<>();
        writers.put("first", new TrackingWriter(true));
        writers.put("second", new TrackingWriter(false));
        final OutputBatch batch = new OutputBatch(Arrays.asList("first", "second"), 10, d -> new BufferedWriter(writers.get(d)));
        try {
            batch.close();
            Assert.fail("Close failure was not reported");
        } catch (final RuntimeIOException e) {
            Assert.assertEquals(e.getMessage(), "Error closing first");
        }
        Assert.assertTrue(writers.get("first").closed);
        Assert.assertTrue(writers.get("second").closed);
    }
}
