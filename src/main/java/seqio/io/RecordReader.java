package seqio.io;

import htsjdk.samtools.util.CloseableIterator;

import java.util.Iterator;

/**
 * A lazy, single-pass source of records (single reads or read pairs).
 * <p>
 * Records are only read when {@link #hasNext()} or {@link #next()} is called. A reader cannot be restarted;
 * {@link #iterator()} returns the reader itself so that it can be used in a for-each loop exactly once.
 * Readers own their underlying handles and must be closed; closing more than once is harmless.
 * </p>
 */
public interface RecordReader<T> extends CloseableIterator<T>, Iterable<T> {

    /** @return true if the records produced by this reader carry quality values */
    boolean deliversQualities();

    @Override
    default Iterator<T> iterator() {
        return this;
    }
}
