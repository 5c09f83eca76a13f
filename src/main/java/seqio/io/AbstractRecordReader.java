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
package seqio.io;

import com.google.common.collect.AbstractIterator;

/**
 * Base class for readers. Subclasses implement {@link #readNext()}, which is called once per requested record,
 * and {@link #doClose()}, which is called at most once.
 */
public abstract class AbstractRecordReader<T> extends AbstractIterator<T> implements RecordReader<T> {
    private boolean closed = false;

    /** @return the next record, or null at the end of input */
    protected abstract T readNext();

    /** Releases the resources held by this reader. */
    protected abstract void doClose();

    @Override
    protected final T computeNext() {
        if (closed) return endOfData();
        final T record = readNext();
        return record == null ? endOfData() : record;
    }

    @Override
    public final void close() {
        if (!closed) {
            closed = true;
            doClose();
        }
    }

    public boolean isClosed() {
        return closed;
    }
}
