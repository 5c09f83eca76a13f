package seqio.io;

import java.io.IOException;
import java.io.Reader;

/**
 * A reader that returns one given line before the content of an already opened reader.
 * <p>
 * Used when the format of a stream has been detected by reading its first line: the line is pushed back so
 * that the parser chosen afterwards still sees it.
 * </p>
 */
public class PrependedLineReader extends Reader {
    private final String firstLine;
    private final Reader delegate;
    private int position = 0;

    /**
     * @param firstLine line to return first; a newline is appended if it has none
     * @param delegate the reader to continue with
     */
    public PrependedLineReader(final String firstLine, final Reader delegate) {
        this.firstLine = firstLine.endsWith("\n") ? firstLine : firstLine + "\n";
        this.delegate = delegate;
    }

    @Override
    public int read(final char[] buffer, final int offset, final int length) throws IOException {
        if (length == 0) return 0;
        if (position < firstLine.length()) {
            final int n = Math.min(length, firstLine.length() - position);
            firstLine.getChars(position, position + n, buffer, offset);
            position += n;
            return n;
        }
        return delegate.read(buffer, offset, length);
    }

    @Override
    public void close() throws IOException {
        delegate.close();
    }
}
