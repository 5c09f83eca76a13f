package seqio.io;

import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;

public class PrependedLineReaderTest {

    @Test
    public void testFirstLineThenRest() throws IOException {
        final BufferedReader reader = new BufferedReader(new PrependedLineReader(">r1", new StringReader("ACGT\nTT\n")));
        Assert.assertEquals(reader.readLine(), ">r1");
        Assert.assertEquals(reader.readLine(), "ACGT");
        Assert.assertEquals(reader.readLine(), "TT");
        Assert.assertNull(reader.readLine());
    }

    @Test
    public void testFirstLineWithNewline() throws IOException {
        final BufferedReader reader = new BufferedReader(new PrependedLineReader("@r1\n", new StringReader("")));
        Assert.assertEquals(reader.readLine(), "@r1");
        Assert.assertNull(reader.readLine());
    }

    @Test
    public void testSmallReads() throws IOException {
        final Reader reader = new PrependedLineReader("ab", new StringReader("cd"));
        final char[] buffer = new char[2];
        final StringBuilder all = new StringBuilder();
        int n;
        while ((n = reader.read(buffer, 0, buffer.length)) != -1) {
            all.append(buffer, 0, n);
        }
        Assert.assertEquals(all.toString(), "ab\ncd");
    }

    @Test
    public void testCloseClosesDelegate() throws IOException {
        final boolean[] closed = {false};
        final Reader delegate = new StringReader("x") {
            @Override
            public void close() {
                closed[0] = true;
                super.close();
            }
        };
        new PrependedLineReader("first", delegate).close();
        Assert.assertTrue(closed[0]);
    }
}
