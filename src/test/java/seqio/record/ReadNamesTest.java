package seqio.record;

import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class ReadNamesTest {

    @DataProvider(name = "names")
    public Object[][] names() {
        return new Object[][] {
                {"abc", "abc", true},
                {"abc/1", "abc/2", true},
                {"abc.1", "abc.2", true},
                {"abc1", "abc2", true},
                {"abc/1", "abc/1", true},
                {"abc2", "abc1", true},
                {"abc comment A", "abc comment B", true},
                {"abc/1 comment", "abc/2 other", true},
                {"abc", "abd", false},
                {"abc/1", "abd/2", false},
                {"abc/1", "abc", false},
                {"abc1", "abc", false},
                {"abc/3", "abc/4", false},
                {"  abc/1", "abc/2", true},
        };
    }

    @Test(dataProvider = "names")
    public void testNamesMatch(final String name1, final String name2, final boolean expected) {
        Assert.assertEquals(ReadNames.namesMatch(name1, name2), expected);
        Assert.assertEquals(ReadNames.namesMatch(name2, name1), expected);
    }

    @Test
    public void testNamesMatchOnReads() {
        Assert.assertTrue(ReadNames.namesMatch(new Sequence("r/1", "A"), new Sequence("r/2", "C")));
    }

    @Test
    public void testFirstToken() {
        Assert.assertEquals(ReadNames.firstToken("read1 some text"), "read1");
        Assert.assertEquals(ReadNames.firstToken("read1\tsome text"), "read1");
        Assert.assertEquals(ReadNames.firstToken("read1"), "read1");
        Assert.assertEquals(ReadNames.firstToken(""), "");
    }

    @Test
    public void testTruncate() {
        final StringBuilder builder = new StringBuilder();
        for (int i = 0; i < 150; i++) builder.append('n');
        final String truncated = ReadNames.truncate(builder.toString());
        Assert.assertEquals(truncated.length(), ReadNames.MAX_MESSAGE_LENGTH);
        Assert.assertTrue(truncated.endsWith("..."));
        Assert.assertEquals(ReadNames.truncate("short"), "short");
        Assert.assertNull(ReadNames.truncate(null));
    }
}
