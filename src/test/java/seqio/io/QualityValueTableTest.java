package seqio.io;

import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class QualityValueTableTest {
    private final QualityValueTable table = QualityValueTable.getInstance();

    @DataProvider(name = "validTokens")
    public Object[][] validTokens() {
        return new Object[][] {
                {"0", '!'},
                {"40", 'I'},
                {"-5", (char) 28},
                {"93", '~'},
                {"222", (char) 255},
        };
    }

    @Test(dataProvider = "validTokens")
    public void testDecode(final String token, final char expected) {
        Assert.assertEquals(table.decode(token), Character.valueOf(expected));
    }

    @DataProvider(name = "invalidTokens")
    public Object[][] invalidTokens() {
        return new Object[][] {
                {"-6"}, {"223"}, {"+7"}, {"07"}, {"-0"}, {"x"}, {"4.0"}, {""},
        };
    }

    @Test(dataProvider = "invalidTokens")
    public void testDecodeRejects(final String token) {
        Assert.assertNull(table.decode(token));
    }

    @Test
    public void testRange() {
        Assert.assertTrue(table.contains(QualityValueTable.MIN_VALUE));
        Assert.assertTrue(table.contains(QualityValueTable.MAX_VALUE));
        Assert.assertFalse(table.contains(QualityValueTable.MAX_VALUE + 1));
        Assert.assertEquals(table.toChar(30), '?');
        Assert.assertSame(QualityValueTable.getInstance(), table);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testToCharOutOfRange() {
        table.toChar(-6);
    }
}
