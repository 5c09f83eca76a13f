package seqio.io;

/**
 * Maps the integer quality values of a QUAL file to their FASTQ characters (value + 33).
 * <p>
 * Values from -5 up to 222 are supported, i.e. every value whose character is printable ASCII or above.
 * Only the canonical decimal spelling of a value is recognized, so "+7" and "07" are rejected.
 * The table is immutable; use {@link #getInstance()}.
 * </p>
 */
public final class QualityValueTable {
    public static final int MIN_VALUE = -5;
    public static final int MAX_VALUE = 256 - 33 - 1;
    public static final int ASCII_OFFSET = 33;

    private static final QualityValueTable INSTANCE = new QualityValueTable();

    private final char[] characters = new char[MAX_VALUE - MIN_VALUE + 1];

    private QualityValueTable() {
        for (int value = MIN_VALUE; value <= MAX_VALUE; value++) {
            characters[value - MIN_VALUE] = (char) (value + ASCII_OFFSET);
        }
    }

    public static QualityValueTable getInstance() {
        return INSTANCE;
    }

    public boolean contains(final int value) {
        return value >= MIN_VALUE && value <= MAX_VALUE;
    }

    public char toChar(final int value) {
        if (!contains(value)) {
            throw new IllegalArgumentException("Quality value out of range: " + value);
        }
        return characters[value - MIN_VALUE];
    }

    /**
     * Decodes one whitespace-delimited token of a QUAL file.
     *
     * @return the quality character, or null if the token is not a recognized quality value
     */
    public Character decode(final String token) {
        final int value;
        try {
            value = Integer.parseInt(token);
        } catch (final NumberFormatException e) {
            return null;
        }
        if (!contains(value) || !Integer.toString(value).equals(token)) {
            return null;
        }
        return characters[value - MIN_VALUE];
    }
}
