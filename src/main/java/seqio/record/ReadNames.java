package seqio.record;

/**
 * Helpers for comparing and printing read names.
 */
public final class ReadNames {
    /** Names and sequences longer than this are shortened in messages. */
    public static final int MAX_MESSAGE_LENGTH = 100;

    private ReadNames() {}

    /**
     * Checks whether two reads have the same name, ignoring a trailing '1' or '2'.
     * <p>
     * Only the part of each name before the first whitespace is compared. Old paired-end data has names
     * ending in "/1" and "/2", and fastq-dump appends ".1" and ".2" when run with -I. The last character is
     * removed from both names whenever both end in '1' or '2'; the two digits need not differ.
     * </p>
     */
    public static boolean namesMatch(final String name1, final String name2) {
        String id1 = firstToken(name1);
        String id2 = firstToken(name2);
        if (endsInMateNumber(id1) && endsInMateNumber(id2)) {
            id1 = id1.substring(0, id1.length() - 1);
            id2 = id2.substring(0, id2.length() - 1);
        }
        return id1.equals(id2);
    }

    public static boolean namesMatch(final Sequence read1, final Sequence read2) {
        return namesMatch(read1.getName(), read2.getName());
    }

    /** The read name up to the first whitespace. */
    public static String firstToken(final String name) {
        final String stripped = name.trim();
        for (int i = 0; i < stripped.length(); i++) {
            if (Character.isWhitespace(stripped.charAt(i))) {
                return stripped.substring(0, i);
            }
        }
        return stripped;
    }

    private static boolean endsInMateNumber(final String name) {
        if (name.isEmpty()) return false;
        final char last = name.charAt(name.length() - 1);
        return last == '1' || last == '2';
    }

    /** Shortens a string for use in an error message. */
    public static String truncate(final String s) {
        if (s == null || s.length() <= MAX_MESSAGE_LENGTH) return s;
        return s.substring(0, MAX_MESSAGE_LENGTH - 3) + "...";
    }
}
