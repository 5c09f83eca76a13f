package seqio.format;

import seqio.FormatException;
import seqio.record.ReadNames;
import seqio.record.Sequence;

final class FormatUtil {
    private FormatUtil() {}

    static String primer(final Sequence read) {
        if (!read.isColorspace()) {
            throw new FormatException("Read '" + ReadNames.truncate(read.getName()) + "' is not a colorspace read and has no primer base.");
        }
        return read.getPrimer();
    }
}
