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
package seqio.record;

import seqio.FormatException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single sequencing read or FASTA entry.
 * <p>
 * The name is the complete header line (without the leading '&gt;' or '@') and may therefore contain a
 * description after the first whitespace. Qualities are optional; when present there is exactly one
 * quality character per residue.
 * </p>
 * <p>
 * Colorspace reads carry a primer base, which is kept apart from the color calls in {@link #getSequence()}
 * and is prepended again on output. Reads in base space have no primer. Use {@link SequenceType} to build
 * reads from raw file fields.
 * </p>
 * <p>
 * Attributes are opaque values attached by downstream processing (e.g. trimming). They are carried over to
 * slices of this read but are never interpreted here.
 * </p>
 */
public class Sequence {
    public static final String COLORSPACE_PRIMERS = "ACGT";

    private final String name;
    private final String sequence;
    private final String qualities;
    private final String name2;
    private final String primer;
    private final Map<String, Object> attributes = new LinkedHashMap<>();

    public Sequence(final String name, final String sequence) {
        this(name, sequence, null, "");
    }

    public Sequence(final String name, final String sequence, final String qualities) {
        this(name, sequence, qualities, "");
    }

    /**
     * Creates a base space read.
     *
     * @throws FormatException if qualities are given and their length differs from the sequence length
     */
    public Sequence(final String name, final String sequence, final String qualities, final String name2) {
        this(name, sequence, qualities, name2, null);
        if (qualities != null && qualities.length() != sequence.length()) {
            throw new FormatException(String.format(
                    "In read named '%s': length of quality sequence (%d) and length of read (%d) do not match",
                    ReadNames.truncate(name), qualities.length(), sequence.length()));
        }
    }

    private Sequence(final String name, final String sequence, final String qualities, final String name2, final String primer) {
        this.name = Objects.requireNonNull(name, "name");
        this.sequence = Objects.requireNonNull(sequence, "sequence");
        this.qualities = qualities;
        this.name2 = name2 == null ? "" : name2;
        this.primer = primer;
    }

    /**
     * Creates a colorspace read whose primer has already been split off the color calls.
     *
     * @throws FormatException if the quality length differs from the number of color calls, or if the
     * primer is not one of A, C, G, T
     */
    public static Sequence colorspace(final String name, final String colors, final String qualities,
                                      final String primer, final String name2) {
        if (qualities != null && qualities.length() != colors.length()) {
            throw new FormatException(String.format(
                    "In read named '%s': length of colorspace quality sequence (%d) and length of read (%d) do not match (primer is: '%s')",
                    ReadNames.truncate(name), qualities.length(), colors.length(), primer));
        }
        if (primer == null || primer.length() != 1 || COLORSPACE_PRIMERS.indexOf(primer.charAt(0)) < 0) {
            throw new FormatException(String.format(
                    "Primer base is '%s' in read '%s', but it should be one of A, C, G, T.",
                    primer, ReadNames.truncate(name)));
        }
        return new Sequence(name, colors, qualities, name2, primer);
    }

    public String getName() { return name; }

    public String getSequence() { return sequence; }

    /** @return the quality string, or null if this read has no qualities */
    public String getQualities() { return qualities; }

    public boolean hasQualities() { return qualities != null; }

    /** @return the secondary header of the FASTQ '+' line, empty if there was none */
    public String getName2() { return name2; }

    /** @return the primer base of a colorspace read, null in base space */
    public String getPrimer() { return primer; }

    public boolean isColorspace() { return primer != null; }

    /** Number of residues (or color calls), not counting the primer. */
    public int length() { return sequence.length(); }

    public Object getAttribute(final String key) {
        return attributes.get(key);
    }

    public void setAttribute(final String key, final Object value) {
        attributes.put(key, value);
    }

    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    /**
     * Returns a new read holding residues [start, end) of this one. Name, secondary name, primer and
     * attributes are kept.
     */
    public Sequence subsequence(final int start, final int end) {
        final String quals = qualities == null ? null : qualities.substring(start, end);
        final Sequence slice = new Sequence(name, sequence.substring(start, end), quals, name2, primer);
        slice.attributes.putAll(attributes);
        return slice;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof Sequence)) return false;
        final Sequence that = (Sequence) o;
        return name.equals(that.name) &&
                sequence.equals(that.sequence) &&
                Objects.equals(qualities, that.qualities) &&
                name2.equals(that.name2) &&
                Objects.equals(primer, that.primer);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, sequence, qualities, name2, primer);
    }

    @Override
    public String toString() {
        final StringBuilder builder = new StringBuilder(isColorspace() ? "ColorspaceSequence(" : "Sequence(");
        builder.append("name='").append(ReadNames.truncate(name)).append('\'');
        if (primer != null) builder.append(", primer='").append(primer).append('\'');
        builder.append(", sequence='").append(ReadNames.truncate(sequence)).append('\'');
        if (qualities != null) builder.append(", qualities='").append(ReadNames.truncate(qualities)).append('\'');
        return builder.append(')').toString();
    }
}
