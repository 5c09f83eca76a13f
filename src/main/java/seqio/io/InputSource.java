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

import htsjdk.samtools.SamInputResource;
import htsjdk.samtools.SamReader;
import htsjdk.samtools.SamReaderFactory;
import htsjdk.samtools.util.IOUtil;
import seqio.ConfigurationException;

import java.io.BufferedReader;
import java.io.File;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * An input to read sequences from: a path, standard input, or a stream or reader that the caller has already
 * opened. The name, when known, is used to detect the format from the file extension and in messages.
 * <p>
 * Paths are opened through htsjdk, which decompresses gzipped files transparently. Whatever is opened from
 * this source is owned, and eventually closed, by the reader it is handed to.
 * </p>
 */
public final class InputSource {
    /** The path that denotes standard input. */
    public static final String STDIN = "-";

    private final String name;
    private final Path path;
    private final InputStream stream;
    private final BufferedReader reader;

    private InputSource(final String name, final Path path, final InputStream stream, final BufferedReader reader) {
        this.name = name;
        this.path = path;
        this.stream = stream;
        this.reader = reader;
    }

    /** A file path, or {@value #STDIN} for standard input. */
    public static InputSource of(final String path) {
        Objects.requireNonNull(path, "path");
        if (STDIN.equals(path)) {
            return new InputSource(STDIN, null, System.in, null);
        }
        return of(Paths.get(path));
    }

    public static InputSource of(final Path path) {
        Objects.requireNonNull(path, "path");
        return new InputSource(path.toString(), path, null, null);
    }

    public static InputSource of(final File file) {
        return of(file.toPath());
    }

    /**
     * An already opened byte stream.
     *
     * @param name file name used for format detection, or null if unknown
     */
    public static InputSource of(final InputStream stream, final String name) {
        return new InputSource(name, null, Objects.requireNonNull(stream, "stream"), null);
    }

    /**
     * An already opened text reader. Such a source cannot be used for SAM/BAM input.
     *
     * @param name file name used for format detection, or null if unknown
     */
    public static InputSource of(final BufferedReader reader, final String name) {
        return new InputSource(name, null, null, Objects.requireNonNull(reader, "reader"));
    }

    /** @return the file name, {@value #STDIN} for standard input, or null if unknown */
    public String getName() {
        return name;
    }

    public boolean isStandardInput() {
        return STDIN.equals(name) && path == null;
    }

    /** @return the name to use for extension based format detection, or null if there is none */
    public String getDetectableName() {
        return isStandardInput() ? null : name;
    }

    /** Opens the source for line oriented reading. */
    public BufferedReader openBufferedReader() {
        if (reader != null) return reader;
        if (stream != null) return new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8));
        return IOUtil.openFileForBufferedReading(path);
    }

    /** Opens the source with the htsjdk alignment decoder. */
    public SamReader openSamReader() {
        final SamReaderFactory factory = SamReaderFactory.makeDefault();
        if (path != null) return factory.open(SamInputResource.of(path));
        if (stream != null) return factory.open(SamInputResource.of(stream));
        throw new ConfigurationException("SAM/BAM input must be given as a path or a byte stream, not as a text reader: " + this);
    }

    @Override
    public String toString() {
        return name == null ? "<unnamed input>" : name;
    }
}
