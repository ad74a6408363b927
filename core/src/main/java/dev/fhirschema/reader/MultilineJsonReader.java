/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fhirschema.reader;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import java.util.zip.GZIPInputStream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Reads multi-line JSON files (NDJSON / JSON Lines), one JSON value per line.
 * <p>
 * Problems are logged rather than raised. A file that cannot be opened yields no values, and
 * lines that are blank or not valid JSON are skipped. Files ending in {@code .gz} are
 * decompressed transparently.
 * </p>
 *
 * <pre>{@code
 * try (Stream<JsonNode> records = MultilineJsonReader.read(path)) {
 *     records.forEach(...);
 * }
 * }</pre>
 */
public final class MultilineJsonReader {

    private static final System.Logger LOG = System.getLogger(MultilineJsonReader.class.getName());

    // A line holds exactly one value; anything after it makes the line invalid
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    private MultilineJsonReader() {
    }

    /**
     * Returns a lazy stream of the JSON values in {@code path}. The stream must be closed.
     */
    public static Stream<JsonNode> read(Path path) {
        BufferedReader reader;
        try {
            reader = open(path);
        }
        catch (IOException e) {
            LOG.log(System.Logger.Level.ERROR, "Could not read from ''{0}'': {1}", path, e.getMessage());
            return Stream.empty();
        }

        LineIterator lines = new LineIterator(path, reader);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(lines, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(lines::close);
    }

    /**
     * Returns the raw first line of {@code path} without its line terminator, or null for an
     * empty file.
     */
    static String readFirstLine(Path path) throws IOException {
        try (BufferedReader reader = open(path)) {
            return reader.readLine();
        }
    }

    static JsonNode parse(String line) throws JsonProcessingException {
        return MAPPER.readTree(line);
    }

    static boolean isCompressed(Path path) {
        return path.getFileName().toString().toLowerCase().endsWith(".gz");
    }

    private static BufferedReader open(Path path) throws IOException {
        InputStream input = Files.newInputStream(path);
        if (isCompressed(path)) {
            try {
                input = new GZIPInputStream(input);
            }
            catch (IOException e) {
                input.close();
                throw e;
            }
        }
        return new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
    }

    /**
     * Iterates the parsed values of a file, reading ahead to the next valid line.
     */
    private static final class LineIterator implements Iterator<JsonNode> {

        private final Path path;
        private final BufferedReader reader;
        private JsonNode next;
        private int lineNumber;
        private boolean exhausted;

        LineIterator(Path path, BufferedReader reader) {
            this.path = path;
            this.reader = reader;
        }

        @Override
        public boolean hasNext() {
            while (next == null && !exhausted) {
                String line;
                try {
                    line = reader.readLine();
                }
                catch (IOException e) {
                    LOG.log(System.Logger.Level.ERROR, "Could not read from ''{0}'': {1}", path, e.getMessage());
                    exhausted = true;
                    break;
                }
                if (line == null) {
                    exhausted = true;
                    break;
                }
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    next = parse(line);
                }
                catch (JsonProcessingException e) {
                    LOG.log(System.Logger.Level.WARNING, "Could not decode ''{0}:{1}'': {2}",
                            path, lineNumber, e.getOriginalMessage());
                }
            }
            return next != null;
        }

        @Override
        public JsonNode next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            JsonNode result = next;
            next = null;
            return result;
        }

        void close() {
            try {
                reader.close();
            }
            catch (IOException e) {
                throw new UncheckedIOException("Could not close " + path, e);
            }
        }
    }
}
