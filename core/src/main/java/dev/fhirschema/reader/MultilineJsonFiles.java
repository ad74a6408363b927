/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fhirschema.reader;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Finds multi-line JSON files in a folder and tells which FHIR resource type they hold.
 * <p>
 * File names vary too much between bulk export tools to rely on, so only the extension is
 * checked ({@code .ndjson} or {@code .jsonl}, optionally followed by {@code .gz}) and the
 * resource type is sniffed from the {@code resourceType} of the first line.
 * </p>
 */
public final class MultilineJsonFiles {

    private static final System.Logger LOG = System.getLogger(MultilineJsonFiles.class.getName());

    private static final List<String> EXTENSIONS = List.of(".ndjson", ".jsonl");

    private MultilineJsonFiles() {
    }

    /**
     * Lists the multi-line JSON files directly inside {@code dir}.
     *
     * @param kinds resource types to accept; all files (including those without a detectable
     *              type) are returned when empty
     * @return sorted map of file to its resource type, which may be null when {@code kinds} is
     *         empty; an empty map if {@code dir} does not exist
     */
    public static Map<Path, String> list(Path dir, Set<String> kinds) {
        return list(dir, kinds, false);
    }

    /**
     * Lists the multi-line JSON files inside {@code dir}, optionally including sub-folders.
     */
    public static Map<Path, String> list(Path dir, Set<String> kinds, boolean recursive) {
        if (!Files.isDirectory(dir)) {
            return Map.of();
        }

        List<Path> candidates;
        try (Stream<Path> children = recursive ? Files.walk(dir) : Files.list(dir)) {
            candidates = children
                    .filter(Files::isRegularFile)
                    .filter(MultilineJsonFiles::hasMultilineJsonExtension)
                    .sorted()
                    .collect(Collectors.toList());
        }
        catch (IOException e) {
            throw new UncheckedIOException("Could not list " + dir, e);
        }

        Map<Path, String> results = new LinkedHashMap<>();
        for (Path candidate : candidates) {
            String resourceType = detectResourceType(candidate);
            if (kinds.isEmpty() || (resourceType != null && kinds.contains(resourceType))) {
                results.put(candidate, resourceType);
            }
        }
        return results;
    }

    /**
     * Returns the values of all matching files in file order, then line order. The stream must be closed.
     */
    public static Stream<JsonNode> readAll(Path dir, Set<String> kinds) {
        return readAll(dir, kinds, false);
    }

    /**
     * Returns the values of all matching files, optionally including sub-folders. Files are
     * opened one at a time, when the previous one is exhausted. The stream must be closed.
     */
    public static Stream<JsonNode> readAll(Path dir, Set<String> kinds, boolean recursive) {
        FileChain values = new FileChain(List.copyOf(list(dir, kinds, recursive).keySet()));
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(values, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(values::close);
    }

    static boolean hasMultilineJsonExtension(Path path) {
        String name = path.getFileName().toString().toLowerCase();
        if (name.endsWith(".gz")) {
            name = name.substring(0, name.length() - 3);
        }
        for (String extension : EXTENSIONS) {
            if (name.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the resource type of the first line of {@code path}, or null if there is none.
     * All records of a file are expected to share one resource type.
     */
    static String detectResourceType(Path path) {
        String firstLine;
        try {
            firstLine = MultilineJsonReader.readFirstLine(path);
        }
        catch (IOException e) {
            LOG.log(System.Logger.Level.WARNING, "Could not read from ''{0}'': {1}", path, e.getMessage());
            return null;
        }
        if (firstLine == null || firstLine.isBlank()) {
            return null;
        }

        JsonNode parsed;
        try {
            parsed = MultilineJsonReader.parse(firstLine);
        }
        catch (JsonProcessingException e) {
            LOG.log(System.Logger.Level.WARNING, "Could not read from ''{0}'': {1}", path, e.getOriginalMessage());
            return null;
        }
        JsonNode resourceType = parsed.get("resourceType");
        return resourceType != null && resourceType.isTextual() ? resourceType.asText() : null;
    }

    /**
     * Iterates the values of several files, keeping at most one of them open.
     */
    private static final class FileChain implements Iterator<JsonNode> {

        private final Iterator<Path> files;
        private Stream<JsonNode> current;
        private Iterator<JsonNode> values = Collections.emptyIterator();

        FileChain(List<Path> files) {
            this.files = files.iterator();
        }

        @Override
        public boolean hasNext() {
            while (!values.hasNext()) {
                close();
                if (!files.hasNext()) {
                    return false;
                }
                current = MultilineJsonReader.read(files.next());
                values = current.iterator();
            }
            return true;
        }

        @Override
        public JsonNode next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return values.next();
        }

        void close() {
            values = Collections.emptyIterator();
            if (current != null) {
                Stream<JsonNode> open = current;
                current = null;
                open.close();
            }
        }
    }
}
