/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fhirschema.inference;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Immutable, map-backed {@link ReferenceDefaults}.
 */
final class StaticReferenceDefaults implements ReferenceDefaults {

    private static final System.Logger LOG = System.getLogger(StaticReferenceDefaults.class.getName());

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final StaticReferenceDefaults EMPTY = new StaticReferenceDefaults(Map.of());

    private final Map<String, List<String>> fieldsByKind;

    StaticReferenceDefaults(Map<String, List<String>> fieldsByKind) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : fieldsByKind.entrySet()) {
            copy.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
        this.fieldsByKind = Collections.unmodifiableMap(copy);
    }

    @Override
    public Optional<List<String>> fieldsFor(String kind) {
        return Optional.ofNullable(fieldsByKind.get(kind));
    }

    @Override
    public Set<String> kinds() {
        return fieldsByKind.keySet();
    }

    static StaticReferenceDefaults fromJson(InputStream input, String sourceName) {
        JsonNode root;
        try {
            root = MAPPER.readTree(input);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Could not read reference defaults from " + sourceName, e);
        }
        if (root == null || !root.isObject()) {
            throw new UncheckedIOException(new IOException(
                    "Reference defaults in " + sourceName + " must be a JSON object of field name arrays"));
        }

        Map<String, List<String>> fieldsByKind = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> kinds = root.fields();
        while (kinds.hasNext()) {
            Map.Entry<String, JsonNode> kind = kinds.next();
            if (!kind.getValue().isArray()) {
                throw new UncheckedIOException(new IOException(
                        "Reference defaults for '" + kind.getKey() + "' in " + sourceName + " must be an array"));
            }
            List<String> fields = new ArrayList<>(kind.getValue().size());
            for (JsonNode field : kind.getValue()) {
                if (!field.isTextual()) {
                    throw new UncheckedIOException(new IOException(
                            "Field names for '" + kind.getKey() + "' in " + sourceName + " must be strings"));
                }
                fields.add(field.asText());
            }
            fieldsByKind.put(kind.getKey(), fields);
        }

        LOG.log(System.Logger.Level.DEBUG, "Loaded reference defaults for {0} record kinds from {1}",
                fieldsByKind.size(), sourceName);
        return new StaticReferenceDefaults(fieldsByKind);
    }

    static final class Bundled {

        static final StaticReferenceDefaults INSTANCE = load();

        private Bundled() {
        }

        private static StaticReferenceDefaults load() {
            try (InputStream input = ReferenceDefaults.class.getResourceAsStream(BUNDLED_RESOURCE)) {
                if (input == null) {
                    throw new IllegalStateException("Bundled reference defaults not found: " + BUNDLED_RESOURCE);
                }
                return fromJson(input, BUNDLED_RESOURCE);
            }
            catch (IOException e) {
                throw new UncheckedIOException("Could not close " + BUNDLED_RESOURCE, e);
            }
        }
    }

    @Override
    public String toString() {
        return "ReferenceDefaults" + fieldsByKind.keySet();
    }
}
