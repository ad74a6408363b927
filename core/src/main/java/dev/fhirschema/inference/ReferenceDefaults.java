/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fhirschema.inference;

import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lookup of the top-level fields a record kind is expected to have, used to widen inferred
 * schemas with fields absent from the sampled records.
 */
public interface ReferenceDefaults {

    /**
     * Classpath location of the bundled FHIR R4 field table.
     */
    String BUNDLED_RESOURCE = "/dev/fhirschema/fhir-r4-toplevel-fields.json";

    /**
     * Returns the ordered top-level field names of {@code kind}, or empty if the kind is unknown.
     */
    Optional<List<String>> fieldsFor(String kind);

    /**
     * Returns the record kinds this lookup knows about.
     */
    Set<String> kinds();

    static ReferenceDefaults empty() {
        return StaticReferenceDefaults.EMPTY;
    }

    static ReferenceDefaults of(Map<String, List<String>> fieldsByKind) {
        return new StaticReferenceDefaults(fieldsByKind);
    }

    /**
     * Reads a JSON object mapping each record kind to an array of field names.
     *
     * @param sourceName name of the source, used in error messages
     * @throws java.io.UncheckedIOException if the input cannot be read or has the wrong shape
     */
    static ReferenceDefaults fromJson(InputStream input, String sourceName) {
        return StaticReferenceDefaults.fromJson(input, sourceName);
    }

    /**
     * Returns the bundled table for common FHIR R4 resources (loaded once).
     */
    static ReferenceDefaults bundled() {
        return StaticReferenceDefaults.Bundled.INSTANCE;
    }
}
