/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fhirschema.inference;

import com.fasterxml.jackson.databind.JsonNode;

import dev.fhirschema.schema.InferredSchema;

/**
 * Sequential fold of records into a schema.
 *
 * <pre>{@code
 * InferredSchema schema = SchemaBuilder.build("Patient", records, ReferenceDefaults.bundled());
 * }</pre>
 *
 * <p>For parallel folds over large inputs, use {@link dev.fhirschema.reader.FhirSchema}.</p>
 */
public final class SchemaBuilder {

    private SchemaBuilder() {
    }

    /**
     * Infers the schema of {@code records}, widened with the reference fields of {@code kind}.
     *
     * @throws InvalidRecordException if any record is not a JSON object
     */
    public static InferredSchema build(String kind, Iterable<? extends JsonNode> records, ReferenceDefaults defaults) {
        return fold(kind, records).finish(defaults);
    }

    /**
     * Folds {@code records} into a new, unfinished tree.
     */
    public static SchemaTree fold(String kind, Iterable<? extends JsonNode> records) {
        SchemaTree tree = SchemaTree.create(kind);
        for (JsonNode record : records) {
            tree.add(record);
        }
        return tree;
    }
}
