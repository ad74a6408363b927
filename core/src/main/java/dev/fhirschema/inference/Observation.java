/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fhirschema.inference;

import dev.fhirschema.schema.FieldPath;

/**
 * A single fact derived from a record: the value at {@code path} had type {@code type}.
 */
public record Observation(FieldPath path, ObservedType type) {

    @Override
    public String toString() {
        return path + ": " + type;
    }
}
