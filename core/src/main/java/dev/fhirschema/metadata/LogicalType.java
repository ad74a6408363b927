/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fhirschema.metadata;

/**
 * Logical types that provide semantic meaning to physical types.
 */
public sealed interface LogicalType permits LogicalType.StringType {

    record StringType() implements LogicalType {

        @Override
        public String toString() {
            return "STRING";
        }
    }
}
