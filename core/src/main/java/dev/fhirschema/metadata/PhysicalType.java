/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fhirschema.metadata;

/**
 * Physical column types an inferred schema renders to.
 */
public enum PhysicalType {
    BOOLEAN,
    INT64,
    DOUBLE,
    BYTE_ARRAY
}
