/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fhirschema.schema;

import java.util.List;

import dev.fhirschema.metadata.LogicalType;
import dev.fhirschema.metadata.PhysicalType;
import dev.fhirschema.metadata.RepetitionType;

/**
 * A leaf column of an inferred schema.
 *
 * @param path Names of all nodes from the root to this column, including the
 *             {@code list} and {@code element} nodes of list encodings
 */
public record ColumnSchema(
        String name,
        List<String> path,
        PhysicalType type,
        RepetitionType repetitionType,
        int columnIndex,
        int maxDefinitionLevel,
        int maxRepetitionLevel,
        LogicalType logicalType) {

    public ColumnSchema {
        path = List.copyOf(path);
    }

    /**
     * Returns the dotted column path, e.g. {@code extension.list.element.url}.
     */
    public String dottedPath() {
        return String.join(".", path);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(repetitionType.name().toLowerCase());
        sb.append(" ");
        sb.append(type.name().toLowerCase());
        sb.append(" ");
        sb.append(dottedPath());
        if (logicalType != null) {
            sb.append(" (").append(logicalType).append(")");
        }
        sb.append(";");
        return sb.toString();
    }
}
