/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fhirschema.schema;

import java.util.List;

import dev.fhirschema.metadata.ConvertedType;
import dev.fhirschema.metadata.LogicalType;
import dev.fhirschema.metadata.PhysicalType;
import dev.fhirschema.metadata.RepetitionType;

/**
 * Tree-based representation of an inferred columnar schema.
 * Each node represents either a primitive column or a group (struct/list).
 */
public sealed interface SchemaNode permits SchemaNode.PrimitiveNode, SchemaNode.GroupNode {

    String name();

    RepetitionType repetitionType();

    int maxDefinitionLevel();

    int maxRepetitionLevel();

    /**
     * Primitive leaf node representing an actual data column.
     */
    record PrimitiveNode(
            String name,
            PhysicalType type,
            RepetitionType repetitionType,
            LogicalType logicalType,
            int columnIndex,
            int maxDefinitionLevel,
            int maxRepetitionLevel) implements SchemaNode {
    }

    /**
     * Group node representing a struct or a list.
     */
    record GroupNode(
            String name,
            RepetitionType repetitionType,
            ConvertedType convertedType,
            List<SchemaNode> children,
            int maxDefinitionLevel,
            int maxRepetitionLevel) implements SchemaNode {

        public GroupNode {
            children = List.copyOf(children);
        }

        /**
         * Returns true if this is a LIST group.
         */
        public boolean isList() {
            return convertedType == ConvertedType.LIST;
        }

        /**
         * Returns true if this is a plain struct (no converted type).
         */
        public boolean isStruct() {
            return convertedType == null;
        }

        /**
         * Finds a direct child by name, or null if there is none.
         */
        public SchemaNode getChild(String name) {
            for (SchemaNode child : children) {
                if (child.name().equals(name)) {
                    return child;
                }
            }
            return null;
        }

        /**
         * For LIST groups, returns the element node (skipping intermediate 'list' group).
         * Returns null if not a list or improperly structured.
         */
        public SchemaNode getListElement() {
            if (!isList() || children.isEmpty()) {
                return null;
            }
            // Standard 3-level list encoding: LIST -> list (repeated) -> element
            SchemaNode inner = children.get(0);
            if (inner instanceof GroupNode innerGroup && innerGroup.repetitionType() == RepetitionType.REPEATED
                    && !innerGroup.children().isEmpty()) {
                return innerGroup.children().get(0);
            }
            return null;
        }
    }
}
