/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fhirschema.internal.render;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import dev.fhirschema.inference.MergedNode;
import dev.fhirschema.metadata.ConvertedType;
import dev.fhirschema.metadata.LogicalType;
import dev.fhirschema.metadata.PhysicalType;
import dev.fhirschema.metadata.RepetitionType;
import dev.fhirschema.schema.InferredSchema;
import dev.fhirschema.schema.SchemaNode;

/**
 * Renders a merged type tree into a nested columnar schema.
 * <p>
 * All fields are optional. Lists use the standard three-level encoding
 * ({@code <name> (LIST) -> repeated group list -> element}). Nodes without any type evidence
 * (NULL leaves and structs without observed fields) become string columns.
 * </p>
 */
public final class SchemaRenderer {

    private static final LogicalType STRING = new LogicalType.StringType();

    private SchemaRenderer() {
    }

    public static InferredSchema render(String name, MergedNode root) {
        int[] columnIndex = { 0 }; // Mutable counter for column indexing
        List<SchemaNode> children = renderChildren(root, 0, 0, columnIndex);

        SchemaNode.GroupNode rootNode = new SchemaNode.GroupNode(
                name,
                RepetitionType.REQUIRED,
                null,
                children,
                0, // Root has def level 0
                0 // Root has rep level 0
        );
        return new InferredSchema(name, rootNode);
    }

    private static List<SchemaNode> renderChildren(MergedNode struct, int parentDefLevel, int parentRepLevel,
                                                   int[] columnIndex) {
        List<SchemaNode> children = new ArrayList<>(struct.children().size());
        for (Map.Entry<String, MergedNode> child : struct.children().entrySet()) {
            children.add(renderField(child.getKey(), child.getValue(), RepetitionType.OPTIONAL,
                    parentDefLevel, parentRepLevel, columnIndex));
        }
        return children;
    }

    private static SchemaNode renderField(String name, MergedNode node, RepetitionType repType,
                                          int parentDefLevel, int parentRepLevel, int[] columnIndex) {
        int defLevel = parentDefLevel + (repType.isNullable() ? 1 : 0);
        int repLevel = parentRepLevel + (repType == RepetitionType.REPEATED ? 1 : 0);

        return switch (node.kind()) {
            case STRUCT -> {
                if (node.children().isEmpty()) {
                    yield primitive(name, PhysicalType.BYTE_ARRAY, STRING, repType, defLevel, repLevel, columnIndex);
                }
                yield new SchemaNode.GroupNode(
                        name,
                        repType,
                        null,
                        renderChildren(node, defLevel, repLevel, columnIndex),
                        defLevel,
                        repLevel);
            }
            case LIST -> {
                // The repeated 'list' group adds one definition and one repetition level
                int listDefLevel = defLevel + 1;
                int listRepLevel = repLevel + 1;
                SchemaNode element = renderField("element", node.element(), RepetitionType.OPTIONAL,
                        listDefLevel, listRepLevel, columnIndex);
                SchemaNode.GroupNode list = new SchemaNode.GroupNode(
                        "list",
                        RepetitionType.REPEATED,
                        null,
                        List.of(element),
                        listDefLevel,
                        listRepLevel);
                yield new SchemaNode.GroupNode(name, repType, ConvertedType.LIST, List.of(list), defLevel, repLevel);
            }
            case BOOLEAN -> primitive(name, PhysicalType.BOOLEAN, null, repType, defLevel, repLevel, columnIndex);
            case INTEGER -> primitive(name, PhysicalType.INT64, null, repType, defLevel, repLevel, columnIndex);
            case FLOAT -> primitive(name, PhysicalType.DOUBLE, null, repType, defLevel, repLevel, columnIndex);
            case STRING, NULL -> primitive(name, PhysicalType.BYTE_ARRAY, STRING, repType, defLevel, repLevel, columnIndex);
        };
    }

    private static SchemaNode.PrimitiveNode primitive(String name, PhysicalType type, LogicalType logicalType,
                                                      RepetitionType repType, int defLevel, int repLevel,
                                                      int[] columnIndex) {
        return new SchemaNode.PrimitiveNode(name, type, repType, logicalType, columnIndex[0]++, defLevel, repLevel);
    }
}
