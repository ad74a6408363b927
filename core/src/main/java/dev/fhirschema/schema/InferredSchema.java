/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fhirschema.schema;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Root schema container describing the columnar layout inferred for one record kind.
 * Supports both flat schemas and nested structures (structs, lists).
 */
public final class InferredSchema {

    private final String name;
    private final SchemaNode.GroupNode rootNode;
    private final List<ColumnSchema> columns;
    private final Map<String, Integer> columnPathToIndex;

    public InferredSchema(String name, SchemaNode.GroupNode rootNode) {
        this.name = name;
        this.rootNode = rootNode;

        List<ColumnSchema> collected = new ArrayList<>();
        List<String> path = new ArrayList<>();
        for (SchemaNode child : rootNode.children()) {
            collectColumns(child, path, collected);
        }
        this.columns = List.copyOf(collected);

        this.columnPathToIndex = new HashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            columnPathToIndex.put(columns.get(i).dottedPath(), i);
        }
    }

    /**
     * Returns the record kind this schema was inferred for.
     */
    public String getName() {
        return name;
    }

    public List<ColumnSchema> getColumns() {
        return columns;
    }

    public ColumnSchema getColumn(int index) {
        return columns.get(index);
    }

    /**
     * Looks up a leaf column by its dotted path, e.g. {@code code.coding.list.element.system}.
     */
    public ColumnSchema getColumn(String dottedPath) {
        Integer index = columnPathToIndex.get(dottedPath);
        if (index == null) {
            throw new IllegalArgumentException("Column not found: " + dottedPath);
        }
        return columns.get(index);
    }

    public int getColumnCount() {
        return columns.size();
    }

    /**
     * Returns the hierarchical schema tree representation.
     */
    public SchemaNode.GroupNode getRootNode() {
        return rootNode;
    }

    /**
     * Finds a top-level field by name in the schema tree.
     */
    public SchemaNode getField(String name) {
        SchemaNode child = rootNode.getChild(name);
        if (child == null) {
            throw new IllegalArgumentException("Field not found: " + name);
        }
        return child;
    }

    public boolean hasField(String name) {
        return rootNode.getChild(name) != null;
    }

    /**
     * Returns the top-level field names in schema order.
     */
    public List<String> getFieldNames() {
        List<String> names = new ArrayList<>(rootNode.children().size());
        for (SchemaNode child : rootNode.children()) {
            names.add(child.name());
        }
        return names;
    }

    /**
     * Returns true if all top-level fields are primitives and no column repeats.
     */
    public boolean isFlatSchema() {
        for (SchemaNode child : rootNode.children()) {
            if (child instanceof SchemaNode.GroupNode) {
                return false;
            }
        }
        for (ColumnSchema col : columns) {
            if (col.maxRepetitionLevel() > 0) {
                return false;
            }
        }
        return true;
    }

    private static void collectColumns(SchemaNode node, List<String> path, List<ColumnSchema> columns) {
        path.add(node.name());
        if (node instanceof SchemaNode.PrimitiveNode prim) {
            columns.add(new ColumnSchema(
                    prim.name(),
                    path,
                    prim.type(),
                    prim.repetitionType(),
                    prim.columnIndex(),
                    prim.maxDefinitionLevel(),
                    prim.maxRepetitionLevel(),
                    prim.logicalType()));
        }
        else if (node instanceof SchemaNode.GroupNode group) {
            for (SchemaNode child : group.children()) {
                collectColumns(child, path, columns);
            }
        }
        path.remove(path.size() - 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof InferredSchema other)) {
            return false;
        }
        return name.equals(other.name) && rootNode.equals(other.rootNode);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, rootNode);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("message ").append(name).append(" {\n");
        for (SchemaNode child : rootNode.children()) {
            appendNode(sb, child, 1);
        }
        sb.append("}");
        return sb.toString();
    }

    private void appendNode(StringBuilder sb, SchemaNode node, int indent) {
        String prefix = "  ".repeat(indent);
        if (node instanceof SchemaNode.GroupNode group) {
            sb.append(prefix);
            sb.append(group.repetitionType().name().toLowerCase());
            sb.append(" group ").append(group.name());
            if (group.convertedType() != null) {
                sb.append(" (").append(group.convertedType()).append(")");
            }
            sb.append(" {\n");
            for (SchemaNode child : group.children()) {
                appendNode(sb, child, indent + 1);
            }
            sb.append(prefix).append("}\n");
        }
        else if (node instanceof SchemaNode.PrimitiveNode prim) {
            sb.append(prefix);
            sb.append(prim.repetitionType().name().toLowerCase());
            sb.append(" ").append(prim.type().name().toLowerCase());
            sb.append(" ").append(prim.name());
            if (prim.logicalType() != null) {
                sb.append(" (").append(prim.logicalType()).append(")");
            }
            sb.append(";\n");
        }
    }
}
