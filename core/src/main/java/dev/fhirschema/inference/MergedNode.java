/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fhirschema.inference;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Accumulating node of a schema tree.
 * <p>
 * A STRUCT node exclusively owns its children, kept in order of first sighting; a LIST node
 * exclusively owns the node describing its elements. Nodes are only ever reached through their
 * parent, so the tree never shares or cycles. Instances are not thread-safe.
 * </p>
 */
public final class MergedNode {

    public enum Kind {
        NULL,
        BOOLEAN,
        INTEGER,
        FLOAT,
        STRING,
        LIST,
        STRUCT;

        public boolean isNumeric() {
            return this == INTEGER || this == FLOAT;
        }

        public boolean isScalar() {
            return this != LIST && this != STRUCT;
        }
    }

    private Kind kind;
    private LinkedHashMap<String, MergedNode> children; // non-null iff STRUCT
    private MergedNode element; // non-null iff LIST

    private MergedNode(Kind kind) {
        this.kind = kind;
    }

    public static MergedNode nullNode() {
        return new MergedNode(Kind.NULL);
    }

    public static MergedNode scalar(Kind kind) {
        if (!kind.isScalar()) {
            throw new IllegalArgumentException("Not a scalar kind: " + kind);
        }
        return new MergedNode(kind);
    }

    public static MergedNode struct() {
        MergedNode node = new MergedNode(Kind.STRUCT);
        node.children = new LinkedHashMap<>();
        return node;
    }

    public static MergedNode list(MergedNode element) {
        MergedNode node = new MergedNode(Kind.LIST);
        node.element = Objects.requireNonNull(element, "element");
        return node;
    }

    /**
     * Creates a fresh node tree equivalent to the given type.
     */
    public static MergedNode from(ObservedType type) {
        if (type instanceof ObservedType.NullType) {
            return nullNode();
        }
        else if (type instanceof ObservedType.BooleanType) {
            return new MergedNode(Kind.BOOLEAN);
        }
        else if (type instanceof ObservedType.IntegerType) {
            return new MergedNode(Kind.INTEGER);
        }
        else if (type instanceof ObservedType.FloatType) {
            return new MergedNode(Kind.FLOAT);
        }
        else if (type instanceof ObservedType.StringType) {
            return new MergedNode(Kind.STRING);
        }
        else if (type instanceof ObservedType.ListType list) {
            return list(from(list.element()));
        }
        else if (type instanceof ObservedType.StructType struct) {
            MergedNode node = struct();
            for (Map.Entry<String, ObservedType> field : struct.fields().entrySet()) {
                node.children.put(field.getKey(), from(field.getValue()));
            }
            return node;
        }
        throw new IllegalArgumentException("Unknown observed type: " + type.getClass());
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Returns the children of a STRUCT node in first-sighting order, or an empty map for other kinds.
     */
    public Map<String, MergedNode> children() {
        return children != null ? Collections.unmodifiableMap(children) : Map.of();
    }

    /**
     * Returns the named child of a STRUCT node, or null.
     */
    public MergedNode child(String name) {
        return children != null ? children.get(name) : null;
    }

    /**
     * Returns the element node of a LIST node, or null for other kinds.
     */
    public MergedNode element() {
        return element;
    }

    /**
     * Returns true for a list whose elements were never observed (only empty arrays).
     */
    public boolean isEmptyList() {
        return kind == Kind.LIST && element.kind == Kind.NULL;
    }

    /**
     * Returns the child with the given name, adding a NULL child if there is none.
     * Only valid on STRUCT nodes.
     */
    MergedNode childOrCreate(String name) {
        if (kind != Kind.STRUCT) {
            throw new IllegalStateException("Not a struct node: " + kind);
        }
        return children.computeIfAbsent(name, k -> nullNode());
    }

    void putChild(String name, MergedNode child) {
        if (kind != Kind.STRUCT) {
            throw new IllegalStateException("Not a struct node: " + kind);
        }
        children.put(name, child);
    }

    /**
     * Turns this node into a deep copy of {@code other}.
     */
    void becomeCopyOf(MergedNode other) {
        MergedNode copy = other.copy();
        this.kind = copy.kind;
        this.children = copy.children;
        this.element = copy.element;
    }

    /**
     * Turns this node into a leaf of the given scalar kind, dropping any children.
     */
    void becomeScalar(Kind scalarKind) {
        this.kind = scalarKind;
        this.children = null;
        this.element = null;
    }

    public MergedNode copy() {
        MergedNode copy = new MergedNode(kind);
        if (children != null) {
            copy.children = new LinkedHashMap<>();
            for (Map.Entry<String, MergedNode> child : children.entrySet()) {
                copy.children.put(child.getKey(), child.getValue().copy());
            }
        }
        if (element != null) {
            copy.element = element.copy();
        }
        return copy;
    }

    /**
     * Returns an immutable snapshot of the type this node currently represents.
     */
    public ObservedType toObservedType() {
        return switch (kind) {
            case NULL -> ObservedType.NULL;
            case BOOLEAN -> ObservedType.BOOLEAN;
            case INTEGER -> ObservedType.INTEGER;
            case FLOAT -> ObservedType.FLOAT;
            case STRING -> ObservedType.STRING;
            case LIST -> new ObservedType.ListType(element.toObservedType());
            case STRUCT -> {
                Map<String, ObservedType> fields = new LinkedHashMap<>();
                for (Map.Entry<String, MergedNode> child : children.entrySet()) {
                    fields.put(child.getKey(), child.getValue().toObservedType());
                }
                yield new ObservedType.StructType(fields);
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MergedNode other)) {
            return false;
        }
        return kind == other.kind
                && Objects.equals(children, other.children)
                && Objects.equals(element, other.element);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, children, element);
    }

    @Override
    public String toString() {
        return toObservedType().toString();
    }
}
