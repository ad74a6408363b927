/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fhirschema.inference;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

import dev.fhirschema.inference.MergedNode.Kind;
import dev.fhirschema.internal.render.SchemaRenderer;
import dev.fhirschema.schema.FieldPath.PathStep;
import dev.fhirschema.schema.InferredSchema;

/**
 * Mutable path-to-type tree accumulating the observations of one record kind.
 * <p>
 * A tree is created empty, receives any number of records, observations or other trees, and is
 * finished exactly once into an {@link InferredSchema}. Instances are not thread-safe; parallel
 * folds build one tree per worker and merge the trees afterwards.
 * </p>
 */
public final class SchemaTree {

    private static final System.Logger LOG = System.getLogger(SchemaTree.class.getName());

    private final String kind;
    private final MergedNode root;
    private long recordCount;
    private boolean finished;

    private SchemaTree(String kind, MergedNode root, long recordCount) {
        this.kind = kind;
        this.root = root;
        this.recordCount = recordCount;
    }

    public static SchemaTree create(String kind) {
        if (kind == null || kind.isEmpty()) {
            throw new IllegalArgumentException("Record kind must not be empty");
        }
        return new SchemaTree(kind, MergedNode.struct(), 0);
    }

    public String kind() {
        return kind;
    }

    /**
     * Returns the root STRUCT node. Callers must not modify it.
     */
    public MergedNode root() {
        return root;
    }

    /**
     * Returns the number of records folded into this tree, including merged trees.
     */
    public long recordCount() {
        return recordCount;
    }

    public boolean isFinished() {
        return finished;
    }

    /**
     * Walks {@code record} and merges all of its observations.
     *
     * @throws InvalidRecordException if {@code record} is not a JSON object
     */
    public void add(JsonNode record) {
        checkOpen();
        for (Observation observation : PathWalker.walk(record)) {
            merge(observation);
        }
        recordCount++;
    }

    /**
     * Merges one observation at its path, creating intermediate struct nodes as needed.
     * <p>
     * If a node on the way has already collapsed to a scalar, the observation is absorbed by it,
     * exactly as if the nested value had been merged into that scalar.
     * </p>
     */
    public void merge(Observation observation) {
        checkOpen();
        List<PathStep> steps = observation.path().steps();

        MergedNode parent = root;
        for (int i = 0; i < steps.size() - 1; i++) {
            PathStep step = steps.get(i);
            MergedNode child = parent.childOrCreate(step.name());
            TypeUnifier.mergeInto(child, containerShape(step.listDepth()));

            MergedNode container = child;
            for (int level = 0; level < step.listDepth() && container.kind() == Kind.LIST; level++) {
                container = container.element();
            }
            if (container.kind() != Kind.STRUCT) {
                return;
            }
            parent = container;
        }

        MergedNode leaf = parent.childOrCreate(observation.path().leafName());
        TypeUnifier.mergeInto(leaf, observation.type());
    }

    /**
     * Merges a partial tree of the same record kind into this one.
     */
    public void merge(SchemaTree other) {
        checkOpen();
        if (!kind.equals(other.kind)) {
            throw new IllegalArgumentException("Cannot merge schema tree of '" + other.kind + "' into '" + kind + "'");
        }
        TypeUnifier.mergeInto(root, other.root);
        recordCount += other.recordCount;
    }

    /**
     * Returns an independent, unfinished copy of this tree.
     */
    public SchemaTree copy() {
        return new SchemaTree(kind, root.copy(), recordCount);
    }

    /**
     * Widens the root with the reference fields of this tree's kind and renders the schema.
     * The tree cannot be modified afterwards.
     */
    public InferredSchema finish(ReferenceDefaults defaults) {
        checkOpen();
        finished = true;

        int observedFields = root.children().size();
        List<String> referenceFields = defaults.fieldsFor(kind).orElse(List.of());
        if (referenceFields.isEmpty()) {
            LOG.log(System.Logger.Level.DEBUG, "No reference fields for ''{0}'', schema covers observed fields only", kind);
        }
        for (String field : referenceFields) {
            if (root.child(field) == null) {
                root.putChild(field, MergedNode.nullNode());
            }
        }

        LOG.log(System.Logger.Level.DEBUG, "Finished schema for ''{0}'' from {1} records: {2} observed and {3} widened top-level fields",
                kind, recordCount, observedFields, root.children().size() - observedFields);

        return SchemaRenderer.render(kind, root);
    }

    private void checkOpen() {
        if (finished) {
            throw new IllegalStateException("Schema tree for '" + kind + "' is already finished");
        }
    }

    /**
     * Shape of the node an intermediate step passes through: a struct, wrapped in one list per
     * array level.
     */
    private static MergedNode containerShape(int listDepth) {
        MergedNode shape = MergedNode.struct();
        for (int i = 0; i < listDepth; i++) {
            shape = MergedNode.list(shape);
        }
        return shape;
    }

    @Override
    public String toString() {
        return "SchemaTree[" + kind + ", records=" + recordCount + ", root=" + root + "]";
    }
}
