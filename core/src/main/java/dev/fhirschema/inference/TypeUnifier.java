/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fhirschema.inference;

import java.util.Map;

import dev.fhirschema.inference.MergedNode.Kind;

/**
 * Computes the single type able to represent two observations of the same field.
 * <p>
 * Rules, applied in order until one matches:
 * </p>
 * <ol>
 *   <li>NULL merged with anything yields the other side.</li>
 *   <li>An empty list merged with a non-list yields the non-list.</li>
 *   <li>Equal variants merge structurally: struct fields are united and shared fields
 *       merged recursively, list elements are merged, equal scalars stay as they are.</li>
 *   <li>INTEGER merged with FLOAT yields FLOAT.</li>
 *   <li>Everything else (mismatched scalars, scalar versus struct, struct or scalar versus a
 *       non-empty list) falls back to STRING, dropping any nested fields.</li>
 * </ol>
 * <p>
 * The merge is total, associative, commutative and idempotent, so records may be folded in any
 * order and partial results combined afterwards. Only struct field order depends on the order of
 * operands: fields of the left side come first, followed by fields first seen on the right.
 * </p>
 */
public final class TypeUnifier {

    private TypeUnifier() {
    }

    /**
     * Merges two observed types without modifying either.
     */
    public static ObservedType merge(ObservedType a, ObservedType b) {
        if (a.equals(b)) {
            return a;
        }
        MergedNode target = MergedNode.from(a);
        mergeInto(target, MergedNode.from(b));
        return target.toObservedType();
    }

    /**
     * Merges two nodes into a new node, leaving both inputs untouched.
     */
    public static MergedNode merge(MergedNode a, MergedNode b) {
        MergedNode target = a.copy();
        mergeInto(target, b);
        return target;
    }

    /**
     * Merges all given types, starting from NULL.
     */
    public static ObservedType mergeAll(Iterable<? extends ObservedType> types) {
        MergedNode target = MergedNode.nullNode();
        for (ObservedType type : types) {
            mergeInto(target, MergedNode.from(type));
        }
        return target.toObservedType();
    }

    /**
     * Merges an observed type into {@code target} in place.
     */
    public static void mergeInto(MergedNode target, ObservedType source) {
        mergeInto(target, MergedNode.from(source));
    }

    /**
     * Merges {@code source} into {@code target} in place. {@code source} is never modified,
     * and no node of it becomes part of {@code target}.
     */
    public static void mergeInto(MergedNode target, MergedNode source) {
        Kind sourceKind = source.kind();
        Kind targetKind = target.kind();

        if (sourceKind == Kind.NULL) {
            return;
        }
        if (targetKind == Kind.NULL) {
            target.becomeCopyOf(source);
            return;
        }

        // An empty array carries no type evidence for anything but lists
        if (source.isEmptyList() && targetKind != Kind.LIST) {
            return;
        }
        if (target.isEmptyList() && sourceKind != Kind.LIST) {
            target.becomeCopyOf(source);
            return;
        }

        if (targetKind == sourceKind) {
            if (targetKind == Kind.STRUCT) {
                mergeChildren(target, source);
            }
            else if (targetKind == Kind.LIST) {
                mergeInto(target.element(), source.element());
            }
            return;
        }

        if (targetKind.isNumeric() && sourceKind.isNumeric()) {
            target.becomeScalar(Kind.FLOAT);
            return;
        }

        target.becomeScalar(Kind.STRING);
    }

    private static void mergeChildren(MergedNode target, MergedNode source) {
        for (Map.Entry<String, MergedNode> child : source.children().entrySet()) {
            MergedNode existing = target.child(child.getKey());
            if (existing == null) {
                target.putChild(child.getKey(), child.getValue().copy());
            }
            else {
                mergeInto(existing, child.getValue());
            }
        }
    }
}
