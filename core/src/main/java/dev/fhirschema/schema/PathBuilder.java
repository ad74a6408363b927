/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fhirschema.schema;

import java.util.ArrayList;
import java.util.List;

/**
 * Stack of path steps used while descending into a nested value.
 */
public final class PathBuilder {

    private final List<FieldPath.PathStep> steps = new ArrayList<>();

    public void push(FieldPath.PathStep step) {
        steps.add(step);
    }

    public void pop() {
        steps.remove(steps.size() - 1);
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    /**
     * Returns the current path including the given leaf, without modifying the stack.
     */
    public FieldPath materialize(FieldPath.PathStep leaf) {
        List<FieldPath.PathStep> path = new ArrayList<>(steps.size() + 1);
        path.addAll(steps);
        path.add(leaf);
        return new FieldPath(path);
    }
}
