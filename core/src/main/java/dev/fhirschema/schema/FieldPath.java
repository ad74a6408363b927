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
 * Path from the root of a record to one of its fields.
 * <p>
 * Array elements do not add index steps: all elements of an array share the path of the
 * array itself, and a step records through how many array levels the next step is reached.
 * </p>
 *
 * @param steps Path steps from the root to the field, never empty
 */
public record FieldPath(List<PathStep> steps) {

    public FieldPath {
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("Field path must have at least one step");
        }
        steps = List.copyOf(steps);
    }

    /**
     * A single step in the path from the root to a field.
     *
     * @param name      Field name
     * @param listDepth Number of array levels between the value of this field and the object
     *                  the following step descends into; 0 if the value is an object itself
     */
    public record PathStep(String name, int listDepth) {

        public PathStep {
            if (name == null) {
                throw new IllegalArgumentException("Step name must not be null");
            }
            if (listDepth < 0) {
                throw new IllegalArgumentException("List depth cannot be negative: " + listDepth);
            }
        }

        public static PathStep of(String name) {
            return new PathStep(name, 0);
        }

        public static PathStep inList(String name, int listDepth) {
            return new PathStep(name, listDepth);
        }

        /**
         * Returns true if this step reaches its value through at least one array.
         */
        public boolean isList() {
            return listDepth > 0;
        }

        @Override
        public String toString() {
            return name + "[]".repeat(listDepth);
        }
    }

    /**
     * Creates a path of plain (non-list) steps.
     */
    public static FieldPath of(String... names) {
        List<PathStep> steps = new ArrayList<>(names.length);
        for (String name : names) {
            steps.add(PathStep.of(name));
        }
        return new FieldPath(steps);
    }

    /**
     * Parses the dotted form produced by {@link #toString()}, e.g. {@code extension[].url}.
     */
    public static FieldPath parse(String dotted) {
        List<PathStep> steps = new ArrayList<>();
        for (String part : dotted.split("\\.", -1)) {
            int depth = 0;
            String name = part;
            while (name.endsWith("[]")) {
                name = name.substring(0, name.length() - 2);
                depth++;
            }
            if (name.isEmpty()) {
                throw new IllegalArgumentException("Empty step in field path: " + dotted);
            }
            steps.add(new PathStep(name, depth));
        }
        return new FieldPath(steps);
    }

    public int depth() {
        return steps.size();
    }

    public PathStep leaf() {
        return steps.get(steps.size() - 1);
    }

    public String leafName() {
        return leaf().name();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < steps.size(); i++) {
            if (i > 0) {
                sb.append('.');
            }
            sb.append(steps.get(i));
        }
        return sb.toString();
    }
}
