/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fhirschema.inference;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

import dev.fhirschema.schema.FieldPath;
import dev.fhirschema.schema.FieldPath.PathStep;
import dev.fhirschema.schema.PathBuilder;

/**
 * Flattens one record into the set of (field path, observed type) pairs it contains.
 * <p>
 * Observed types are shallow: an object is observed as an empty struct and each of its fields
 * as an observation of its own, an array as a list of the merged shallow types of its elements.
 * Array elements never add index steps to a path; objects reached through arrays are recorded
 * with the number of array levels on the step of the array field.
 * </p>
 * <p>
 * Example: {@code {"name": [{"given": ["Jane"]}]}} yields
 * {@code name: list<struct<>>} and {@code name[].given: list<string>}.
 * </p>
 */
public final class PathWalker {

    private PathWalker() {
    }

    /**
     * Returns one observation per distinct path in {@code record}, in order of first sighting.
     * Paths seen several times (e.g. in multiple array elements) carry the merged type.
     *
     * @throws InvalidRecordException if {@code record} is not a JSON object
     */
    public static List<Observation> walk(JsonNode record) {
        if (record == null) {
            throw new InvalidRecordException("Record must not be null");
        }
        if (!record.isObject()) {
            throw new InvalidRecordException("Record must be a JSON object, but was " + record.getNodeType());
        }

        Map<FieldPath, ObservedType> observed = new LinkedHashMap<>();
        walkObject(record, new PathBuilder(), observed);

        List<Observation> observations = new ArrayList<>(observed.size());
        for (Map.Entry<FieldPath, ObservedType> entry : observed.entrySet()) {
            observations.add(new Observation(entry.getKey(), entry.getValue()));
        }
        return observations;
    }

    /**
     * Classifies a single value by its JSON kind. Objects are reported without their fields.
     */
    public static ObservedType shallowType(JsonNode value) {
        return switch (value.getNodeType()) {
            case OBJECT -> ObservedType.StructType.EMPTY;
            case ARRAY -> {
                List<ObservedType> elementTypes = new ArrayList<>(value.size());
                for (JsonNode element : value) {
                    elementTypes.add(shallowType(element));
                }
                yield new ObservedType.ListType(TypeUnifier.mergeAll(elementTypes));
            }
            case BOOLEAN -> ObservedType.BOOLEAN;
            case NUMBER -> value.isIntegralNumber() ? ObservedType.INTEGER : ObservedType.FLOAT;
            case STRING, BINARY, POJO -> ObservedType.STRING;
            case NULL, MISSING -> ObservedType.NULL;
        };
    }

    private static void walkObject(JsonNode object, PathBuilder path, Map<FieldPath, ObservedType> observed) {
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            JsonNode value = field.getValue();

            observe(observed, path.materialize(PathStep.of(name)), shallowType(value));

            if (value.isObject()) {
                path.push(PathStep.of(name));
                walkObject(value, path, observed);
                path.pop();
            }
            else if (value.isArray()) {
                walkElements(name, value, 1, path, observed);
            }
        }
    }

    private static void walkElements(String name, JsonNode array, int listDepth, PathBuilder path,
                                     Map<FieldPath, ObservedType> observed) {
        for (JsonNode element : array) {
            if (element.isObject()) {
                path.push(PathStep.inList(name, listDepth));
                walkObject(element, path, observed);
                path.pop();
            }
            else if (element.isArray()) {
                walkElements(name, element, listDepth + 1, path, observed);
            }
        }
    }

    private static void observe(Map<FieldPath, ObservedType> observed, FieldPath path, ObservedType type) {
        observed.merge(path, type, TypeUnifier::merge);
    }
}
