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
import java.util.StringJoiner;

/**
 * Type deduced from one concrete value, or the union of several such types.
 * <p>
 * The variant set is closed: every value of a JSON record maps to exactly one of these.
 * Struct fields keep the order in which they were first seen; equality ignores that order.
 * </p>
 */
public sealed interface ObservedType
permits ObservedType.NullType, ObservedType.BooleanType, ObservedType.IntegerType, ObservedType.FloatType,
        ObservedType.StringType, ObservedType.ListType, ObservedType.StructType
{

    NullType NULL = new NullType();

    BooleanType BOOLEAN = new BooleanType();

    IntegerType INTEGER = new IntegerType();

    FloatType FLOAT = new FloatType();

    StringType STRING = new StringType();

    record NullType() implements ObservedType {
        @Override
        public String toString() {
            return "null";
        }
    }

    record BooleanType() implements ObservedType {
        @Override
        public String toString() {
            return "boolean";
        }
    }

    record IntegerType() implements ObservedType {
        @Override
        public String toString() {
            return "integer";
        }
    }

    record FloatType() implements ObservedType {
        @Override
        public String toString() {
            return "float";
        }
    }

    record StringType() implements ObservedType {
        @Override
        public String toString() {
            return "string";
        }
    }

    record ListType(ObservedType element) implements ObservedType {
        public ListType {
            if (element == null) {
                throw new IllegalArgumentException("List element type must not be null");
            }
        }

        /**
         * Returns true for the type of an empty array, whose element type is unknown.
         */
        public boolean isEmpty() {
            return element instanceof NullType;
        }

        @Override
        public String toString() {
            return "list<" + element + ">";
        }
    }

    record StructType(Map<String, ObservedType> fields) implements ObservedType {

        public static final StructType EMPTY = new StructType(Map.of());

        public StructType {
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        @Override
        public String toString() {
            StringJoiner joiner = new StringJoiner(", ", "struct<", ">");
            for (Map.Entry<String, ObservedType> field : fields.entrySet()) {
                joiner.add(field.getKey() + ": " + field.getValue());
            }
            return joiner.toString();
        }
    }

    static ListType listOf(ObservedType element) {
        return new ListType(element);
    }

    /**
     * Creates a struct type from alternating field names and types, in that order.
     */
    static StructType structOf(Object... namesAndTypes) {
        if (namesAndTypes.length % 2 != 0) {
            throw new IllegalArgumentException("Expected pairs of field name and type");
        }
        Map<String, ObservedType> fields = new LinkedHashMap<>();
        for (int i = 0; i < namesAndTypes.length; i += 2) {
            fields.put((String) namesAndTypes[i], (ObservedType) namesAndTypes[i + 1]);
        }
        return new StructType(fields);
    }

    /**
     * Returns true for the leaf variants (null, boolean, integer, float, string).
     */
    default boolean isScalar() {
        return !(this instanceof ListType) && !(this instanceof StructType);
    }
}
