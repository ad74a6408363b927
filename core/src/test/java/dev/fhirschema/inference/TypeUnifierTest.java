/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fhirschema.inference;

import java.util.List;

import org.junit.jupiter.api.Test;

import static dev.fhirschema.inference.ObservedType.BOOLEAN;
import static dev.fhirschema.inference.ObservedType.FLOAT;
import static dev.fhirschema.inference.ObservedType.INTEGER;
import static dev.fhirschema.inference.ObservedType.NULL;
import static dev.fhirschema.inference.ObservedType.STRING;
import static dev.fhirschema.inference.ObservedType.listOf;
import static dev.fhirschema.inference.ObservedType.structOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TypeUnifierTest {

    private static final List<ObservedType> POOL = List.of(
            NULL,
            BOOLEAN,
            INTEGER,
            FLOAT,
            STRING,
            listOf(NULL),
            listOf(INTEGER),
            listOf(FLOAT),
            listOf(listOf(NULL)),
            listOf(structOf("a", INTEGER)),
            ObservedType.StructType.EMPTY,
            structOf("a", INTEGER),
            structOf("b", STRING, "a", FLOAT),
            structOf("a", listOf(NULL), "c", BOOLEAN));

    @Test
    void testNullIsIdentity() {
        for (ObservedType type : POOL) {
            assertThat(TypeUnifier.merge(NULL, type)).isEqualTo(type);
            assertThat(TypeUnifier.merge(type, NULL)).isEqualTo(type);
        }
    }

    @Test
    void testEqualScalarsStay() {
        assertThat(TypeUnifier.merge(BOOLEAN, BOOLEAN)).isEqualTo(BOOLEAN);
        assertThat(TypeUnifier.merge(INTEGER, INTEGER)).isEqualTo(INTEGER);
        assertThat(TypeUnifier.merge(STRING, STRING)).isEqualTo(STRING);
    }

    @Test
    void testIntegerAndFloatWidenToFloat() {
        assertThat(TypeUnifier.merge(INTEGER, FLOAT)).isEqualTo(FLOAT);
        assertThat(TypeUnifier.merge(FLOAT, INTEGER)).isEqualTo(FLOAT);
        assertThat(TypeUnifier.merge(listOf(INTEGER), listOf(FLOAT))).isEqualTo(listOf(FLOAT));
    }

    @Test
    void testIncompatibleTypesFallBackToString() {
        assertThat(TypeUnifier.merge(BOOLEAN, INTEGER)).isEqualTo(STRING);
        assertThat(TypeUnifier.merge(STRING, FLOAT)).isEqualTo(STRING);
        assertThat(TypeUnifier.merge(structOf("a", INTEGER), STRING)).isEqualTo(STRING);
        assertThat(TypeUnifier.merge(listOf(INTEGER), structOf("a", INTEGER))).isEqualTo(STRING);
        assertThat(TypeUnifier.merge(listOf(STRING), BOOLEAN)).isEqualTo(STRING);
    }

    @Test
    void testEmptyListYieldsToNonListTypes() {
        assertThat(TypeUnifier.merge(listOf(NULL), INTEGER)).isEqualTo(INTEGER);
        assertThat(TypeUnifier.merge(structOf("a", INTEGER), listOf(NULL))).isEqualTo(structOf("a", INTEGER));
        assertThat(TypeUnifier.merge(listOf(NULL), listOf(STRING))).isEqualTo(listOf(STRING));
        assertThat(TypeUnifier.merge(listOf(NULL), listOf(NULL))).isEqualTo(listOf(NULL));
    }

    @Test
    void testStructFieldsAreUnited() {
        ObservedType merged = TypeUnifier.merge(
                structOf("a", INTEGER, "b", STRING),
                structOf("b", STRING, "c", listOf(BOOLEAN), "a", FLOAT));

        assertThat(merged).isEqualTo(structOf("a", FLOAT, "b", STRING, "c", listOf(BOOLEAN)));
        // First sighting order, left operand first
        assertThat(((ObservedType.StructType) merged).fields().keySet()).containsExactly("a", "b", "c");
    }

    @Test
    void testStructEqualityIgnoresFieldOrder() {
        assertThat(structOf("a", INTEGER, "b", STRING)).isEqualTo(structOf("b", STRING, "a", INTEGER));
        assertThat(MergedNode.from(structOf("a", INTEGER, "b", STRING)))
                .isEqualTo(MergedNode.from(structOf("b", STRING, "a", INTEGER)));
    }

    @Test
    void testMergeIsCommutative() {
        for (ObservedType a : POOL) {
            for (ObservedType b : POOL) {
                assertThat(TypeUnifier.merge(a, b))
                        .as("%s + %s", a, b)
                        .isEqualTo(TypeUnifier.merge(b, a));
            }
        }
    }

    @Test
    void testMergeIsAssociative() {
        for (ObservedType a : POOL) {
            for (ObservedType b : POOL) {
                for (ObservedType c : POOL) {
                    assertThat(TypeUnifier.merge(TypeUnifier.merge(a, b), c))
                            .as("(%s + %s) + %s", a, b, c)
                            .isEqualTo(TypeUnifier.merge(a, TypeUnifier.merge(b, c)));
                }
            }
        }
    }

    @Test
    void testMergeIsIdempotent() {
        for (ObservedType a : POOL) {
            assertThat(TypeUnifier.merge(a, a)).isEqualTo(a);
            for (ObservedType b : POOL) {
                ObservedType merged = TypeUnifier.merge(a, b);
                assertThat(TypeUnifier.merge(merged, b)).as("(%s + %s) + %s", a, b, b).isEqualTo(merged);
            }
        }
    }

    @Test
    void testTypeClassification() {
        assertThat(NULL.isScalar()).isTrue();
        assertThat(STRING.isScalar()).isTrue();
        assertThat(listOf(INTEGER).isScalar()).isFalse();
        assertThat(ObservedType.StructType.EMPTY.isScalar()).isFalse();
        assertThat(listOf(NULL).isEmpty()).isTrue();
        assertThat(listOf(listOf(NULL)).isEmpty()).isFalse();

        assertThat(MergedNode.scalar(MergedNode.Kind.FLOAT).toObservedType()).isEqualTo(FLOAT);
        assertThat(MergedNode.list(MergedNode.nullNode()).isEmptyList()).isTrue();
        assertThatThrownBy(() -> MergedNode.scalar(MergedNode.Kind.STRUCT))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testMergeAll() {
        assertThat(TypeUnifier.mergeAll(List.of())).isEqualTo(NULL);
        assertThat(TypeUnifier.mergeAll(List.of(INTEGER, NULL, FLOAT, INTEGER))).isEqualTo(FLOAT);
        assertThat(TypeUnifier.mergeAll(List.of(INTEGER, BOOLEAN, FLOAT))).isEqualTo(STRING);
    }

    @Test
    void testMergeNodesLeavesInputsUntouched() {
        MergedNode left = MergedNode.from(structOf("a", INTEGER));
        MergedNode right = MergedNode.from(structOf("a", FLOAT, "b", listOf(STRING)));

        MergedNode merged = TypeUnifier.merge(left, right);

        assertThat(merged.toObservedType()).isEqualTo(structOf("a", FLOAT, "b", listOf(STRING)));
        assertThat(left.toObservedType()).isEqualTo(structOf("a", INTEGER));
        assertThat(right.toObservedType()).isEqualTo(structOf("a", FLOAT, "b", listOf(STRING)));

        // The merged tree does not share nodes with the source
        TypeUnifier.mergeInto(merged.child("b"), BOOLEAN);
        assertThat(right.child("b").kind()).isEqualTo(MergedNode.Kind.LIST);
    }

    @Test
    void testScalarFallbackDropsChildren() {
        MergedNode node = MergedNode.from(structOf("a", INTEGER, "b", structOf("c", STRING)));
        TypeUnifier.mergeInto(node, STRING);

        assertThat(node.kind()).isEqualTo(MergedNode.Kind.STRING);
        assertThat(node.children()).isEmpty();
        assertThat(node.element()).isNull();
    }
}
