/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fhirschema.parquet;

import java.util.ArrayList;
import java.util.List;

import org.apache.parquet.schema.GroupType;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.Type;
import org.apache.parquet.schema.Types;

import dev.fhirschema.metadata.ConvertedType;
import dev.fhirschema.metadata.LogicalType;
import dev.fhirschema.metadata.PhysicalType;
import dev.fhirschema.metadata.RepetitionType;
import dev.fhirschema.schema.InferredSchema;
import dev.fhirschema.schema.SchemaNode;

/**
 * Converts inferred schemas to parquet-java schema types, e.g. for writing records with
 * parquet-java or parquet-avro.
 */
public final class ParquetSchemaConverter {

    private ParquetSchemaConverter() {
    }

    /**
     * Convert an inferred schema to a parquet-java MessageType.
     *
     * @param schema the inferred schema
     * @return the MessageType, named after the record kind
     */
    public static MessageType toMessageType(InferredSchema schema) {
        SchemaNode.GroupNode root = schema.getRootNode();
        List<Type> fields = new ArrayList<>();
        for (SchemaNode child : root.children()) {
            fields.add(toType(child));
        }
        return new MessageType(schema.getName(), fields);
    }

    static Type toType(SchemaNode node) {
        Type.Repetition repetition = toRepetition(node.repetitionType());

        if (node instanceof SchemaNode.PrimitiveNode primitive) {
            Types.PrimitiveBuilder<PrimitiveType> builder = Types.primitive(toPrimitiveTypeName(primitive.type()), repetition);
            if (primitive.logicalType() != null) {
                builder = builder.as(toLogicalTypeAnnotation(primitive.logicalType()));
            }
            return builder.named(primitive.name());
        }
        else if (node instanceof SchemaNode.GroupNode group) {
            Types.GroupBuilder<GroupType> builder = Types.buildGroup(repetition);
            if (group.convertedType() != null) {
                builder = builder.as(toLogicalTypeAnnotation(group.convertedType()));
            }
            for (SchemaNode child : group.children()) {
                builder = builder.addField(toType(child));
            }
            return builder.named(group.name());
        }
        throw new IllegalArgumentException("Unknown schema node type: " + node.getClass());
    }

    private static Type.Repetition toRepetition(RepetitionType repetition) {
        return switch (repetition) {
            case REQUIRED -> Type.Repetition.REQUIRED;
            case OPTIONAL -> Type.Repetition.OPTIONAL;
            case REPEATED -> Type.Repetition.REPEATED;
        };
    }

    private static PrimitiveType.PrimitiveTypeName toPrimitiveTypeName(PhysicalType type) {
        return switch (type) {
            case BOOLEAN -> PrimitiveType.PrimitiveTypeName.BOOLEAN;
            case INT64 -> PrimitiveType.PrimitiveTypeName.INT64;
            case DOUBLE -> PrimitiveType.PrimitiveTypeName.DOUBLE;
            case BYTE_ARRAY -> PrimitiveType.PrimitiveTypeName.BINARY;
        };
    }

    private static LogicalTypeAnnotation toLogicalTypeAnnotation(ConvertedType convertedType) {
        return switch (convertedType) {
            case LIST -> LogicalTypeAnnotation.listType();
        };
    }

    private static LogicalTypeAnnotation toLogicalTypeAnnotation(LogicalType logicalType) {
        if (logicalType instanceof LogicalType.StringType) {
            return LogicalTypeAnnotation.stringType();
        }
        throw new IllegalArgumentException("Unsupported logical type: " + logicalType);
    }
}
