/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fhirschema.reader;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Stream;

import com.fasterxml.jackson.databind.JsonNode;

import dev.fhirschema.inference.ReferenceDefaults;
import dev.fhirschema.inference.SchemaBuilder;
import dev.fhirschema.inference.SchemaTree;
import dev.fhirschema.schema.InferredSchema;

/**
 * Entry point for inferring schemas with a shared thread pool.
 *
 * <pre>{@code
 * try (FhirSchema fhirSchema = FhirSchema.create()) {
 *     InferredSchema patients = fhirSchema.infer("Patient", records);
 *     Map<String, InferredSchema> all = fhirSchema.inferAllFromFiles(exportDir);
 * }
 * }</pre>
 *
 * <p>
 * Records are folded in batches into independent partial trees on the pool, and the partial
 * trees are merged in batch order on the calling thread. The result is identical to a sequential
 * fold, including the order of fields.
 * </p>
 */
public class FhirSchema implements AutoCloseable {

    private static final System.Logger LOG = System.getLogger(FhirSchema.class.getName());

    private final InferenceContext context;
    private final ReferenceDefaults referenceDefaults;

    private FhirSchema(InferenceContext context, ReferenceDefaults referenceDefaults) {
        this.context = context;
        this.referenceDefaults = referenceDefaults;
    }

    /**
     * Create a new instance with a thread pool sized to available processors and the bundled
     * FHIR R4 reference fields.
     */
    public static FhirSchema create() {
        return new FhirSchema(InferenceContext.create(), ReferenceDefaults.bundled());
    }

    /**
     * Create a new instance with a thread pool of the specified size and the bundled FHIR R4
     * reference fields.
     */
    public static FhirSchema create(int threads) {
        return new FhirSchema(InferenceContext.create(threads), ReferenceDefaults.bundled());
    }

    /**
     * Create a new instance with a thread pool of the specified size and the given reference fields.
     */
    public static FhirSchema create(int threads, ReferenceDefaults referenceDefaults) {
        return new FhirSchema(InferenceContext.create(threads), referenceDefaults);
    }

    /**
     * Create a new instance on an existing context. The context is closed with this instance.
     */
    public static FhirSchema create(InferenceContext context, ReferenceDefaults referenceDefaults) {
        return new FhirSchema(context, referenceDefaults);
    }

    public ReferenceDefaults referenceDefaults() {
        return referenceDefaults;
    }

    /**
     * Infers the schema of {@code records} in parallel.
     *
     * @throws dev.fhirschema.inference.InvalidRecordException if any record is not a JSON object
     */
    public InferredSchema infer(String kind, Iterable<? extends JsonNode> records) {
        return fold(kind, records.iterator()).finish(referenceDefaults);
    }

    /**
     * Infers the schema of the records of a stream in parallel. The stream is not closed.
     */
    public InferredSchema infer(String kind, Stream<? extends JsonNode> records) {
        return fold(kind, records.iterator()).finish(referenceDefaults);
    }

    /**
     * Infers the schema of {@code records} on the calling thread.
     */
    public InferredSchema inferSequential(String kind, Iterable<? extends JsonNode> records) {
        return SchemaBuilder.build(kind, records, referenceDefaults);
    }

    /**
     * Infers the schema of all {@code kind} records in the multi-line JSON files of {@code dir}.
     * Values that are not JSON objects, or that declare another resource type, are skipped.
     */
    public InferredSchema inferFromFiles(Path dir, String kind) {
        try (Stream<JsonNode> records = MultilineJsonFiles.readAll(dir, Set.of(kind))) {
            return infer(kind, records.filter(record -> isRecordOf(record, kind)));
        }
    }

    /**
     * Infers one schema per resource type found in the multi-line JSON files of {@code dir}.
     *
     * @return schemas keyed by resource type, in alphabetical order
     */
    public Map<String, InferredSchema> inferAllFromFiles(Path dir) {
        Set<String> kinds = new TreeSet<>();
        for (String kind : MultilineJsonFiles.list(dir, Set.of()).values()) {
            if (kind != null) {
                kinds.add(kind);
            }
        }

        Map<String, InferredSchema> schemas = new TreeMap<>();
        for (String kind : kinds) {
            schemas.put(kind, inferFromFiles(dir, kind));
        }
        return schemas;
    }

    /**
     * Folds {@code records} into a new, unfinished tree using the context's pool.
     */
    public SchemaTree fold(String kind, Iterator<? extends JsonNode> records) {
        SchemaTree result = SchemaTree.create(kind);
        Deque<CompletableFuture<SchemaTree>> inFlight = new ArrayDeque<>();
        int maxInFlight = context.threads() * 2;
        int batches = 0;

        try {
            while (records.hasNext()) {
                List<JsonNode> batch = new ArrayList<>(context.batchSize());
                while (batch.size() < context.batchSize() && records.hasNext()) {
                    batch.add(records.next());
                }
                inFlight.addLast(CompletableFuture.supplyAsync(() -> SchemaBuilder.fold(kind, batch), context.executor()));
                batches++;

                // Merging the oldest batch first keeps first-sighting order identical to a sequential fold
                if (inFlight.size() >= maxInFlight) {
                    result.merge(await(inFlight.removeFirst()));
                }
            }
            while (!inFlight.isEmpty()) {
                result.merge(await(inFlight.removeFirst()));
            }
        }
        catch (RuntimeException e) {
            for (CompletableFuture<SchemaTree> pending : inFlight) {
                pending.cancel(true);
            }
            throw e;
        }

        LOG.log(System.Logger.Level.DEBUG, "Folded {0} records of ''{1}'' in {2} batches",
                result.recordCount(), kind, batches);
        return result;
    }

    private static SchemaTree await(CompletableFuture<SchemaTree> future) {
        try {
            return future.join();
        }
        catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private static boolean isRecordOf(JsonNode record, String kind) {
        if (!record.isObject()) {
            LOG.log(System.Logger.Level.WARNING, "Skipping non-object value while reading ''{0}'' records", kind);
            return false;
        }
        JsonNode resourceType = record.get("resourceType");
        if (resourceType == null || !resourceType.isTextual() || kind.equals(resourceType.asText())) {
            return true;
        }
        LOG.log(System.Logger.Level.WARNING, "Skipping ''{0}'' record while reading ''{1}'' records",
                resourceType.asText(), kind);
        return false;
    }

    /**
     * Get the context used by this instance.
     */
    public InferenceContext context() {
        return context;
    }

    @Override
    public void close() {
        context.close();
    }
}
