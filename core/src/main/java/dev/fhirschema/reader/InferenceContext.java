/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fhirschema.reader;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Context object that manages shared resources for schema inference.
 * <p>
 * Holds the thread pool partial schema trees are folded on, plus the batch size
 * records are grouped into per task. The batch size can be overridden with the
 * {@value #BATCH_SIZE_PROPERTY} system property.
 * </p>
 */
public final class InferenceContext implements AutoCloseable {

    public static final String BATCH_SIZE_PROPERTY = "fhirschema.batch.size";

    public static final int DEFAULT_BATCH_SIZE = 1024;

    private static final System.Logger LOG = System.getLogger(InferenceContext.class.getName());

    private final ExecutorService executor;
    private final int threads;
    private final int batchSize;

    private InferenceContext(ExecutorService executor, int threads, int batchSize) {
        this.executor = executor;
        this.threads = threads;
        this.batchSize = batchSize;
    }

    /**
     * Create a new context with a thread pool sized to available processors.
     */
    public static InferenceContext create() {
        return create(Runtime.getRuntime().availableProcessors());
    }

    /**
     * Create a new context with a thread pool of the specified size.
     */
    public static InferenceContext create(int threads) {
        return create(threads, batchSizeFromSystemProperty());
    }

    /**
     * Create a new context with a thread pool of the specified size and an explicit batch size.
     */
    public static InferenceContext create(int threads, int batchSize) {
        if (threads < 1) {
            throw new IllegalArgumentException("Thread count must be positive: " + threads);
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        AtomicInteger threadCounter = new AtomicInteger(0);
        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, "fhirschema-" + threadCounter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
        ExecutorService executor = Executors.newFixedThreadPool(threads, threadFactory);
        LOG.log(System.Logger.Level.DEBUG, "Created inference context with {0} threads and batch size {1}",
                threads, batchSize);
        return new InferenceContext(executor, threads, batchSize);
    }

    private static int batchSizeFromSystemProperty() {
        String value = System.getProperty(BATCH_SIZE_PROPERTY);
        if (value == null || value.isBlank()) {
            return DEFAULT_BATCH_SIZE;
        }
        try {
            return Integer.parseInt(value.trim());
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + BATCH_SIZE_PROPERTY + ": " + value, e);
        }
    }

    /**
     * Get the executor service for parallel operations.
     */
    public ExecutorService executor() {
        return executor;
    }

    public int threads() {
        return threads;
    }

    /**
     * Number of records folded by one task.
     */
    public int batchSize() {
        return batchSize;
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            executor.awaitTermination(5, TimeUnit.SECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
