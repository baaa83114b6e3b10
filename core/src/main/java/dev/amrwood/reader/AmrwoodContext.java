/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.reader;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Context object that manages the thread pool used to decode shards in parallel.
 * <p>
 * The context lifecycle is tied to the {@link Amrwood} instance that created it.
 * </p>
 */
public final class AmrwoodContext implements AutoCloseable {

    static final String THREADS_PROPERTY = "amrwood.threads";

    private static final System.Logger LOG = System.getLogger(AmrwoodContext.class.getName());

    private final ExecutorService executor;
    private final int threads;

    private AmrwoodContext(ExecutorService executor, int threads) {
        this.executor = executor;
        this.threads = threads;
    }

    /**
     * Create a new context with a thread pool sized by the {@code amrwood.threads}
     * system property, or to the available processors if it is not set.
     */
    public static AmrwoodContext create() {
        return create(defaultThreads());
    }

    /**
     * Create a new context with a thread pool of the specified size.
     */
    public static AmrwoodContext create(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("Thread count must be positive: " + threads);
        }
        AtomicInteger threadCounter = new AtomicInteger(0);
        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, "amrwood-" + threadCounter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
        ExecutorService executor = Executors.newFixedThreadPool(threads, threadFactory);
        LOG.log(System.Logger.Level.DEBUG, "Created context with {0} threads", threads);
        return new AmrwoodContext(executor, threads);
    }

    static int defaultThreads() {
        String configured = System.getProperty(THREADS_PROPERTY);
        if (configured == null || configured.isBlank()) {
            return Runtime.getRuntime().availableProcessors();
        }
        try {
            int threads = Integer.parseInt(configured.trim());
            if (threads > 0) {
                return threads;
            }
        }
        catch (NumberFormatException e) {
            LOG.log(System.Logger.Level.WARNING, "Ignoring invalid value ''{0}'' of {1}", configured, THREADS_PROPERTY);
            return Runtime.getRuntime().availableProcessors();
        }
        LOG.log(System.Logger.Level.WARNING, "Ignoring non-positive value ''{0}'' of {1}", configured, THREADS_PROPERTY);
        return Runtime.getRuntime().availableProcessors();
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
