/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.service;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@link MetricsService} over many trajectories on a work-stealing pool.
 *
 * <p>A failing trajectory becomes a {@link BatchError} at its index; the rest of the batch is
 * unaffected. Results are returned in input order.</p>
 */
public final class BatchMetricsService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BatchMetricsService.class);

    private final MetricsService metrics;
    private final ExecutorService executor;

    public BatchMetricsService(MetricsService metrics, int parallelism) {
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, was " + parallelism);
        }
        this.executor = Executors.newWorkStealingPool(parallelism);
    }

    public BatchMetricsService(ServiceConfig config) {
        this(new MetricsService(config), config.batchParallelism());
    }

    public List<BatchEntry> computeBatch(List<JsonNode> trajectories) {
        return computeBatch(trajectories, metrics.defaults());
    }

    public List<BatchEntry> computeBatch(List<JsonNode> trajectories, MetricsOptions options) {
        Objects.requireNonNull(trajectories, "trajectories must not be null");
        Objects.requireNonNull(options, "options must not be null");

        int total = trajectories.size();
        List<Future<BatchEntry>> futures = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            final int index = i;
            final JsonNode data = trajectories.get(i);
            futures.add(executor.submit(() -> computeOne(index, total, data, options)));
        }

        List<BatchEntry> results = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            results.add(await(i, futures.get(i)));
        }
        return results;
    }

    private BatchEntry computeOne(int index, int total, JsonNode data, MetricsOptions options) {
        log.info("Processing trajectory {}/{}", index + 1, total);
        try {
            return BatchEntry.success(index, metrics.compute(data, options));
        } catch (RuntimeException e) {
            log.error("Error processing trajectory {}", index + 1, e);
            return BatchEntry.failure(index, BatchError.of(index, e));
        }
    }

    private static BatchEntry await(int index, Future<BatchEntry> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while waiting for trajectory " + index, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            log.error("Trajectory {} failed outside the pipeline", index, cause);
            String message = cause == null ? e.getMessage() : String.valueOf(cause.getMessage());
            return BatchEntry.failure(index, new BatchError(index, BatchError.INTERNAL, message));
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) executor.shutdownNow();
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
