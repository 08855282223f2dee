/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.service;

import ai.evacortex.se3return.core.engine.LambdaBounds;

import java.util.OptionalLong;

/**
 * Service-wide defaults, read once from JVM system properties.
 */
public record ServiceConfig(
        boolean bounded,
        double rMax,
        LambdaBounds lambdaBounds,
        double baseUnit,
        int maxEvaluations,
        OptionalLong noiseSeed,
        int batchParallelism
) {

    public static final String BOUNDED = "se3return.bounded";
    public static final String R_MAX = "se3return.rMax";
    public static final String LAMBDA_LO = "se3return.lambda.lo";
    public static final String LAMBDA_HI = "se3return.lambda.hi";
    public static final String BASE_UNIT = "se3return.baseUnit";
    public static final String MAX_EVALUATIONS = "se3return.optimizer.maxEvaluations";
    public static final String NOISE_SEED = "se3return.noise.seed";
    public static final String BATCH_PARALLELISM = "se3return.batch.parallelism";

    public ServiceConfig {
        if (!(rMax > 0.0) || !Double.isFinite(rMax)) {
            throw new IllegalArgumentException("rMax must be positive and finite, was " + rMax);
        }
        if (lambdaBounds == null) throw new NullPointerException("lambdaBounds must not be null");
        if (noiseSeed == null) throw new NullPointerException("noiseSeed must not be null");
        if (maxEvaluations < 1) {
            throw new IllegalArgumentException("maxEvaluations must be >= 1, was " + maxEvaluations);
        }
        if (batchParallelism < 1) {
            throw new IllegalArgumentException("batchParallelism must be >= 1, was " + batchParallelism);
        }
    }

    public static ServiceConfig defaults() {
        return new ServiceConfig(true, 1.0, LambdaBounds.DEFAULT, 100.0, 500, OptionalLong.empty(),
                Runtime.getRuntime().availableProcessors());
    }

    public static ServiceConfig fromSystemProperties() {
        ServiceConfig d = defaults();
        String seed = System.getProperty(NOISE_SEED);
        return new ServiceConfig(
                Boolean.parseBoolean(System.getProperty(BOUNDED, Boolean.toString(d.bounded()))),
                Double.parseDouble(System.getProperty(R_MAX, Double.toString(d.rMax()))),
                new LambdaBounds(
                        Double.parseDouble(System.getProperty(LAMBDA_LO, Double.toString(d.lambdaBounds().lo()))),
                        Double.parseDouble(System.getProperty(LAMBDA_HI, Double.toString(d.lambdaBounds().hi())))),
                Double.parseDouble(System.getProperty(BASE_UNIT, Double.toString(d.baseUnit()))),
                Integer.getInteger(MAX_EVALUATIONS, d.maxEvaluations()),
                seed == null || seed.isBlank() ? OptionalLong.empty() : OptionalLong.of(Long.parseLong(seed.trim())),
                Integer.getInteger(BATCH_PARALLELISM, d.batchParallelism()));
    }
}
