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
import ai.evacortex.se3return.core.exceptions.UnsupportedFormatException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Per-request switches and parameters of the metrics pipeline.
 */
public record MetricsOptions(
        boolean resonanceDetection,
        boolean verificationCascade,
        boolean bounded,
        double rMax,
        LambdaBounds lambdaBounds,
        double baseUnit,
        int maxEvaluations,
        OptionalLong noiseSeed
) {

    public MetricsOptions {
        Objects.requireNonNull(lambdaBounds, "lambdaBounds must not be null");
        Objects.requireNonNull(noiseSeed, "noiseSeed must not be null");
        if (maxEvaluations < 1) {
            throw new IllegalArgumentException("maxEvaluations must be >= 1, was " + maxEvaluations);
        }
    }

    public static MetricsOptions defaultOptions() {
        return from(ServiceConfig.defaults());
    }

    public static MetricsOptions from(ServiceConfig config) {
        return new MetricsOptions(true, true, config.bounded(), config.rMax(), config.lambdaBounds(),
                config.baseUnit(), config.maxEvaluations(), config.noiseSeed());
    }

    /**
     * Overlays the fields present in a request's {@code options} object on {@code defaults}.
     * A missing or null node yields {@code defaults} unchanged.
     *
     * @throws UnsupportedFormatException if a field has the wrong JSON type
     * @throws ai.evacortex.se3return.core.exceptions.InvalidScaleException if {@code lambda_bounds} is not a valid range
     */
    public static MetricsOptions fromJson(JsonNode node, MetricsOptions defaults) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return defaults;
        }
        if (!node.isObject()) {
            throw new UnsupportedFormatException("options must be a JSON object");
        }
        LambdaBounds bounds = defaults.lambdaBounds();
        JsonNode lb = node.get("lambda_bounds");
        if (lb != null && !lb.isNull()) {
            if (!lb.isArray() || lb.size() != 2 || !lb.get(0).isNumber() || !lb.get(1).isNumber()) {
                throw new UnsupportedFormatException("lambda_bounds must be a [lo, hi] pair of numbers");
            }
            bounds = new LambdaBounds(lb.get(0).doubleValue(), lb.get(1).doubleValue());
        }
        OptionalLong seed = defaults.noiseSeed();
        JsonNode seedNode = node.get("noise_seed");
        if (seedNode != null && !seedNode.isNull()) {
            if (!seedNode.canConvertToLong() || !seedNode.isIntegralNumber()) {
                throw new UnsupportedFormatException("noise_seed must be an integer");
            }
            seed = OptionalLong.of(seedNode.longValue());
        }
        return new MetricsOptions(
                bool(node, "enable_resonance_detection", defaults.resonanceDetection()),
                bool(node, "enable_verification_cascade", defaults.verificationCascade()),
                bool(node, "bounded", defaults.bounded()),
                number(node, "r_max", defaults.rMax()),
                bounds,
                number(node, "base_unit", defaults.baseUnit()),
                positiveInt(node, "max_evaluations", defaults.maxEvaluations()),
                seed);
    }

    public MetricsOptions withNoiseSeed(long seed) {
        return new MetricsOptions(resonanceDetection, verificationCascade, bounded, rMax, lambdaBounds,
                baseUnit, maxEvaluations, OptionalLong.of(seed));
    }

    public MetricsOptions withLambdaBounds(LambdaBounds bounds) {
        return new MetricsOptions(resonanceDetection, verificationCascade, bounded, rMax, bounds,
                baseUnit, maxEvaluations, noiseSeed);
    }

    private static boolean bool(JsonNode node, String field, boolean fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return fallback;
        if (!value.isBoolean()) {
            throw new UnsupportedFormatException(field + " must be a boolean");
        }
        return value.booleanValue();
    }

    private static double number(JsonNode node, String field, double fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return fallback;
        if (!value.isNumber()) {
            throw new UnsupportedFormatException(field + " must be a number");
        }
        return value.doubleValue();
    }

    private static int positiveInt(JsonNode node, String field, int fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return fallback;
        if (!value.isIntegralNumber() || !value.canConvertToInt() || value.intValue() < 1) {
            throw new UnsupportedFormatException(field + " must be a positive integer");
        }
        return value.intValue();
    }
}
