/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.core.verification;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Immutable configuration of a {@link VerificationCascade}. Build once with {@link #builder()}.
 *
 * <p>The normalization divisors (2.0, 0.5, 1.0) and the stochastic fallback (0.5) are fixed
 * empirical defaults, exposed for reproduction of other calibrations rather than derived.</p>
 */
public final class CascadeConfig {

    private static final double WEIGHT_SUM_SLACK = 1e-9;

    private final Map<VerificationLevel, Double> weights;
    private final Map<VerificationLevel, Double> thresholds;
    private final double topologicalScale;
    private final double energeticScale;
    private final double temporalScale;
    private final double stochasticFallback;
    private final int noiseTrials;
    private final double noiseStd;
    private final OptionalLong seed;
    private final boolean parallelTrials;

    private CascadeConfig(Builder b) {
        this.weights = Collections.unmodifiableMap(new EnumMap<>(b.weights));
        this.thresholds = Collections.unmodifiableMap(new EnumMap<>(b.thresholds));
        this.topologicalScale = b.topologicalScale;
        this.energeticScale = b.energeticScale;
        this.temporalScale = b.temporalScale;
        this.stochasticFallback = b.stochasticFallback;
        this.noiseTrials = b.noiseTrials;
        this.noiseStd = b.noiseStd;
        this.seed = b.seed;
        this.parallelTrials = b.parallelTrials;
    }

    public static CascadeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public double weight(VerificationLevel level) {
        return weights.get(level);
    }

    public double threshold(VerificationLevel level) {
        return thresholds.get(level);
    }

    public Map<VerificationLevel, Double> weights() {
        return weights;
    }

    public Map<VerificationLevel, Double> thresholds() {
        return thresholds;
    }

    public double topologicalScale() {
        return topologicalScale;
    }

    public double energeticScale() {
        return energeticScale;
    }

    public double temporalScale() {
        return temporalScale;
    }

    public double stochasticFallback() {
        return stochasticFallback;
    }

    public int noiseTrials() {
        return noiseTrials;
    }

    public double noiseStd() {
        return noiseStd;
    }

    public OptionalLong seed() {
        return seed;
    }

    public boolean parallelTrials() {
        return parallelTrials;
    }

    public static final class Builder {
        private final Map<VerificationLevel, Double> weights = new EnumMap<>(VerificationLevel.class);
        private final Map<VerificationLevel, Double> thresholds = new EnumMap<>(VerificationLevel.class);
        private double topologicalScale = 2.0;
        private double energeticScale = 0.5;
        private double temporalScale = 1.0;
        private double stochasticFallback = 0.5;
        private int noiseTrials = 10;
        private double noiseStd = 0.05;
        private OptionalLong seed = OptionalLong.empty();
        private boolean parallelTrials = false;

        private Builder() {
            for (VerificationLevel level : VerificationLevel.values()) {
                weights.put(level, level.defaultWeight());
                thresholds.put(level, level.defaultThreshold());
            }
        }

        public Builder weight(VerificationLevel level, double weight) {
            weights.put(Objects.requireNonNull(level, "level must not be null"), weight);
            return this;
        }

        /** Replaces all weights; levels absent from {@code replacement} get weight 0. */
        public Builder weights(Map<VerificationLevel, Double> replacement) {
            for (VerificationLevel level : VerificationLevel.values()) {
                weights.put(level, replacement.getOrDefault(level, 0.0));
            }
            return this;
        }

        public Builder threshold(VerificationLevel level, double threshold) {
            thresholds.put(Objects.requireNonNull(level, "level must not be null"), threshold);
            return this;
        }

        /** Overrides the given thresholds; other levels keep their defaults. */
        public Builder thresholds(Map<VerificationLevel, Double> overrides) {
            thresholds.putAll(overrides);
            return this;
        }

        public Builder topologicalScale(double scale) {
            this.topologicalScale = scale;
            return this;
        }

        public Builder energeticScale(double scale) {
            this.energeticScale = scale;
            return this;
        }

        public Builder temporalScale(double scale) {
            this.temporalScale = scale;
            return this;
        }

        public Builder stochasticFallback(double fallback) {
            this.stochasticFallback = fallback;
            return this;
        }

        public Builder noiseTrials(int trials) {
            this.noiseTrials = trials;
            return this;
        }

        public Builder noiseStd(double std) {
            this.noiseStd = std;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = OptionalLong.of(seed);
            return this;
        }

        public Builder seed(OptionalLong seed) {
            this.seed = Objects.requireNonNull(seed, "seed must not be null");
            return this;
        }

        public Builder parallelTrials(boolean parallel) {
            this.parallelTrials = parallel;
            return this;
        }

        public CascadeConfig build() {
            double sum = 0.0;
            for (Map.Entry<VerificationLevel, Double> e : weights.entrySet()) {
                double w = e.getValue();
                if (!(w >= 0.0) || !Double.isFinite(w)) {
                    throw new IllegalArgumentException("weight of " + e.getKey().key() + " must be finite and >= 0, was " + w);
                }
                sum += w;
            }
            if (sum > 1.0 + WEIGHT_SUM_SLACK) {
                throw new IllegalArgumentException("weights must sum to at most 1, sum was " + sum);
            }
            for (Map.Entry<VerificationLevel, Double> e : thresholds.entrySet()) {
                if (!Double.isFinite(e.getValue())) {
                    throw new IllegalArgumentException("threshold of " + e.getKey().key() + " must be finite");
                }
            }
            requirePositive("topologicalScale", topologicalScale);
            requirePositive("energeticScale", energeticScale);
            requirePositive("temporalScale", temporalScale);
            if (!(stochasticFallback >= 0.0 && stochasticFallback <= 1.0)) {
                throw new IllegalArgumentException("stochasticFallback must be in [0, 1], was " + stochasticFallback);
            }
            if (noiseTrials < 1) {
                throw new IllegalArgumentException("noiseTrials must be >= 1, was " + noiseTrials);
            }
            if (!(noiseStd >= 0.0) || !Double.isFinite(noiseStd)) {
                throw new IllegalArgumentException("noiseStd must be finite and >= 0, was " + noiseStd);
            }
            return new CascadeConfig(this);
        }

        private static void requirePositive(String name, double value) {
            if (!(value > 0.0) || !Double.isFinite(value)) {
                throw new IllegalArgumentException(name + " must be positive and finite, was " + value);
            }
        }
    }
}
