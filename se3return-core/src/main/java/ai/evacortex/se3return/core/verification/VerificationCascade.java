/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.core.verification;

import ai.evacortex.se3return.core.Pose;
import ai.evacortex.se3return.core.Trajectory;
import ai.evacortex.se3return.core.engine.ReturnObjective;
import ai.evacortex.se3return.core.math.Vector3;
import ai.evacortex.se3return.core.trace.NoOpTracer;
import ai.evacortex.se3return.core.trace.ReturnTracer;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * Scores a trajectory at a chosen scale on five independent levels and folds them into a
 * weighted overall score, a pass/fail verdict and a reward.
 *
 * <p>Every level except the stochastic one is deterministic. The stochastic level derives one
 * seed per trial from a single generator before running any trial, so a seeded cascade gives the
 * same answer whether trials run sequentially or in parallel.</p>
 */
public final class VerificationCascade {

    private static final double STEP_EPSILON = 1e-10;
    private static final double BASELINE_EPSILON = 1e-10;

    private final CascadeConfig config;
    private final ReturnTracer tracer;

    public VerificationCascade(CascadeConfig config, ReturnTracer tracer) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
    }

    public VerificationCascade(CascadeConfig config) {
        this(config, NoOpTracer.INSTANCE);
    }

    public VerificationCascade() {
        this(CascadeConfig.defaults());
    }

    public VerificationResult verify(Trajectory trajectory, double lambda, double baseUnit) {
        return verify(ReturnObjective.doubled(trajectory), lambda, baseUnit);
    }

    /**
     * Runs all five levels. The objective's doubling flag is ignored: the topological and
     * stochastic levels always measure the doubled return error.
     */
    public VerificationResult verify(ReturnObjective objective, double lambda, double baseUnit) {
        Objects.requireNonNull(objective, "objective must not be null");
        Trajectory trajectory = objective.trajectory();
        ReturnObjective doubled = objective.isDoubled() ? objective : ReturnObjective.doubled(trajectory);

        Map<VerificationLevel, Double> raw = new EnumMap<>(VerificationLevel.class);
        raw.put(VerificationLevel.TOPOLOGICAL, returnQuality(doubled, lambda));
        raw.put(VerificationLevel.ENERGETIC, energyConservation(trajectory, lambda));
        raw.put(VerificationLevel.TEMPORAL, timingConsistency(trajectory));
        raw.put(VerificationLevel.SPATIAL, boundedDomain(trajectory));
        raw.put(VerificationLevel.STOCHASTIC, noiseRobustness(doubled, lambda));

        Map<VerificationLevel, Double> normalized = new EnumMap<>(VerificationLevel.class);
        double overall = 0.0;
        boolean passed = true;
        for (Map.Entry<VerificationLevel, Double> e : raw.entrySet()) {
            VerificationLevel level = e.getKey();
            double value = e.getValue();
            double score = normalize(level, value);
            normalized.put(level, score);
            overall += config.weight(level) * score;
            passed &= meetsThreshold(level, value);
            tracer.level(level, value, score);
        }
        return new VerificationResult(raw, normalized, overall, passed, overall * baseUnit);
    }

    /** Doubled return error at {@code lambda}. */
    public double returnQuality(ReturnObjective doubled, double lambda) {
        return doubled.applyAsDouble(lambda);
    }

    /** Mean of ‖rotation generator‖ + ‖translation‖ over the scaled, doubled poses. */
    public double energyConservation(Trajectory trajectory, double lambda) {
        Trajectory transformed = trajectory.scale(lambda).doubled();
        double work = 0.0;
        for (Pose pose : transformed.poses()) {
            work += pose.rotationVector().norm() + pose.translation().norm();
        }
        return work / transformed.size();
    }

    /** Coefficient of variation of consecutive step sizes in the unscaled trajectory. */
    public double timingConsistency(Trajectory trajectory) {
        int n = trajectory.size();
        if (n < 2) return 0.0;

        double[] steps = new double[n - 1];
        Vector3 prevRot = trajectory.get(0).rotationVector();
        Vector3 prevTrans = trajectory.get(0).translation();
        for (int i = 1; i < n; i++) {
            Vector3 rot = trajectory.get(i).rotationVector();
            Vector3 trans = trajectory.get(i).translation();
            steps[i - 1] = rot.subtract(prevRot).norm() + trans.subtract(prevTrans).norm();
            prevRot = rot;
            prevTrans = trans;
        }

        double mean = 0.0;
        for (double s : steps) mean += s;
        mean /= steps.length;
        if (mean < STEP_EPSILON) return 0.0;

        double variance = 0.0;
        for (double s : steps) variance += (s - mean) * (s - mean);
        variance /= steps.length;
        return Math.sqrt(variance) / mean;
    }

    public double boundedDomain(Trajectory trajectory) {
        return trajectory.withinBounds() ? 1.0 : 0.0;
    }

    /**
     * Robustness in [0, 1]: 1 − (mean noisy error − baseline) / baseline, clamped. A near-zero
     * baseline yields the configured fallback.
     */
    public double noiseRobustness(ReturnObjective doubled, double lambda) {
        double baseline = doubled.applyAsDouble(lambda);
        Trajectory trajectory = doubled.trajectory();

        Random master = config.seed().isPresent() ? new Random(config.seed().getAsLong()) : new Random();
        long[] seeds = new long[config.noiseTrials()];
        for (int i = 0; i < seeds.length; i++) {
            seeds[i] = master.nextLong();
        }

        IntStream trials = IntStream.range(0, seeds.length);
        if (config.parallelTrials()) {
            trials = trials.parallel();
        }
        double[] errors = trials
                .mapToDouble(i -> perturbedError(trajectory, lambda, new Random(seeds[i])))
                .toArray();

        if (baseline < BASELINE_EPSILON) {
            return config.stochasticFallback();
        }
        double mean = 0.0;
        for (double e : errors) mean += e;
        mean /= errors.length;

        double robustness = 1.0 - (mean - baseline) / baseline;
        return Math.max(0.0, Math.min(1.0, robustness));
    }

    private double perturbedError(Trajectory trajectory, double lambda, Random rng) {
        double std = config.noiseStd();
        List<Pose> noisy = new ArrayList<>(trajectory.size());
        for (Pose pose : trajectory.poses()) {
            Vector3 rotNoise = gaussian(rng, std);
            Vector3 transNoise = gaussian(rng, std);
            noisy.add(Pose.fromRotationVector(
                    pose.rotationVector().add(rotNoise),
                    pose.translation().add(transNoise)));
        }
        return ReturnObjective.returnError(trajectory.withPoses(noisy), lambda, true);
    }

    private static Vector3 gaussian(Random rng, double std) {
        return new Vector3(rng.nextGaussian() * std, rng.nextGaussian() * std, rng.nextGaussian() * std);
    }

    private double normalize(VerificationLevel level, double raw) {
        return switch (level) {
            case TOPOLOGICAL -> Math.max(0.0, 1.0 - raw / config.topologicalScale());
            case ENERGETIC -> Math.max(0.0, 1.0 - raw / config.energeticScale());
            case TEMPORAL -> Math.max(0.0, 1.0 - raw / config.temporalScale());
            case SPATIAL, STOCHASTIC -> raw;
        };
    }

    private boolean meetsThreshold(VerificationLevel level, double raw) {
        if (level == VerificationLevel.SPATIAL) {
            return raw == 1.0;
        }
        double threshold = config.threshold(level);
        return level.higherIsBetter() ? raw >= threshold : raw <= threshold;
    }

    public CascadeConfig config() {
        return config;
    }
}
