/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.core.resonance;

import ai.evacortex.se3return.core.Trajectory;
import ai.evacortex.se3return.core.engine.LambdaBounds;
import ai.evacortex.se3return.core.engine.ReturnObjective;
import ai.evacortex.se3return.core.engine.ReturnOptimizer;
import ai.evacortex.se3return.core.engine.ReturnResult;
import ai.evacortex.se3return.core.trace.NoOpTracer;
import ai.evacortex.se3return.core.trace.ReturnTracer;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Tests whether the return error at a named constant is about as good as the optimum.
 *
 * <p>Each {@link ResonanceConstant} is evaluated with the doubled return objective; the
 * best one is compared against a wide-range optimization. The constant counts as a natural
 * resonance when its error is within {@code tolerance} (relative) of the optimal error.
 * This only compares numbers; it makes no claim about why a constant scores well.</p>
 */
public final class ResonanceDetector {

    public static final double DEFAULT_TOLERANCE = 0.1;

    private final double tolerance;
    private final LambdaBounds searchBounds;
    private final ReturnOptimizer optimizer;
    private final ReturnTracer tracer;

    public ResonanceDetector(double tolerance, LambdaBounds searchBounds, ReturnOptimizer optimizer, ReturnTracer tracer) {
        if (!(tolerance >= 0.0) || !Double.isFinite(tolerance)) {
            throw new IllegalArgumentException("tolerance must be finite and >= 0, was " + tolerance);
        }
        this.tolerance = tolerance;
        this.searchBounds = Objects.requireNonNull(searchBounds, "searchBounds must not be null");
        this.optimizer = Objects.requireNonNull(optimizer, "optimizer must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
    }

    public ResonanceDetector(double tolerance) {
        this(tolerance, LambdaBounds.WIDE, new ReturnOptimizer(), NoOpTracer.INSTANCE);
    }

    public ResonanceDetector() {
        this(DEFAULT_TOLERANCE);
    }

    /** Return error of the doubled trajectory at {@code lambda}. */
    public double testScaling(Trajectory trajectory, double lambda) {
        return ReturnObjective.returnError(trajectory, lambda, true);
    }

    public ResonanceResult detect(Trajectory trajectory) {
        return detect(ReturnObjective.doubled(trajectory));
    }

    public ResonanceResult detect(ReturnObjective objective) {
        Objects.requireNonNull(objective, "objective must not be null");
        if (!objective.isDoubled()) {
            throw new IllegalArgumentException("Resonance detection requires the doubled objective");
        }

        Map<ResonanceConstant, Double> errors = new EnumMap<>(ResonanceConstant.class);
        ResonanceConstant best = null;
        double bestError = Double.POSITIVE_INFINITY;
        for (ResonanceConstant constant : ResonanceConstant.values()) {
            double error = objective.applyAsDouble(constant.value());
            tracer.resonance(constant.key(), constant.value(), error);
            errors.put(constant, error);
            if (best == null || error < bestError) {
                best = constant;
                bestError = error;
            }
        }

        ReturnResult optimum = optimizer.optimize(objective, searchBounds);
        boolean natural = bestError <= optimum.epsilon() * (1.0 + tolerance);

        return new ResonanceResult(best, bestError, errors, optimum.lambda(), optimum.epsilon(), natural);
    }

    /**
     * Closest named constant to {@code lambda} by absolute difference. Pure lookup.
     */
    public static NearestResonance nearest(double lambda) {
        ResonanceConstant nearest = null;
        double distance = Double.POSITIVE_INFINITY;
        for (ResonanceConstant constant : ResonanceConstant.values()) {
            double d = Math.abs(lambda - constant.value());
            if (nearest == null || d < distance) {
                nearest = constant;
                distance = d;
            }
        }
        return new NearestResonance(nearest, nearest.value(), distance);
    }

    public double tolerance() {
        return tolerance;
    }
}
