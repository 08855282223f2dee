/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.core.engine;

import ai.evacortex.se3return.core.Trajectory;
import ai.evacortex.se3return.core.trace.NoOpTracer;
import ai.evacortex.se3return.core.trace.ReturnTracer;

import java.util.Objects;

/**
 * Finds the scale λ* ∈ [lo, hi] minimizing the return error of a trajectory.
 *
 * <p>Deterministic for a given trajectory, bounds and options. Non-convergence is reported on
 * the result, not thrown.</p>
 */
public final class ReturnOptimizer {

    private final ScalarMinimizer minimizer;
    private final OptimizerOptions options;
    private final ReturnTracer tracer;

    public ReturnOptimizer(ScalarMinimizer minimizer, OptimizerOptions options, ReturnTracer tracer) {
        this.minimizer = Objects.requireNonNull(minimizer, "minimizer must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
    }

    public ReturnOptimizer(OptimizerOptions options) {
        this(new BrentMinimizer(), options, NoOpTracer.INSTANCE);
    }

    public ReturnOptimizer() {
        this(OptimizerOptions.defaultOptions());
    }

    public ReturnResult optimize(Trajectory trajectory) {
        return optimize(ReturnObjective.doubled(trajectory), LambdaBounds.DEFAULT);
    }

    public ReturnResult optimize(Trajectory trajectory, LambdaBounds bounds, boolean doubled) {
        return optimize(ReturnObjective.of(trajectory, doubled), bounds);
    }

    public ReturnResult optimize(ReturnObjective objective, LambdaBounds bounds) {
        Objects.requireNonNull(objective, "objective must not be null");
        ScalarMinimum minimum = minimizer.minimize(lambda -> {
            double error = objective.applyAsDouble(lambda);
            tracer.evaluation(lambda, error);
            return error;
        }, bounds, options);
        ReturnResult result = ReturnResult.from(minimum);
        tracer.optimized(result);
        return result;
    }

    public OptimizerOptions options() {
        return options;
    }
}
