/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.core.engine;

/**
 * Tuning for the bounded 1-D search.
 */
public record OptimizerOptions(
        double xatol,          // absolute tolerance on the abscissa
        int maxEvaluations     // objective evaluation budget, including the first probe
) {
    public OptimizerOptions {
        if (!(xatol > 0.0)) {
            throw new IllegalArgumentException("xatol must be > 0, was " + xatol);
        }
        if (maxEvaluations < 1) {
            throw new IllegalArgumentException("maxEvaluations must be >= 1, was " + maxEvaluations);
        }
    }

    public static OptimizerOptions defaultOptions() {
        return new OptimizerOptions(1e-5, 500);
    }

    public OptimizerOptions withMaxEvaluations(int maxEvaluations) {
        return new OptimizerOptions(xatol, maxEvaluations);
    }
}
