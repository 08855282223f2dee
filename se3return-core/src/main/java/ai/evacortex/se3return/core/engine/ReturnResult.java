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
 * Result of optimizing the return objective.
 *
 * @param lambda      optimal scale λ*
 * @param epsilon     residual return error ε* at λ*
 * @param converged   whether the search narrowed its bracket within the evaluation budget
 * @param evaluations number of objective evaluations spent
 */
public record ReturnResult(double lambda, double epsilon, boolean converged, int evaluations) {

    static ReturnResult from(ScalarMinimum minimum) {
        return new ReturnResult(minimum.x(), minimum.value(), minimum.converged(), minimum.evaluations());
    }
}
