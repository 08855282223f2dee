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
 * Outcome of a bounded scalar minimization.
 *
 * @param x           best abscissa found
 * @param value       objective value at {@code x}
 * @param converged   false when the evaluation budget ran out or the objective produced NaN
 * @param evaluations number of objective evaluations spent
 */
public record ScalarMinimum(double x, double value, boolean converged, int evaluations) {}
