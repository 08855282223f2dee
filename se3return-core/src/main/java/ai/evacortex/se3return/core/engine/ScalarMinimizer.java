/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.core.engine;

import java.util.function.DoubleUnaryOperator;

/**
 * {@code ScalarMinimizer} defines a derivative-free search for the minimum of a real function
 * over a closed interval.
 *
 * <p>Implementations must be deterministic: the same function, bounds and options always produce
 * the same sequence of evaluations and the same {@link ScalarMinimum}. Running out of the
 * evaluation budget is reported through {@link ScalarMinimum#converged()}, never by throwing.</p>
 *
 * @see BrentMinimizer
 * @see GoldenSectionMinimizer
 */
public interface ScalarMinimizer {

    /**
     * Minimizes {@code f} over {@code bounds} with {@link OptimizerOptions#defaultOptions()}.
     *
     * @throws NullPointerException if any argument is {@code null}
     */
    ScalarMinimum minimize(DoubleUnaryOperator f, LambdaBounds bounds);

    /**
     * Minimizes {@code f} over {@code bounds}.
     *
     * @param f       objective; evaluated only inside {@code bounds}
     * @param bounds  search interval
     * @param options tolerance and evaluation budget
     * @return the best point found, never {@code null}
     * @throws NullPointerException if any argument is {@code null}
     */
    ScalarMinimum minimize(DoubleUnaryOperator f, LambdaBounds bounds, OptimizerOptions options);
}
