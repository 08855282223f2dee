/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.core.trace;

import ai.evacortex.se3return.core.engine.ReturnResult;
import ai.evacortex.se3return.core.verification.VerificationLevel;

/**
 * Observability hook passed into the optimizer, detector and cascade.
 * Implementations must be cheap and must not throw.
 */
public interface ReturnTracer {

    /** One evaluation of the return objective during a search. */
    void evaluation(double lambda, double error);

    /** A bounded search has finished. */
    void optimized(ReturnResult result);

    /** A named constant was evaluated by the resonance detector. */
    default void resonance(String name, double lambda, double error) {}

    /** A verification level has been measured and normalized. */
    default void level(VerificationLevel level, double raw, double normalized) {}
}
