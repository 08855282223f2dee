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

public final class NoOpTracer implements ReturnTracer {

    public static final NoOpTracer INSTANCE = new NoOpTracer();

    private NoOpTracer() {}

    @Override
    public void evaluation(double lambda, double error) {
        // no-op
    }

    @Override
    public void optimized(ReturnResult result) {
        // no-op
    }
}
