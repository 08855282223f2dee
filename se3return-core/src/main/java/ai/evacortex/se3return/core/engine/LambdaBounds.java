/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.core.engine;

import ai.evacortex.se3return.core.exceptions.InvalidScaleException;

/**
 * Closed search interval [lo, hi] for the scale factor λ.
 */
public record LambdaBounds(double lo, double hi) {

    /** Search range where return scales near 1 are considered meaningful. */
    public static final LambdaBounds DEFAULT = new LambdaBounds(0.1, 2.0);

    /** Wide range used when comparing named constants against the best achievable error. */
    public static final LambdaBounds WIDE = new LambdaBounds(0.1, 10.0);

    public LambdaBounds {
        if (!Double.isFinite(lo) || !Double.isFinite(hi)) {
            throw new InvalidScaleException("bounds must be finite: [" + lo + " .. " + hi + "]");
        }
        if (lo >= hi) {
            throw new InvalidScaleException("lower bound must be below upper bound: [" + lo + " .. " + hi + "]");
        }
    }

    public boolean contains(double lambda) {
        return lambda >= lo && lambda <= hi;
    }

    public double width() {
        return hi - lo;
    }

    @Override
    public String toString() {
        return "[" + lo + " .. " + hi + "]";
    }
}
