/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.core.verification;

/**
 * The five independent checks of the verification cascade, in scoring order.
 */
public enum VerificationLevel {
    /** Return error at the chosen scale. Lower is better. */
    TOPOLOGICAL("topological", 0.3, 0.1, false),
    /** Mean per-pose work over the doubled, scaled trajectory. Lower is better. */
    ENERGETIC("energetic", 0.2, 0.05, false),
    /** Coefficient of variation of step sizes in the original trajectory. Lower is better. */
    TEMPORAL("temporal", 0.2, 0.1, false),
    /** 1.0 when every translation lies within r_max, else 0.0. */
    SPATIAL("spatial", 0.2, 1.0, true),
    /** Robustness of the return error to Gaussian perturbation, in [0, 1]. Higher is better. */
    STOCHASTIC("stochastic", 0.1, 0.8, true);

    private final String key;
    private final double defaultWeight;
    private final double defaultThreshold;
    private final boolean higherIsBetter;

    VerificationLevel(String key, double defaultWeight, double defaultThreshold, boolean higherIsBetter) {
        this.key = key;
        this.defaultWeight = defaultWeight;
        this.defaultThreshold = defaultThreshold;
        this.higherIsBetter = higherIsBetter;
    }

    public String key() {
        return key;
    }

    public double defaultWeight() {
        return defaultWeight;
    }

    public double defaultThreshold() {
        return defaultThreshold;
    }

    public boolean higherIsBetter() {
        return higherIsBetter;
    }
}
