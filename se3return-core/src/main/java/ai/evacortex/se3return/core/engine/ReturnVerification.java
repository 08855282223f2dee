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
 * Decomposed return quality at a given scale.
 */
public record ReturnVerification(
        double totalError,
        double rotationError,
        double translationError,
        boolean returnAchieved,
        double tolerance,
        double lambda
) {
    public static final double DEFAULT_TOLERANCE = 0.1;
}
