/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.core.engine;

import ai.evacortex.se3return.core.Pose;
import ai.evacortex.se3return.core.math.Matrix3;
import ai.evacortex.se3return.core.math.Vector3;

/**
 * Interference between two interventions measured through the adjoint action.
 *
 * <p>The second pose is embedded as a 4x4 homogeneous block X = [R₂ p₂; 0 1]; the action of the
 * first pose conjugates the rotation block (R₁·R₂·R₁ᵀ), rotates the translation column (R₁·p₂)
 * and leaves a zero bottom row. The score is ‖Ad(X) − X‖_F. The homogeneous corner always
 * contributes 1, so the score bottoms out at 1 when both blocks are left unchanged.</p>
 */
public final class Interference {

    private Interference() {}

    public static double predict(Pose first, Pose second) {
        Matrix3 r1 = first.rotation();
        Matrix3 conjugated = r1.multiply(second.rotation()).multiply(r1.transpose());
        Vector3 rotatedTranslation = r1.multiply(second.translation());

        double rotationPart = conjugated.subtract(second.rotation()).frobeniusNorm();
        double translationPart = rotatedTranslation.subtract(second.translation()).norm();
        // homogeneous corner: X holds 1, Ad(X) holds 0
        double corner = 1.0;

        return Math.sqrt(rotationPart * rotationPart + translationPart * translationPart + corner * corner);
    }
}
