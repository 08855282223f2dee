/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.core.resonance;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Outcome of comparing the named constants against the optimized scale.
 *
 * @param best          constant with the lowest return error
 * @param bestError     return error at {@code best}
 * @param errors        return error per constant, in declaration order
 * @param optimalLambda scale found by the wide-range search
 * @param optimalError  return error at {@code optimalLambda}
 * @param natural       {@code bestError ≤ optimalError · (1 + tolerance)}
 */
public record ResonanceResult(
        ResonanceConstant best,
        double bestError,
        Map<ResonanceConstant, Double> errors,
        double optimalLambda,
        double optimalError,
        boolean natural
) {
    public ResonanceResult {
        errors = Collections.unmodifiableMap(new EnumMap<>(errors));
    }

    public String bestName() {
        return best.key();
    }
}
