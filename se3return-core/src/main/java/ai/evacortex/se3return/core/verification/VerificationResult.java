/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.core.verification;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Outcome of one cascade run. Maps iterate in {@link VerificationLevel} declaration order.
 */
public record VerificationResult(Map<VerificationLevel, Double> raw,
                                 Map<VerificationLevel, Double> normalized,
                                 double overallScore,
                                 boolean passed,
                                 double reward) {

    public VerificationResult {
        if (raw.size() != VerificationLevel.values().length
                || normalized.size() != VerificationLevel.values().length) {
            throw new IllegalArgumentException("Every verification level must be scored");
        }
        raw = Collections.unmodifiableMap(new EnumMap<>(raw));
        normalized = Collections.unmodifiableMap(new EnumMap<>(normalized));
    }

    public double raw(VerificationLevel level) {
        return raw.get(level);
    }

    public double normalized(VerificationLevel level) {
        return normalized.get(level);
    }
}
