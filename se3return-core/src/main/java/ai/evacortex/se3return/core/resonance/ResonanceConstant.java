/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.core.resonance;

/**
 * Named mathematical constants tested as candidate return scales.
 * Declaration order is the tie-break order: when two constants score equally, the earlier wins.
 */
public enum ResonanceConstant {
    GOLDEN_RATIO("golden_ratio", (Math.sqrt(5.0) - 1.0) / 2.0),
    SILVER_RATIO("silver_ratio", 1.0 + Math.sqrt(2.0)),
    PLASTIC_NUMBER("plastic_number", 1.324717957244),   // real root of x³ = x + 1
    OCTAVE("octave", 2.0),
    PERFECT_FIFTH("perfect_fifth", 3.0 / 2.0),
    PERFECT_FOURTH("perfect_fourth", 4.0 / 3.0),
    MAJOR_THIRD("major_third", 5.0 / 4.0);

    private final String key;
    private final double value;

    ResonanceConstant(String key, double value) {
        this.key = key;
        this.value = value;
    }

    public String key() {
        return key;
    }

    public double value() {
        return value;
    }
}
