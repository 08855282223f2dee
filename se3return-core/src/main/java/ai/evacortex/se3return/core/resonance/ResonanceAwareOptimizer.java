/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.core.resonance;

import ai.evacortex.se3return.core.Trajectory;
import ai.evacortex.se3return.core.engine.LambdaBounds;
import ai.evacortex.se3return.core.engine.ReturnObjective;
import ai.evacortex.se3return.core.engine.ReturnOptimizer;
import ai.evacortex.se3return.core.engine.ReturnResult;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Searches close to the named constants before falling back to a wide search.
 */
public final class ResonanceAwareOptimizer {

    /** Local error above which the biased search widens to {@link LambdaBounds#WIDE}. */
    public static final double FALLBACK_ERROR = 1.0;

    private static final double LOWER_FACTOR = 0.7;
    private static final double UPPER_FACTOR = 1.4;

    private final ReturnOptimizer optimizer;

    public ResonanceAwareOptimizer(ReturnOptimizer optimizer) {
        this.optimizer = Objects.requireNonNull(optimizer, "optimizer must not be null");
    }

    public ResonanceAwareOptimizer() {
        this(new ReturnOptimizer());
    }

    /**
     * With {@code biasToGolden}, searches (0.7φ, 1.4φ) first and, if that leaves an error above
     * {@link #FALLBACK_ERROR}, also searches the wide range and keeps the better result.
     * Without bias, searches the wide range directly.
     */
    public ReturnResult optimizeWithBias(Trajectory trajectory, boolean biasToGolden) {
        ReturnObjective objective = ReturnObjective.doubled(trajectory);
        if (!biasToGolden) {
            return optimizer.optimize(objective, LambdaBounds.WIDE);
        }

        ReturnResult local = optimizer.optimize(objective, around(ResonanceConstant.GOLDEN_RATIO));
        if (local.epsilon() > FALLBACK_ERROR) {
            ReturnResult global = optimizer.optimize(objective, LambdaBounds.WIDE);
            if (global.epsilon() < local.epsilon()) {
                return global;
            }
        }
        return local;
    }

    /** Best scale in the neighborhood (0.7c, 1.4c) of every constant. */
    public Map<ResonanceConstant, ReturnResult> multiResonanceSearch(Trajectory trajectory) {
        ReturnObjective objective = ReturnObjective.doubled(trajectory);
        Map<ResonanceConstant, ReturnResult> results = new EnumMap<>(ResonanceConstant.class);
        for (ResonanceConstant constant : ResonanceConstant.values()) {
            results.put(constant, optimizer.optimize(objective, around(constant)));
        }
        return Collections.unmodifiableMap(results);
    }

    static LambdaBounds around(ResonanceConstant constant) {
        return new LambdaBounds(constant.value() * LOWER_FACTOR, constant.value() * UPPER_FACTOR);
    }
}
