/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.service;

import ai.evacortex.se3return.core.engine.ReturnResult;
import ai.evacortex.se3return.core.trace.ReturnTracer;
import ai.evacortex.se3return.core.verification.VerificationLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards core trace events to SLF4J at DEBUG.
 */
public final class Slf4jReturnTracer implements ReturnTracer {

    private static final Logger log = LoggerFactory.getLogger(Slf4jReturnTracer.class);

    public static final Slf4jReturnTracer INSTANCE = new Slf4jReturnTracer();

    private Slf4jReturnTracer() {}

    @Override
    public void evaluation(double lambda, double error) {
        log.debug("eval λ={} ε={}", lambda, error);
    }

    @Override
    public void optimized(ReturnResult result) {
        log.debug("optimized λ*={} ε={} converged={} evaluations={}",
                result.lambda(), result.epsilon(), result.converged(), result.evaluations());
    }

    @Override
    public void resonance(String name, double lambda, double error) {
        log.debug("resonance {} λ={} ε={}", name, lambda, error);
    }

    @Override
    public void level(VerificationLevel level, double raw, double normalized) {
        log.debug("level {} raw={} normalized={}", level.key(), raw, normalized);
    }
}
