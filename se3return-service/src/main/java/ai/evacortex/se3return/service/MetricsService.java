/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.service;

import ai.evacortex.se3return.core.Trajectory;
import ai.evacortex.se3return.core.engine.BrentMinimizer;
import ai.evacortex.se3return.core.engine.LambdaBounds;
import ai.evacortex.se3return.core.engine.OptimizerOptions;
import ai.evacortex.se3return.core.engine.ReturnObjective;
import ai.evacortex.se3return.core.engine.ReturnOptimizer;
import ai.evacortex.se3return.core.engine.ReturnResult;
import ai.evacortex.se3return.core.resonance.ResonanceDetector;
import ai.evacortex.se3return.core.resonance.ResonanceResult;
import ai.evacortex.se3return.core.trace.ReturnTracer;
import ai.evacortex.se3return.core.verification.CascadeConfig;
import ai.evacortex.se3return.core.verification.VerificationCascade;
import ai.evacortex.se3return.core.verification.VerificationResult;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Full pipeline for one trajectory: encode, optimize λ, optionally detect a resonance and run the
 * verification cascade, then score confidence.
 *
 * <p>All stages share one {@link ReturnObjective}, so a λ evaluated by the optimizer is not
 * recomputed by the detector or the cascade. Instances are stateless and thread-safe.</p>
 */
public final class MetricsService {

    private static final Logger log = LoggerFactory.getLogger(MetricsService.class);

    static final double DEGRADED_CONFIDENCE = 0.5;

    private final TrajectoryEncoder encoder;
    private final MetricsOptions defaults;
    private final Clock clock;
    private final ReturnTracer tracer;

    public MetricsService(TrajectoryEncoder encoder, MetricsOptions defaults, Clock clock, ReturnTracer tracer) {
        this.encoder = Objects.requireNonNull(encoder, "encoder must not be null");
        this.defaults = Objects.requireNonNull(defaults, "defaults must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
    }

    public MetricsService(ServiceConfig config) {
        this(new TrajectoryEncoder(), MetricsOptions.from(config), Clock.systemUTC(), Slf4jReturnTracer.INSTANCE);
    }

    public MetricsService() {
        this(ServiceConfig.fromSystemProperties());
    }

    public RegenerativeMetrics compute(JsonNode trajectoryData) {
        return compute(trajectoryData, defaults);
    }

    public RegenerativeMetrics compute(MetricsRequest request) {
        return compute(request.trajectoryData(), request.resolveOptions(defaults));
    }

    /** Parses a request document, runs it, and serializes the metrics. */
    public String computeJson(String requestJson) {
        return MetricsJson.write(compute(MetricsRequest.fromJson(MetricsJson.parse(requestJson))));
    }

    /**
     * @throws ai.evacortex.se3return.core.exceptions.ReturnException when the data cannot be encoded
     *         into a valid trajectory
     */
    public RegenerativeMetrics compute(JsonNode trajectoryData, MetricsOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        Trajectory trajectory = encoder.encode(trajectoryData, options.bounded(), options.rMax()).orElseThrow();
        log.info("Encoded trajectory with {} poses", trajectory.size());

        ReturnObjective objective = ReturnObjective.doubled(trajectory);
        ReturnOptimizer optimizer = new ReturnOptimizer(new BrentMinimizer(),
                OptimizerOptions.defaultOptions().withMaxEvaluations(options.maxEvaluations()), tracer);
        ReturnResult optimum = optimizer.optimize(objective, options.lambdaBounds());
        log.info("Optimal λ: {}, return error ε: {}", optimum.lambda(), optimum.epsilon());

        String resonance = null;
        if (options.resonanceDetection()) {
            ResonanceDetector detector = new ResonanceDetector(ResonanceDetector.DEFAULT_TOLERANCE,
                    LambdaBounds.WIDE, optimizer, tracer);
            ResonanceResult detected = detector.detect(objective);
            if (detected.natural()) {
                resonance = detected.bestName();
                log.info("Resonance detected: {}", resonance);
            }
        }

        double score = 0.0;
        if (options.verificationCascade()) {
            CascadeConfig config = CascadeConfig.builder().seed(options.noiseSeed()).build();
            VerificationResult verification = new VerificationCascade(config, tracer)
                    .verify(objective, optimum.lambda(), options.baseUnit());
            score = verification.overallScore();
            log.info("Verification score: {} (passed={})", score, verification.passed());
        }

        double confidence;
        if (optimum.converged()) {
            confidence = Math.min(1.0, 1.0 / (1.0 + optimum.epsilon()));
        } else {
            confidence = DEGRADED_CONFIDENCE;
            log.warn("Optimization did not converge after {} evaluations", optimum.evaluations());
        }

        MetricsMetadata metadata = new MetricsMetadata(
                trajectory.size(),
                options.bounded(),
                options.rMax(),
                new double[] {options.lambdaBounds().lo(), options.lambdaBounds().hi()},
                optimum.converged(),
                optimum.evaluations(),
                Instant.now(clock).toString(),
                TrajectoryFingerprint.computeHex(trajectory));

        return new RegenerativeMetrics(optimum.lambda(), optimum.epsilon(), score, resonance, confidence, metadata);
    }

    public MetricsOptions defaults() {
        return defaults;
    }
}
