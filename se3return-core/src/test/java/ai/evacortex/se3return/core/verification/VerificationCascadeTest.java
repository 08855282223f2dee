/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.core.verification;

import ai.evacortex.se3return.core.Pose;
import ai.evacortex.se3return.core.PoseTestUtils;
import ai.evacortex.se3return.core.Trajectories;
import ai.evacortex.se3return.core.Trajectory;
import ai.evacortex.se3return.core.engine.ReturnObjective;
import ai.evacortex.se3return.core.engine.ReturnResult;
import ai.evacortex.se3return.core.trace.ReturnTracer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static ai.evacortex.se3return.core.verification.VerificationLevel.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Verification cascade")
class VerificationCascadeTest {

    private static final double BASE = 100.0;

    private static VerificationCascade seeded(long seed) {
        return new VerificationCascade(CascadeConfig.builder().seed(seed).build());
    }

    @Test
    void defaults_matchDocumentedWeightsAndThresholds() {
        CascadeConfig c = CascadeConfig.defaults();
        assertEquals(0.3, c.weight(TOPOLOGICAL));
        assertEquals(0.2, c.weight(ENERGETIC));
        assertEquals(0.2, c.weight(TEMPORAL));
        assertEquals(0.2, c.weight(SPATIAL));
        assertEquals(0.1, c.weight(STOCHASTIC));
        assertEquals(0.1, c.threshold(TOPOLOGICAL));
        assertEquals(0.05, c.threshold(ENERGETIC));
        assertEquals(0.1, c.threshold(TEMPORAL));
        assertEquals(1.0, c.threshold(SPATIAL));
        assertEquals(0.8, c.threshold(STOCHASTIC));
        assertEquals(10, c.noiseTrials());
        assertEquals(0.05, c.noiseStd());
        assertEquals(0.5, c.stochasticFallback());
        assertTrue(c.seed().isEmpty());
    }

    @Test
    void perfectReturn_usesStochasticFallback() {
        Trajectory loop = PoseTestUtils.closedLoop(5L);
        VerificationResult r = seeded(1L).verify(loop, 1.0, BASE);
        assertTrue(r.raw(TOPOLOGICAL) < 1e-10);
        assertEquals(1.0, r.normalized(TOPOLOGICAL), 1e-10);
        assertEquals(0.5, r.raw(STOCHASTIC), 0.0);
        assertFalse(r.passed(), "stochastic fallback 0.5 is below the 0.8 threshold");
    }

    @Test
    void spatial_isOneForUnboundedRegardlessOfMagnitude() {
        Trajectory t = Trajectory.of(List.of(PoseTestUtils.translation(25, 0, 0)), false, 1.0);
        assertEquals(1.0, new VerificationCascade().boundedDomain(t), 0.0);
    }

    @Test
    void spatial_isZeroOnceABoundedPoseLeavesTheBall() {
        // scaling carries the bound without re-validating, which is how an out-of-bounds bounded trajectory arises
        Trajectory inside = Trajectory.of(List.of(PoseTestUtils.translation(0.8, 0, 0), Pose.identity()), true, 1.0);
        Trajectory outside = inside.scale(2.0);
        assertEquals(1.0, new VerificationCascade().boundedDomain(inside), 0.0);
        assertEquals(0.0, new VerificationCascade().boundedDomain(outside), 0.0);

        CascadeConfig lenient = CascadeConfig.builder()
                .seed(3L)
                .threshold(TOPOLOGICAL, 100.0)
                .threshold(ENERGETIC, 100.0)
                .threshold(TEMPORAL, 100.0)
                .threshold(STOCHASTIC, 0.0)
                .build();
        VerificationResult r = new VerificationCascade(lenient).verify(outside, 1.0, BASE);
        assertEquals(0.0, r.raw(SPATIAL), 0.0);
        assertFalse(r.passed(), "any out-of-bounds pose must fail the cascade");
    }

    @Test
    void lenientThresholds_pass() {
        CascadeConfig lenient = CascadeConfig.builder()
                .seed(3L)
                .threshold(TOPOLOGICAL, 100.0)
                .threshold(ENERGETIC, 100.0)
                .threshold(TEMPORAL, 100.0)
                .threshold(STOCHASTIC, 0.0)
                .build();
        VerificationResult r = new VerificationCascade(lenient).verify(Trajectory.of(PoseTestUtils.square()), 1.0, BASE);
        assertTrue(r.passed());
    }

    @Test
    void temporal_isZeroForShortOrStationaryTrajectories() {
        VerificationCascade cascade = new VerificationCascade();
        assertEquals(0.0, cascade.timingConsistency(Trajectory.of(List.of(PoseTestUtils.translation(0.3, 0, 0)))));
        Pose p = PoseTestUtils.pose(0.1, 0, 0, 0.2, 0, 0);
        assertEquals(0.0, cascade.timingConsistency(Trajectory.of(List.of(p, p, p))));
    }

    @Test
    void temporal_isZeroForEvenSteps_andPositiveForUneven() {
        VerificationCascade cascade = new VerificationCascade();
        Trajectory even = Trajectory.of(List.of(
                PoseTestUtils.translation(0.0, 0, 0),
                PoseTestUtils.translation(0.25, 0, 0),
                PoseTestUtils.translation(0.5, 0, 0),
                PoseTestUtils.translation(0.75, 0, 0)));
        assertEquals(0.0, cascade.timingConsistency(even), 1e-12);

        // steps 0.1 and 0.3: mean 0.2, population std 0.1
        Trajectory uneven = Trajectory.of(List.of(
                PoseTestUtils.translation(0.0, 0, 0),
                PoseTestUtils.translation(0.1, 0, 0),
                PoseTestUtils.translation(0.4, 0, 0)));
        assertEquals(0.5, cascade.timingConsistency(uneven), 1e-12);
    }

    @Test
    void energetic_isMeanWorkOverScaledDoubledPoses() {
        VerificationCascade cascade = new VerificationCascade();
        Trajectory t = Trajectory.of(List.of(PoseTestUtils.translation(0.2, 0, 0), PoseTestUtils.pose(0.3, 0, 0, 0, 0, 0)));
        // per pose: 0.2 and 0.3, repeated; scaled by 0.5
        assertEquals(0.125, cascade.energyConservation(t, 0.5), 1e-12);
    }

    @Test
    void overall_isWeightedSumOfNormalizedScores_andRewardScalesIt() {
        Trajectory t = Trajectories.random(5, new Random(9));
        VerificationResult r = seeded(17L).verify(t, 0.9, BASE);
        CascadeConfig c = CascadeConfig.defaults();
        double expected = 0.0;
        for (VerificationLevel level : VerificationLevel.values()) {
            expected += c.weight(level) * r.normalized(level);
        }
        assertEquals(expected, r.overallScore(), 1e-12);
        assertEquals(r.overallScore() * BASE, r.reward(), 1e-9);
        assertTrue(r.overallScore() >= 0.0 && r.overallScore() <= 1.0);
        assertEquals(Math.max(0.0, 1.0 - r.raw(TOPOLOGICAL) / 2.0), r.normalized(TOPOLOGICAL), 1e-12);
        assertEquals(Math.max(0.0, 1.0 - r.raw(ENERGETIC) / 0.5), r.normalized(ENERGETIC), 1e-12);
        assertEquals(Math.max(0.0, 1.0 - r.raw(TEMPORAL)), r.normalized(TEMPORAL), 1e-12);
    }

    @Test
    void topological_matchesObjective() {
        Trajectory t = Trajectory.of(PoseTestUtils.square());
        VerificationResult r = seeded(2L).verify(t, 1.3, BASE);
        assertEquals(ReturnObjective.returnError(t, 1.3, true), r.raw(TOPOLOGICAL), 0.0);
    }

    @Test
    void stochastic_isReproducibleWithSeed_sequentialOrParallel() {
        Trajectory t = Trajectories.random(6, new Random(4));
        ReturnObjective objective = ReturnObjective.doubled(t);

        double a = seeded(99L).noiseRobustness(objective, 1.0);
        double b = seeded(99L).noiseRobustness(objective, 1.0);
        double parallel = new VerificationCascade(CascadeConfig.builder().seed(99L).parallelTrials(true).build())
                .noiseRobustness(objective, 1.0);

        assertEquals(a, b, 0.0);
        assertEquals(a, parallel, 0.0);
        assertTrue(a >= 0.0 && a <= 1.0);
    }

    @Test
    void zeroNoise_isFullyRobust() {
        Trajectory t = Trajectory.of(PoseTestUtils.square());
        VerificationCascade cascade = new VerificationCascade(CascadeConfig.builder().seed(1L).noiseStd(0.0).build());
        assertEquals(1.0, cascade.noiseRobustness(ReturnObjective.doubled(t), 1.0), 1e-9);
    }

    @Test
    void tracer_seesEveryLevelInOrder() {
        List<VerificationLevel> seen = new ArrayList<>();
        ReturnTracer tracer = new ReturnTracer() {
            @Override
            public void evaluation(double lambda, double error) {}

            @Override
            public void optimized(ReturnResult result) {}

            @Override
            public void level(VerificationLevel level, double raw, double normalized) {
                seen.add(level);
            }
        };
        new VerificationCascade(CascadeConfig.builder().seed(1L).build(), tracer)
                .verify(Trajectory.of(PoseTestUtils.square()), 1.0, BASE);
        assertEquals(List.of(VerificationLevel.values()), seen);
    }

    @Test
    void config_rejectsBadValues() {
        assertThrows(IllegalArgumentException.class, () -> CascadeConfig.builder().weight(TOPOLOGICAL, -0.1).build());
        assertThrows(IllegalArgumentException.class, () -> CascadeConfig.builder().weight(TOPOLOGICAL, 0.9).build());
        assertThrows(IllegalArgumentException.class, () -> CascadeConfig.builder().noiseTrials(0).build());
        assertThrows(IllegalArgumentException.class, () -> CascadeConfig.builder().energeticScale(0.0).build());
    }

    @Test
    void weights_replacementZeroesMissingLevels() {
        Map<VerificationLevel, Double> only = new EnumMap<>(VerificationLevel.class);
        only.put(TOPOLOGICAL, 1.0);
        CascadeConfig c = CascadeConfig.builder().weights(only).seed(1L).build();
        assertEquals(0.0, c.weight(STOCHASTIC));

        Trajectory t = Trajectory.of(PoseTestUtils.square());
        VerificationResult r = new VerificationCascade(c).verify(t, 1.0, BASE);
        assertEquals(r.normalized(TOPOLOGICAL), r.overallScore(), 1e-12);
    }
}
