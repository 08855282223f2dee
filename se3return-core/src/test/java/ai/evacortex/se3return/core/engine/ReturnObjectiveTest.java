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
import ai.evacortex.se3return.core.PoseTestUtils;
import ai.evacortex.se3return.core.Trajectory;
import ai.evacortex.se3return.core.exceptions.InvalidScaleException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Return objective")
class ReturnObjectiveTest {

    @Test
    void identityTrajectory_hasZeroErrorEverywhere() {
        Trajectory t = Trajectory.of(List.of(Pose.identity(), Pose.identity()));
        for (double lambda : new double[] {0.1, 0.618, 1.0, 2.0}) {
            assertEquals(0.0, ReturnObjective.returnError(t, lambda), 0.0);
        }
    }

    @Test
    void pureTranslation_scalesLinearly_andDoublingDoubles() {
        Trajectory t = Trajectory.of(List.of(PoseTestUtils.translation(0.3, 0, 0)));
        assertEquals(1.2, ReturnObjective.returnError(t, 2.0, true), 1e-12);
        assertEquals(0.6, ReturnObjective.returnError(t, 2.0, false), 1e-12);
    }

    @Test
    void closedLoop_returnsExactlyAtUnitScale() {
        Trajectory loop = PoseTestUtils.closedLoop(21L);
        assertTrue(ReturnObjective.returnError(loop, 1.0) < 1e-12);
    }

    @Test
    void halfTurnDoubled_returnsToIdentity() {
        // Rz(2)^λ doubled is Rz(4λ): identity at λ = π/2
        Trajectory t = Trajectory.of(List.of(PoseTestUtils.screw(2.0, 0.0)));
        assertTrue(ReturnObjective.returnError(t, Math.PI / 2) < 1e-9);
        assertTrue(ReturnObjective.returnError(t, 1.0) > 1.0);
    }

    @Test
    void instance_matchesStaticDefinition() {
        Trajectory t = Trajectory.of(PoseTestUtils.square());
        ReturnObjective objective = ReturnObjective.doubled(t);
        double first = objective.applyAsDouble(0.8);
        assertEquals(ReturnObjective.returnError(t, 0.8, true), first, 0.0);
        assertEquals(first, objective.applyAsDouble(0.8), 0.0);

        ReturnObjective single = ReturnObjective.of(t, false);
        assertFalse(single.isDoubled());
        assertEquals(ReturnObjective.returnError(t, 0.8, false), single.applyAsDouble(0.8), 0.0);
    }

    @Test
    void nonFiniteLambda_isInvalidScale() {
        Trajectory t = Trajectory.of(PoseTestUtils.square());
        assertThrows(InvalidScaleException.class, () -> ReturnObjective.returnError(t, Double.NaN));
        assertThrows(InvalidScaleException.class, () -> ReturnObjective.doubled(t).applyAsDouble(Double.NEGATIVE_INFINITY));
    }

    @Test
    void verifyApproximateReturn_splitsErrorAndAppliesTolerance() {
        Trajectory t = Trajectory.of(List.of(PoseTestUtils.translation(0.02, 0, 0)));

        ReturnVerification v = ReturnObjective.verifyApproximateReturn(t, 2.0);
        assertEquals(0.08, v.totalError(), 1e-12);
        assertEquals(0.0, v.rotationError(), 1e-12);
        assertEquals(0.08, v.translationError(), 1e-12);
        assertTrue(v.returnAchieved());
        assertEquals(ReturnVerification.DEFAULT_TOLERANCE, v.tolerance());

        ReturnVerification strict = ReturnObjective.verifyApproximateReturn(t, 2.0, 0.05, true);
        assertFalse(strict.returnAchieved());
        assertEquals(2.0, strict.lambda());
    }
}
