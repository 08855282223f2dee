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
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InterferenceTest {

    @Test
    void identityAction_leavesOnlyTheHomogeneousCorner() {
        Pose b = PoseTestUtils.pose(0.3, 0.2, -0.1, 0.4, 0, 0.2);
        assertEquals(1.0, Interference.predict(Pose.identity(), b), 1e-12);
    }

    @Test
    void coaxialScrews_doNotInterfere() {
        assertEquals(1.0, Interference.predict(PoseTestUtils.screw(0.7, 0.1), PoseTestUtils.screw(-0.3, 0.2)), 1e-12);
    }

    @Test
    void crossedInterventions_scoreAboveBaseline() {
        Pose a = PoseTestUtils.pose(Math.PI / 2, 0, 0, 0, 0, 0);
        Pose b = PoseTestUtils.pose(0, 0.5, 0, 0, 0.3, 0);
        assertTrue(Interference.predict(a, b) > 1.1);
    }
}
