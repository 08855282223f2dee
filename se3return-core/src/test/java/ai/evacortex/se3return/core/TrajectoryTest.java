/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.core;

import ai.evacortex.se3return.core.exceptions.BoundsViolationException;
import ai.evacortex.se3return.core.exceptions.DimensionMismatchException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Trajectory container")
class TrajectoryTest {

    @Test
    void emptyTrajectory_isDimensionMismatch() {
        assertThrows(DimensionMismatchException.class, () -> Trajectory.of(List.of()));
        assertEquals(ErrorKind.DIMENSION_MISMATCH, Trajectory.tryOf(List.of(), true, 1.0).failure().kind());
    }

    @Test
    void bounded_rejectsTranslationBeyondRMax() {
        List<Pose> poses = List.of(PoseTestUtils.translation(0.2, 0, 0), PoseTestUtils.translation(0, 1.5, 0));
        assertThrows(BoundsViolationException.class, () -> Trajectory.of(poses, true, 1.0));
        assertEquals(ErrorKind.BOUNDS_VIOLATION, Trajectory.tryOf(poses, true, 1.0).failure().kind());
    }

    @Test
    void unbounded_acceptsLargeTranslations() {
        Trajectory t = Trajectory.of(List.of(PoseTestUtils.translation(50, 0, 0)), false, 1.0);
        assertTrue(t.withinBounds());
        assertFalse(t.bounded());
    }

    @Test
    void invalidRMax_isBoundsViolation() {
        List<Pose> poses = List.of(Pose.identity());
        assertEquals(ErrorKind.BOUNDS_VIOLATION, Trajectory.tryOf(poses, true, 0.0).failure().kind());
        assertEquals(ErrorKind.BOUNDS_VIOLATION, Trajectory.tryOf(poses, true, Double.NaN).failure().kind());
    }

    @Test
    void scale_keepsBoundParametersWithoutRevalidation() {
        Trajectory t = Trajectory.of(List.of(PoseTestUtils.translation(0.8, 0, 0)), true, 1.0);
        Trajectory scaled = t.scale(2.0);
        assertTrue(scaled.bounded());
        assertEquals(1.0, scaled.rMax());
        assertEquals(1.6, scaled.get(0).translation().x, 1e-12);
        assertFalse(scaled.withinBounds(), "scaled translation exceeds r_max but scaling must not throw");
    }

    @Test
    void doubled_repeatsPosesInOrder() {
        List<Pose> poses = PoseTestUtils.square();
        Trajectory t = Trajectory.of(poses);
        Trajectory d = t.doubled();
        assertEquals(8, d.size());
        for (int i = 0; i < 4; i++) {
            assertEquals(poses.get(i), d.get(i));
            assertEquals(poses.get(i), d.get(i + 4));
        }
    }

    @Test
    void compose_isOrderedProduct() {
        Pose a = PoseTestUtils.pose(0, 0, Math.PI / 2, 0, 0, 0);
        Pose b = PoseTestUtils.translation(0.5, 0, 0);
        Trajectory t = Trajectory.of(List.of(a, b));
        assertTrue(t.compose().approxEquals(Pose.compose(a, b), 1e-12));
    }

    @Test
    void poses_isUnmodifiable() {
        Trajectory t = Trajectory.of(PoseTestUtils.square());
        assertThrows(UnsupportedOperationException.class, () -> t.poses().add(Pose.identity()));
    }

    @Test
    void closedLoop_composesToIdentity() {
        Trajectory loop = PoseTestUtils.closedLoop(7L);
        assertEquals(4, loop.size());
        assertTrue(loop.compose().approxEquals(Pose.identity(), 1e-12));
    }

    @Test
    void random_isReproducibleAndBounded() {
        Trajectory a = Trajectories.random(6, new Random(42));
        Trajectory b = Trajectories.random(6, new Random(42));
        assertEquals(6, a.size());
        for (int i = 0; i < a.size(); i++) {
            assertEquals(a.get(i), b.get(i));
        }
        assertTrue(a.withinBounds());
    }
}
