/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.core;

import ai.evacortex.se3return.core.math.Vector3;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Synthetic trajectory generators.
 */
public final class Trajectories {

    private Trajectories() {}

    /**
     * Random walk of {@code length} small steps: rotation vectors drawn from N(0, rotationScale²)
     * and translations from N(0, (rMax / length)²) per component.
     *
     * @throws ai.evacortex.se3return.core.exceptions.BoundsViolationException if {@code bounded}
     *         and a drawn translation exceeds {@code rMax}
     */
    public static Trajectory random(int length, double rMax, double rotationScale, boolean bounded, Random random) {
        if (length <= 0) {
            throw new IllegalArgumentException("length must be > 0");
        }
        List<Pose> poses = new ArrayList<>(length);
        double translationScale = rMax / length;
        for (int i = 0; i < length; i++) {
            Vector3 rotation = gaussian(random, rotationScale);
            Vector3 translation = gaussian(random, translationScale);
            poses.add(Pose.fromRotationVector(rotation, translation));
        }
        return Trajectory.of(poses, bounded, rMax);
    }

    public static Trajectory random(int length, Random random) {
        return random(length, Trajectory.DEFAULT_R_MAX, 0.1, true, random);
    }

    /**
     * {@code steps} followed by their inverses in reverse order. Composes exactly to the identity.
     */
    public static Trajectory closedLoop(List<Pose> steps, boolean bounded, double rMax) {
        List<Pose> poses = new ArrayList<>(steps.size() * 2);
        poses.addAll(steps);
        for (int i = steps.size() - 1; i >= 0; i--) {
            poses.add(steps.get(i).inverse());
        }
        return Trajectory.of(poses, bounded, rMax);
    }

    static Vector3 gaussian(Random random, double std) {
        return new Vector3(random.nextGaussian() * std, random.nextGaussian() * std, random.nextGaussian() * std);
    }
}
