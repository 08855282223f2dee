/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, non-empty, immutable sequence of {@link Pose}s with a translation-radius bound.
 *
 * <p>When {@code bounded} is set, construction checks ‖p‖ ≤ r_max for every pose. Trajectories
 * derived by {@link #scale(double)} and {@link #doubled()} carry the original bound parameters
 * but are <em>not</em> re-validated: the optimizer probes scales above 1 that may push
 * translations past r_max, and those probes must still be evaluable. The spatial verification
 * level reports such trajectories as out of bounds.</p>
 */
public final class Trajectory {

    public static final double DEFAULT_R_MAX = 1.0;

    private final List<Pose> poses;
    private final boolean bounded;
    private final double rMax;

    private Trajectory(List<Pose> poses, boolean bounded, double rMax) {
        this.poses = poses;
        this.bounded = bounded;
        this.rMax = rMax;
    }

    public static Trajectory of(List<Pose> poses, boolean bounded, double rMax) {
        return tryOf(poses, bounded, rMax).orElseThrow();
    }

    public static Trajectory of(List<Pose> poses) {
        return of(poses, true, DEFAULT_R_MAX);
    }

    public static Result<Trajectory> tryOf(List<Pose> poses, boolean bounded, double rMax) {
        Objects.requireNonNull(poses, "poses must not be null");
        if (poses.isEmpty()) {
            return Result.failure(ErrorKind.DIMENSION_MISMATCH, "trajectory must contain at least one pose");
        }
        if (!(rMax > 0.0) || !Double.isFinite(rMax)) {
            return Result.failure(ErrorKind.BOUNDS_VIOLATION, "r_max must be positive and finite, was " + rMax);
        }
        List<Pose> copy = List.copyOf(poses);
        if (bounded) {
            for (int i = 0; i < copy.size(); i++) {
                double norm = copy.get(i).translation().norm();
                if (norm > rMax) {
                    return Result.failure(ErrorKind.BOUNDS_VIOLATION,
                            "translation norm " + norm + " of pose " + i + " exceeds r_max " + rMax);
                }
            }
        }
        return Result.ok(new Trajectory(copy, bounded, rMax));
    }

    /**
     * Left fold of {@link Pose#compose(Pose, Pose)} from the identity: g₁ · g₂ · … · g_T.
     */
    public Pose compose() {
        Pose result = Pose.identity();
        for (Pose pose : poses) {
            result = Pose.compose(result, pose);
        }
        return result;
    }

    /** Scales every pose independently; bound parameters are kept, not re-checked. */
    public Trajectory scale(double lambda) {
        List<Pose> scaled = new ArrayList<>(poses.size());
        for (Pose pose : poses) {
            scaled.add(pose.scale(lambda));
        }
        return new Trajectory(Collections.unmodifiableList(scaled), bounded, rMax);
    }

    /** The sequence concatenated with itself. */
    public Trajectory doubled() {
        List<Pose> twice = new ArrayList<>(poses.size() * 2);
        twice.addAll(poses);
        twice.addAll(poses);
        return new Trajectory(Collections.unmodifiableList(twice), bounded, rMax);
    }

    /**
     * Same poses with their translations and rotation generators replaced, used for perturbation
     * trials. Bound parameters are carried over without re-validation, like {@link #scale(double)}.
     */
    public Trajectory withPoses(List<Pose> replacement) {
        if (replacement.size() != poses.size()) {
            throw new IllegalArgumentException("Replacement must keep length " + poses.size());
        }
        return new Trajectory(List.copyOf(replacement), bounded, rMax);
    }

    /** True when every translation lies within r_max, or the trajectory is unbounded. */
    public boolean withinBounds() {
        if (!bounded) return true;
        for (Pose pose : poses) {
            if (pose.translation().norm() > rMax) return false;
        }
        return true;
    }

    public List<Pose> poses() {
        return poses;
    }

    public Pose get(int index) {
        return poses.get(index);
    }

    public int size() {
        return poses.size();
    }

    public boolean bounded() {
        return bounded;
    }

    public double rMax() {
        return rMax;
    }

    @Override
    public String toString() {
        return "Trajectory{size=" + poses.size() + ", bounded=" + bounded + ", rMax=" + rMax + '}';
    }
}
