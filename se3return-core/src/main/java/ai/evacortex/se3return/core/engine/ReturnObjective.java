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
import ai.evacortex.se3return.core.Trajectory;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

/**
 * The return objective ε(λ) = ‖compose(double(scale(traj, λ))) − I‖, with the doubling optional.
 *
 * <p>{@link #returnError(Trajectory, double, boolean)} is the single definition of this cost.
 * The optimizer, the resonance detector and the verification cascade all evaluate it through
 * here so their numbers stay bit-for-bit comparable.</p>
 *
 * <p>An instance binds one trajectory and memoizes evaluations in a small per-instance cache,
 * so the same λ probed by different components is computed once. Instances are thread-safe.</p>
 */
public final class ReturnObjective implements DoubleUnaryOperator {

    private static final int CACHE_SIZE = 1024;

    private final Trajectory trajectory;
    private final boolean doubled;
    private final Cache<Double, Double> evaluations;

    private ReturnObjective(Trajectory trajectory, boolean doubled) {
        this.trajectory = Objects.requireNonNull(trajectory, "trajectory must not be null");
        this.doubled = doubled;
        this.evaluations = Caffeine.newBuilder()
                .maximumSize(CACHE_SIZE)
                .build();
    }

    public static ReturnObjective of(Trajectory trajectory, boolean doubled) {
        return new ReturnObjective(trajectory, doubled);
    }

    public static ReturnObjective doubled(Trajectory trajectory) {
        return new ReturnObjective(trajectory, true);
    }

    /**
     * @throws ai.evacortex.se3return.core.exceptions.InvalidScaleException if {@code lambda} is not finite
     */
    public static double returnError(Trajectory trajectory, double lambda, boolean doubled) {
        return finalPose(trajectory, lambda, doubled).distanceToIdentity();
    }

    public static double returnError(Trajectory trajectory, double lambda) {
        return returnError(trajectory, lambda, true);
    }

    /**
     * Total transformation after scaling and optional doubling. Its distance to the identity is the return error.
     */
    public static Pose finalPose(Trajectory trajectory, double lambda, boolean doubled) {
        Trajectory scaled = trajectory.scale(lambda);
        if (doubled) {
            scaled = scaled.doubled();
        }
        return scaled.compose();
    }

    /**
     * Breaks the return error at {@code lambda} into its rotation and translation parts and
     * checks it against {@code tolerance}.
     */
    public static ReturnVerification verifyApproximateReturn(Trajectory trajectory, double lambda,
                                                             double tolerance, boolean doubled) {
        Pose total = finalPose(trajectory, lambda, doubled);
        double rotationError = total.rotationError();
        double translationError = total.translationError();
        double totalError = rotationError + translationError;
        return new ReturnVerification(totalError, rotationError, translationError,
                totalError < tolerance, tolerance, lambda);
    }

    public static ReturnVerification verifyApproximateReturn(Trajectory trajectory, double lambda) {
        return verifyApproximateReturn(trajectory, lambda, ReturnVerification.DEFAULT_TOLERANCE, true);
    }

    @Override
    public double applyAsDouble(double lambda) {
        return evaluations.get(lambda, l -> returnError(trajectory, l, doubled));
    }

    public Trajectory trajectory() {
        return trajectory;
    }

    public boolean isDoubled() {
        return doubled;
    }
}
