/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.core;

import ai.evacortex.se3return.core.exceptions.InvalidScaleException;
import ai.evacortex.se3return.core.math.Matrix3;
import ai.evacortex.se3return.core.math.Quaternion;
import ai.evacortex.se3return.core.math.Rotations;
import ai.evacortex.se3return.core.math.Vector3;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable rigid motion g = [R p; 0 1] with R ∈ SO(3) and p ∈ ℝ³.
 *
 * <p>The rotation is always held as a 3x3 matrix; axis-angle vectors and quaternions are
 * converted at construction time and never seen by the algebra below.</p>
 */
public final class Pose {

    private static final Pose IDENTITY = new Pose(Matrix3.IDENTITY, Vector3.ZERO);

    private final Matrix3 rotation;
    private final Vector3 translation;

    private Pose(Matrix3 rotation, Vector3 translation) {
        this.rotation = rotation;
        this.translation = translation;
    }

    public static Pose identity() {
        return IDENTITY;
    }

    /**
     * @throws ai.evacortex.se3return.core.exceptions.InvalidPoseException if the rotation is not
     *         orthogonal with determinant +1 within {@link Rotations#TOLERANCE}, or the translation is not finite
     */
    public static Pose of(Matrix3 rotation, Vector3 translation) {
        return tryOf(rotation, translation).orElseThrow();
    }

    public static Result<Pose> tryOf(Matrix3 rotation, Vector3 translation) {
        Objects.requireNonNull(rotation, "rotation must not be null");
        Objects.requireNonNull(translation, "translation must not be null");
        Optional<String> problem = Rotations.validate(rotation, Rotations.TOLERANCE);
        if (problem.isPresent()) {
            return Result.failure(ErrorKind.INVALID_POSE, problem.get());
        }
        if (!translation.isFinite()) {
            return Result.failure(ErrorKind.INVALID_POSE, "translation contains non-finite components");
        }
        return Result.ok(new Pose(rotation, translation));
    }

    public static Pose fromRotationVector(Vector3 rotationVector, Vector3 translation) {
        return tryFromRotationVector(rotationVector, translation).orElseThrow();
    }

    public static Result<Pose> tryFromRotationVector(Vector3 rotationVector, Vector3 translation) {
        Objects.requireNonNull(rotationVector, "rotationVector must not be null");
        if (!rotationVector.isFinite()) {
            return Result.failure(ErrorKind.INVALID_POSE, "rotation vector contains non-finite components");
        }
        return tryOf(Rotations.fromRotationVector(rotationVector), translation);
    }

    public static Pose fromQuaternion(Quaternion quaternion, Vector3 translation) {
        return tryFromQuaternion(quaternion, translation).orElseThrow();
    }

    public static Result<Pose> tryFromQuaternion(Quaternion quaternion, Vector3 translation) {
        Objects.requireNonNull(quaternion, "quaternion must not be null");
        double norm = quaternion.norm();
        if (norm == 0.0 || !Double.isFinite(norm)) {
            return Result.failure(ErrorKind.INVALID_POSE, "quaternion must have finite, non-zero norm");
        }
        return tryOf(Rotations.fromQuaternion(quaternion), translation);
    }

    /**
     * Group product {@code a · b}: {@code b} is applied first, then {@code a}.
     */
    public static Pose compose(Pose a, Pose b) {
        return new Pose(
                a.rotation.multiply(b.rotation),
                a.rotation.multiply(b.translation).add(a.translation));
    }

    public Pose compose(Pose next) {
        return compose(this, next);
    }

    public Pose inverse() {
        Matrix3 rt = rotation.transpose();
        return new Pose(rt, rt.multiply(translation).negate());
    }

    /**
     * Scales the pose by {@code lambda}: the rotation through its Lie algebra
     * (R^λ = exp(λ·log R)), the translation linearly (λ·p).
     *
     * @throws InvalidScaleException if {@code lambda} is NaN or infinite
     */
    public Pose scale(double lambda) {
        if (!Double.isFinite(lambda)) {
            throw new InvalidScaleException("scale factor must be finite, was " + lambda);
        }
        if (lambda == 1.0) {
            return this;
        }
        Vector3 generator = Rotations.toRotationVector(rotation).scale(lambda);
        return new Pose(Rotations.fromRotationVector(generator), translation.scale(lambda));
    }

    /**
     * ‖R − I‖_F + ‖p‖₂. Zero exactly at the identity.
     */
    public double distanceToIdentity() {
        return rotationError() + translationError();
    }

    public double rotationError() {
        return rotation.subtract(Matrix3.IDENTITY).frobeniusNorm();
    }

    public double translationError() {
        return translation.norm();
    }

    public Matrix3 rotation() {
        return rotation;
    }

    public Vector3 translation() {
        return translation;
    }

    public Vector3 rotationVector() {
        return Rotations.toRotationVector(rotation);
    }

    public Quaternion quaternion() {
        return Rotations.toQuaternion(rotation);
    }

    public boolean approxEquals(Pose other, double tolerance) {
        return rotation.maxAbsDifference(other.rotation) <= tolerance
                && translation.approxEquals(other.translation, tolerance);
    }

    @Override
    public String toString() {
        return "Pose{rotation=" + rotationVector() + ", translation=" + translation + '}';
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Pose)) return false;
        Pose other = (Pose) obj;
        return rotation.equals(other.rotation) && translation.equals(other.translation);
    }

    @Override
    public int hashCode() {
        return rotation.hashCode() * 31 + translation.hashCode();
    }
}
