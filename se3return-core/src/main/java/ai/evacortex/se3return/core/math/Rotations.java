/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.core.math;

import java.util.Optional;

/**
 * Conversions between the canonical rotation matrix and its boundary representations
 * (axis-angle vector, unit quaternion).
 *
 * <p>Both the exponential and the logarithm map go through the quaternion, which keeps the
 * logarithm well conditioned near the antipodal boundary (angle ≈ π) where the
 * {@code (R - Rᵀ) / 2 sin θ} form divides by zero.</p>
 */
public final class Rotations {

    /** Default tolerance for orthogonality and determinant checks. */
    public static final double TOLERANCE = 1e-6;

    private static final double SMALL_ANGLE = 1e-3;

    private Rotations() {}

    /**
     * Exponential map: axis-angle vector (direction = axis, length = angle in radians) to matrix.
     */
    public static Matrix3 fromRotationVector(Vector3 rotationVector) {
        return fromQuaternion(quaternionFromRotationVector(rotationVector));
    }

    /**
     * Logarithm map: rotation matrix to axis-angle vector with angle in [0, π].
     */
    public static Vector3 toRotationVector(Matrix3 rotation) {
        return rotationVectorFromQuaternion(toQuaternion(rotation));
    }

    public static Quaternion quaternionFromRotationVector(Vector3 v) {
        double angle = v.norm();
        double scale;
        if (angle <= SMALL_ANGLE) {
            double a2 = angle * angle;
            scale = 0.5 - a2 / 48.0 + a2 * a2 / 3840.0;
        } else {
            scale = Math.sin(angle / 2.0) / angle;
        }
        return new Quaternion(scale * v.x, scale * v.y, scale * v.z, Math.cos(angle / 2.0));
    }

    public static Vector3 rotationVectorFromQuaternion(Quaternion q) {
        Quaternion c = q.canonical();
        double vectorNorm = Math.sqrt(c.x() * c.x() + c.y() * c.y() + c.z() * c.z());
        double angle = 2.0 * Math.atan2(vectorNorm, c.w());
        double scale;
        if (angle <= SMALL_ANGLE) {
            double a2 = angle * angle;
            scale = 2.0 + a2 / 12.0 + 7.0 * a2 * a2 / 2880.0;
        } else {
            scale = angle / Math.sin(angle / 2.0);
        }
        return new Vector3(scale * c.x(), scale * c.y(), scale * c.z());
    }

    public static Matrix3 fromQuaternion(Quaternion quaternion) {
        Quaternion q = quaternion.normalize();
        double x = q.x(), y = q.y(), z = q.z(), w = q.w();
        return Matrix3.ofRowMajor(
                1 - 2 * (y * y + z * z), 2 * (x * y - z * w), 2 * (x * z + y * w),
                2 * (x * y + z * w), 1 - 2 * (x * x + z * z), 2 * (y * z - x * w),
                2 * (x * z - y * w), 2 * (y * z + x * w), 1 - 2 * (x * x + y * y));
    }

    /**
     * Shepperd's method: pick the largest of the diagonal entries and the trace as pivot.
     */
    public static Quaternion toQuaternion(Matrix3 r) {
        double[] decision = {r.get(0, 0), r.get(1, 1), r.get(2, 2), r.trace()};
        int choice = 0;
        for (int i = 1; i < 4; i++) {
            if (decision[i] > decision[choice]) choice = i;
        }

        double[] q = new double[4];
        if (choice != 3) {
            int i = choice;
            int j = (i + 1) % 3;
            int k = (j + 1) % 3;
            q[i] = 1.0 - decision[3] + 2.0 * r.get(i, i);
            q[j] = r.get(j, i) + r.get(i, j);
            q[k] = r.get(k, i) + r.get(i, k);
            q[3] = r.get(k, j) - r.get(j, k);
        } else {
            q[0] = r.get(2, 1) - r.get(1, 2);
            q[1] = r.get(0, 2) - r.get(2, 0);
            q[2] = r.get(1, 0) - r.get(0, 1);
            q[3] = 1.0 + decision[3];
        }
        return new Quaternion(q[0], q[1], q[2], q[3]).normalize();
    }

    /**
     * Checks that {@code r} is a proper rotation: finite, orthogonal and with determinant +1.
     *
     * @return a description of the first violated condition, or empty when valid
     */
    public static Optional<String> validate(Matrix3 r, double tolerance) {
        if (!r.isFinite()) {
            return Optional.of("rotation contains non-finite entries");
        }
        double det = r.determinant();
        if (Math.abs(det - 1.0) > tolerance) {
            return Optional.of("rotation determinant must be 1, was " + det);
        }
        double deviation = r.multiply(r.transpose()).maxAbsDifference(Matrix3.IDENTITY);
        if (deviation > tolerance) {
            return Optional.of("rotation must be orthogonal, |R·Rᵀ - I| = " + deviation);
        }
        return Optional.empty();
    }
}
