/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.core.math;

/**
 * Unit quaternion in scalar-last (x, y, z, w) order.
 */
public record Quaternion(double x, double y, double z, double w) {

    public static final Quaternion IDENTITY = new Quaternion(0.0, 0.0, 0.0, 1.0);

    public double norm() {
        return Math.sqrt(x * x + y * y + z * z + w * w);
    }

    public Quaternion normalize() {
        double n = norm();
        if (n == 0.0 || !Double.isFinite(n)) {
            throw new IllegalArgumentException("Quaternion must have finite, non-zero norm");
        }
        return new Quaternion(x / n, y / n, z / n, w / n);
    }

    /** Same rotation with a non-negative scalar part. */
    public Quaternion canonical() {
        return w < 0.0 ? new Quaternion(-x, -y, -z, -w) : this;
    }

    public double[] toArray() {
        return new double[]{x, y, z, w};
    }
}
