/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.core.math;

import java.util.Locale;

/**
 * Immutable 3-dimensional real vector used for translations and rotation generators.
 */
public final class Vector3 {

    public static final Vector3 ZERO = new Vector3(0.0, 0.0, 0.0);

    public final double x;
    public final double y;
    public final double z;

    public Vector3(double x, double y, double z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }

    public static Vector3 of(double[] values) {
        if (values.length != 3) {
            throw new IllegalArgumentException("Expected 3 components, got " + values.length);
        }
        return new Vector3(values[0], values[1], values[2]);
    }

    public Vector3 add(Vector3 other) {
        return new Vector3(x + other.x, y + other.y, z + other.z);
    }

    public Vector3 subtract(Vector3 other) {
        return new Vector3(x - other.x, y - other.y, z - other.z);
    }

    public Vector3 scale(double factor) {
        return new Vector3(x * factor, y * factor, z * factor);
    }

    public Vector3 negate() {
        return new Vector3(-x, -y, -z);
    }

    public double dot(Vector3 other) {
        return x * other.x + y * other.y + z * other.z;
    }

    public double norm() {
        return Math.sqrt(normSquared());
    }

    public double normSquared() {
        return x * x + y * y + z * z;
    }

    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y) && Double.isFinite(z);
    }

    public double[] toArray() {
        return new double[]{x, y, z};
    }

    public boolean approxEquals(Vector3 other, double tolerance) {
        return Math.abs(x - other.x) <= tolerance
                && Math.abs(y - other.y) <= tolerance
                && Math.abs(z - other.z) <= tolerance;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "[%f, %f, %f]", x, y, z);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Vector3)) return false;
        Vector3 other = (Vector3) obj;
        return Double.compare(x, other.x) == 0
                && Double.compare(y, other.y) == 0
                && Double.compare(z, other.z) == 0;
    }

    @Override
    public int hashCode() {
        return (Double.hashCode(x) * 31 + Double.hashCode(y)) * 31 + Double.hashCode(z);
    }
}
