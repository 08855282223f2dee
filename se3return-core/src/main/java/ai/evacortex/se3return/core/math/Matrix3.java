/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.core.math;

import java.util.Arrays;

/**
 * Immutable 3x3 real matrix stored in row-major order.
 */
public final class Matrix3 {

    public static final Matrix3 IDENTITY = new Matrix3(new double[]{
            1.0, 0.0, 0.0,
            0.0, 1.0, 0.0,
            0.0, 0.0, 1.0
    });

    private final double[] m;

    private Matrix3(double[] rowMajor) {
        this.m = rowMajor;
    }

    public static Matrix3 ofRowMajor(double... values) {
        if (values.length != 9) {
            throw new IllegalArgumentException("Expected 9 entries, got " + values.length);
        }
        return new Matrix3(values.clone());
    }

    public static Matrix3 ofRows(double[][] rows) {
        if (rows.length != 3) {
            throw new IllegalArgumentException("Expected 3 rows, got " + rows.length);
        }
        double[] values = new double[9];
        for (int r = 0; r < 3; r++) {
            if (rows[r].length != 3) {
                throw new IllegalArgumentException("Row " + r + " has " + rows[r].length + " entries, expected 3");
            }
            System.arraycopy(rows[r], 0, values, r * 3, 3);
        }
        return new Matrix3(values);
    }

    public double get(int row, int col) {
        return m[row * 3 + col];
    }

    public Matrix3 multiply(Matrix3 other) {
        double[] out = new double[9];
        for (int r = 0; r < 3; r++) {
            for (int c = 0; c < 3; c++) {
                out[r * 3 + c] = m[r * 3] * other.m[c]
                        + m[r * 3 + 1] * other.m[3 + c]
                        + m[r * 3 + 2] * other.m[6 + c];
            }
        }
        return new Matrix3(out);
    }

    public Vector3 multiply(Vector3 v) {
        return new Vector3(
                m[0] * v.x + m[1] * v.y + m[2] * v.z,
                m[3] * v.x + m[4] * v.y + m[5] * v.z,
                m[6] * v.x + m[7] * v.y + m[8] * v.z);
    }

    public Matrix3 transpose() {
        return new Matrix3(new double[]{
                m[0], m[3], m[6],
                m[1], m[4], m[7],
                m[2], m[5], m[8]
        });
    }

    public Matrix3 subtract(Matrix3 other) {
        double[] out = new double[9];
        for (int i = 0; i < 9; i++) out[i] = m[i] - other.m[i];
        return new Matrix3(out);
    }

    public double trace() {
        return m[0] + m[4] + m[8];
    }

    public double determinant() {
        return m[0] * (m[4] * m[8] - m[5] * m[7])
                - m[1] * (m[3] * m[8] - m[5] * m[6])
                + m[2] * (m[3] * m[7] - m[4] * m[6]);
    }

    public double frobeniusNorm() {
        double sum = 0.0;
        for (double v : m) sum += v * v;
        return Math.sqrt(sum);
    }

    /** Largest absolute entry-wise difference. */
    public double maxAbsDifference(Matrix3 other) {
        double max = 0.0;
        for (int i = 0; i < 9; i++) {
            max = Math.max(max, Math.abs(m[i] - other.m[i]));
        }
        return max;
    }

    public boolean isFinite() {
        for (double v : m) {
            if (!Double.isFinite(v)) return false;
        }
        return true;
    }

    public double[] toRowMajor() {
        return m.clone();
    }

    public double[][] toRows() {
        return new double[][]{
                {m[0], m[1], m[2]},
                {m[3], m[4], m[5]},
                {m[6], m[7], m[8]}
        };
    }

    @Override
    public String toString() {
        return Arrays.deepToString(toRows());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Matrix3)) return false;
        return Arrays.equals(m, ((Matrix3) obj).m);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(m);
    }
}
