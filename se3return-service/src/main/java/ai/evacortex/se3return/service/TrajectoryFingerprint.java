/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.service;

import ai.evacortex.se3return.core.Pose;
import ai.evacortex.se3return.core.Trajectory;
import net.jpountz.xxhash.XXHashFactory;

import java.nio.ByteBuffer;
import java.util.HexFormat;

/**
 * Deterministic xxHash64 content hash of a trajectory: every rotation matrix and translation,
 * followed by the bound flag and r_max.
 */
public final class TrajectoryFingerprint {

    private static final XXHashFactory XX_HASH = XXHashFactory.fastestInstance();
    private static final long SEED = 0x9747b28cL;
    private static final int DOUBLES_PER_POSE = 12;

    private TrajectoryFingerprint() {}

    public static long compute(Trajectory trajectory) {
        ByteBuffer buffer = ByteBuffer.allocate(trajectory.size() * DOUBLES_PER_POSE * Double.BYTES + 1 + Double.BYTES);
        for (Pose pose : trajectory.poses()) {
            for (double v : pose.rotation().toRowMajor()) {
                buffer.putDouble(v);
            }
            buffer.putDouble(pose.translation().x);
            buffer.putDouble(pose.translation().y);
            buffer.putDouble(pose.translation().z);
        }
        buffer.put((byte) (trajectory.bounded() ? 1 : 0));
        buffer.putDouble(trajectory.rMax());
        byte[] bytes = buffer.array();
        return XX_HASH.hash64().hash(bytes, 0, bytes.length, SEED);
    }

    public static String computeHex(Trajectory trajectory) {
        return HexFormat.of().toHexDigits(compute(trajectory));
    }
}
