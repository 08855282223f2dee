/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.service;

import ai.evacortex.se3return.core.ErrorKind;
import ai.evacortex.se3return.core.Pose;
import ai.evacortex.se3return.core.Result;
import ai.evacortex.se3return.core.Trajectory;
import ai.evacortex.se3return.core.math.Matrix3;
import ai.evacortex.se3return.core.math.Vector3;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns JSON trajectory encodings into a {@link Trajectory}.
 *
 * <p>Accepted shapes:</p>
 * <ul>
 *   <li>{@code {"poses": [{"rotation": [3] | [[3],[3],[3]], "translation": [3]}, ...]}}</li>
 *   <li>{@code {"positions": [[x,y,z], ...], "orientations": [[...], ...]}}, converted to incremental poses</li>
 *   <li>{@code {"state_vectors": [[r0,r1,r2,t0,t1,t2,...], ...]}}</li>
 *   <li>a bare array, read as a pose list</li>
 * </ul>
 * <p>Failures are returned, never thrown.</p>
 */
public final class TrajectoryEncoder {

    private static final Logger log = LoggerFactory.getLogger(TrajectoryEncoder.class);

    private static final int STATE_WIDTH = 6;

    public Result<Trajectory> encode(JsonNode data, boolean bounded, double rMax) {
        if (data == null || data.isNull() || data.isMissingNode()) {
            return Result.failure(ErrorKind.UNSUPPORTED_FORMAT, "trajectory_data is missing");
        }
        if (data.isArray()) {
            return encodePoses(data, bounded, rMax);
        }
        if (!data.isObject()) {
            return Result.failure(ErrorKind.UNSUPPORTED_FORMAT,
                    "expected a JSON object or array, got " + data.getNodeType());
        }
        if (data.has("poses")) {
            return encodePoses(data.get("poses"), bounded, rMax);
        }
        if (data.has("positions") && data.has("orientations")) {
            return encodeTimeSeries(data.get("positions"), data.get("orientations"), bounded, rMax);
        }
        if (data.has("state_vectors")) {
            return encodeStateVectors(data.get("state_vectors"), bounded, rMax);
        }
        return Result.failure(ErrorKind.UNSUPPORTED_FORMAT,
                "expected 'poses', 'positions'+'orientations', or 'state_vectors'");
    }

    public Result<Trajectory> encodePoses(JsonNode poses, boolean bounded, double rMax) {
        if (poses == null || !poses.isArray()) {
            return Result.failure(ErrorKind.UNSUPPORTED_FORMAT, "'poses' must be an array");
        }
        List<Pose> out = new ArrayList<>(poses.size());
        for (int i = 0; i < poses.size(); i++) {
            JsonNode entry = poses.get(i);
            JsonNode rotation = entry.get("rotation");
            JsonNode translation = entry.get("translation");
            if (rotation == null || rotation.isNull() || translation == null || translation.isNull()) {
                return Result.failure(ErrorKind.UNSUPPORTED_FORMAT,
                        "pose " + i + " must contain 'rotation' and 'translation'");
            }
            Result<Vector3> t = vector(translation, "translation of pose " + i);
            if (!t.isOk()) return Result.failure(t.failure());

            Result<Pose> pose;
            if (isMatrix(rotation)) {
                Result<Matrix3> r = matrix(rotation, "rotation of pose " + i);
                if (!r.isOk()) return Result.failure(r.failure());
                pose = Pose.tryOf(r.value(), t.value());
            } else {
                Result<Vector3> r = vector(rotation, "rotation of pose " + i);
                if (!r.isOk()) return Result.failure(r.failure());
                pose = Pose.tryFromRotationVector(r.value(), t.value());
            }
            if (!pose.isOk()) return Result.failure(pose.failure());
            out.add(pose.value());
        }
        return build(out, bounded, rMax, "poses");
    }

    /**
     * Pose 0 is the first position with no rotation; pose i is the step from sample i−1 to i,
     * taking the first three components of the orientation difference as the rotation vector.
     */
    public Result<Trajectory> encodeTimeSeries(JsonNode positions, JsonNode orientations, boolean bounded, double rMax) {
        if (positions == null || !positions.isArray() || orientations == null || !orientations.isArray()) {
            return Result.failure(ErrorKind.UNSUPPORTED_FORMAT, "'positions' and 'orientations' must be arrays");
        }
        if (positions.size() != orientations.size()) {
            return Result.failure(ErrorKind.DIMENSION_MISMATCH, "positions and orientations must have the same length ("
                    + positions.size() + " != " + orientations.size() + ")");
        }
        List<Pose> out = new ArrayList<>(positions.size());
        Vector3 prevPos = null;
        double[] prevOrient = null;
        for (int i = 0; i < positions.size(); i++) {
            Result<Vector3> pos = vector(positions.get(i), "position " + i);
            if (!pos.isOk()) return Result.failure(pos.failure());
            Result<double[]> orient = row(orientations.get(i), 3, "orientation " + i);
            if (!orient.isOk()) return Result.failure(orient.failure());

            Result<Pose> pose;
            if (i == 0) {
                pose = Pose.tryFromRotationVector(Vector3.ZERO, pos.value());
            } else {
                double[] o = orient.value();
                Vector3 deltaOrient = new Vector3(o[0] - prevOrient[0], o[1] - prevOrient[1], o[2] - prevOrient[2]);
                pose = Pose.tryFromRotationVector(deltaOrient, pos.value().subtract(prevPos));
            }
            if (!pose.isOk()) return Result.failure(pose.failure());
            out.add(pose.value());
            prevPos = pos.value();
            prevOrient = orient.value();
        }
        return build(out, bounded, rMax, "positions+orientations");
    }

    public Result<Trajectory> encodeStateVectors(JsonNode stateVectors, boolean bounded, double rMax) {
        if (stateVectors == null || !stateVectors.isArray()) {
            return Result.failure(ErrorKind.UNSUPPORTED_FORMAT, "'state_vectors' must be an array");
        }
        List<Pose> out = new ArrayList<>(stateVectors.size());
        for (int i = 0; i < stateVectors.size(); i++) {
            Result<double[]> state = row(stateVectors.get(i), STATE_WIDTH, "state vector " + i);
            if (!state.isOk()) return Result.failure(state.failure());
            double[] s = state.value();
            Result<Pose> pose = Pose.tryFromRotationVector(new Vector3(s[0], s[1], s[2]), new Vector3(s[3], s[4], s[5]));
            if (!pose.isOk()) return Result.failure(pose.failure());
            out.add(pose.value());
        }
        return build(out, bounded, rMax, "state_vectors");
    }

    private static Result<Trajectory> build(List<Pose> poses, boolean bounded, double rMax, String format) {
        Result<Trajectory> trajectory = Trajectory.tryOf(poses, bounded, rMax);
        if (trajectory.isOk()) {
            log.debug("Encoded {} poses from {}", poses.size(), format);
        }
        return trajectory;
    }

    private static boolean isMatrix(JsonNode node) {
        return node.isArray() && node.size() > 0 && node.get(0).isArray();
    }

    private static Result<Vector3> vector(JsonNode node, String what) {
        if (node == null || !node.isArray()) {
            return Result.failure(ErrorKind.UNSUPPORTED_FORMAT, what + " must be an array of numbers");
        }
        if (node.size() != 3) {
            return Result.failure(ErrorKind.DIMENSION_MISMATCH, what + " must have 3 components, got " + node.size());
        }
        return row(node, 3, what).map(v -> new Vector3(v[0], v[1], v[2]));
    }

    private static Result<Matrix3> matrix(JsonNode node, String what) {
        if (node.size() != 3) {
            return Result.failure(ErrorKind.DIMENSION_MISMATCH, what + " must be a 3x3 matrix, got " + node.size() + " rows");
        }
        double[] values = new double[9];
        for (int r = 0; r < 3; r++) {
            JsonNode rowNode = node.get(r);
            if (rowNode == null || !rowNode.isArray()) {
                return Result.failure(ErrorKind.UNSUPPORTED_FORMAT, what + " row " + r + " must be an array");
            }
            if (rowNode.size() != 3) {
                return Result.failure(ErrorKind.DIMENSION_MISMATCH, what + " must be a 3x3 matrix, row " + r
                        + " has " + rowNode.size() + " entries");
            }
            Result<double[]> row = row(rowNode, 3, what + " row " + r);
            if (!row.isOk()) return Result.failure(row.failure());
            System.arraycopy(row.value(), 0, values, r * 3, 3);
        }
        return Result.ok(Matrix3.ofRowMajor(values));
    }

    private static Result<double[]> row(JsonNode node, int minWidth, String what) {
        if (node == null || !node.isArray()) {
            return Result.failure(ErrorKind.UNSUPPORTED_FORMAT, what + " must be an array of numbers");
        }
        if (node.size() < minWidth) {
            return Result.failure(ErrorKind.DIMENSION_MISMATCH,
                    what + " needs at least " + minWidth + " components, got " + node.size());
        }
        double[] values = new double[node.size()];
        for (int i = 0; i < values.length; i++) {
            JsonNode v = node.get(i);
            if (!v.isNumber()) {
                return Result.failure(ErrorKind.UNSUPPORTED_FORMAT, what + " component " + i + " is not a number");
            }
            values[i] = v.doubleValue();
        }
        return Result.ok(values);
    }
}
