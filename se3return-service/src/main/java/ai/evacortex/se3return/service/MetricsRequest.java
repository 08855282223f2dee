/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.service;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * A metrics request: {@code {"trajectory_data": ..., "options": {...}}}. A node without a
 * {@code trajectory_data} field is taken as the trajectory data itself.
 */
public record MetricsRequest(JsonNode trajectoryData, JsonNode options) {

    public MetricsRequest {
        Objects.requireNonNull(trajectoryData, "trajectoryData must not be null");
    }

    public static MetricsRequest fromJson(JsonNode node) {
        Objects.requireNonNull(node, "node must not be null");
        if (node.isObject() && node.has("trajectory_data")) {
            return new MetricsRequest(node.get("trajectory_data"), node.get("options"));
        }
        return new MetricsRequest(node, null);
    }

    public MetricsOptions resolveOptions(MetricsOptions defaults) {
        return MetricsOptions.fromJson(options, defaults);
    }
}
