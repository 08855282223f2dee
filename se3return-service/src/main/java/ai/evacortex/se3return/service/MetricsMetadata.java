/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.service;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MetricsMetadata(
        @JsonProperty("trajectory_length") int trajectoryLength,
        @JsonProperty("bounded") boolean bounded,
        @JsonProperty("r_max") double rMax,
        @JsonProperty("lambda_bounds") double[] lambdaBounds,
        @JsonProperty("optimization_success") boolean optimizationSuccess,
        @JsonProperty("optimization_iterations") int optimizationIterations,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("trajectory_fingerprint") String trajectoryFingerprint
) {
}
