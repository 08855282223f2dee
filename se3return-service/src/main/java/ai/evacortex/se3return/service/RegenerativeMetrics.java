/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.service;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.Optional;

/**
 * Output of one metrics run.
 *
 * @param optimalLambda      scale minimizing the doubled return error within the requested bounds
 * @param returnErrorEpsilon return error at {@code optimalLambda}, never negative
 * @param verificationScore  weighted cascade score in [0, 1]; 0 when the cascade is disabled
 * @param resonanceDetected  key of the natural resonance constant, or {@code null}
 * @param confidence         {@code min(1, 1/(1+ε))} after convergence, 0.5 otherwise
 */
public record RegenerativeMetrics(
        @JsonProperty("optimal_lambda") double optimalLambda,
        @JsonProperty("return_error_epsilon") double returnErrorEpsilon,
        @JsonProperty("verification_score") double verificationScore,
        @JsonProperty("resonance_detected") @JsonInclude(JsonInclude.Include.NON_NULL) String resonanceDetected,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("metadata") MetricsMetadata metadata
) {

    public RegenerativeMetrics {
        Objects.requireNonNull(metadata, "metadata must not be null");
    }

    @JsonIgnore
    public Optional<String> resonance() {
        return Optional.ofNullable(resonanceDetected);
    }
}
