/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.service;

import ai.evacortex.se3return.core.exceptions.ReturnException;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Failure of a single batch trajectory. {@code kind} is an {@link ai.evacortex.se3return.core.ErrorKind}
 * name, or {@value #INTERNAL} for anything outside the taxonomy.
 */
public record BatchError(
        @JsonProperty("trajectory_index") int trajectoryIndex,
        @JsonProperty("kind") String kind,
        @JsonProperty("error") String message
) {

    public static final String INTERNAL = "INTERNAL";

    public static BatchError of(int index, RuntimeException e) {
        if (e instanceof ReturnException re) {
            return new BatchError(index, re.kind().name(), re.getMessage());
        }
        return new BatchError(index, INTERNAL, String.valueOf(e.getMessage()));
    }
}
