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

/**
 * One slot of a batch response: either metrics or an error, tagged with its input index.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchEntry(
        @JsonProperty("index") int index,
        @JsonProperty("metrics") RegenerativeMetrics metrics,
        @JsonProperty("error") BatchError error
) {

    public BatchEntry {
        if ((metrics == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of metrics or error must be set");
        }
    }

    public static BatchEntry success(int index, RegenerativeMetrics metrics) {
        return new BatchEntry(index, metrics, null);
    }

    public static BatchEntry failure(int index, BatchError error) {
        return new BatchEntry(index, null, error);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return metrics != null;
    }
}
