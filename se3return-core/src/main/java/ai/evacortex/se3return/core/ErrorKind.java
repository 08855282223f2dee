/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.core;

import ai.evacortex.se3return.core.exceptions.*;

import java.util.function.Function;

/**
 * Failure taxonomy for trajectory construction, scaling and encoding.
 */
public enum ErrorKind {
    /** Rotation not orthogonal or not proper. */
    INVALID_POSE(InvalidPoseException::new),
    /** Translation exceeds r_max under a bounded trajectory, or r_max itself is invalid. */
    BOUNDS_VIOLATION(BoundsViolationException::new),
    /** Non-finite scale factor or scale range. */
    INVALID_SCALE(InvalidScaleException::new),
    /** Unrecognized input encoding. */
    UNSUPPORTED_FORMAT(UnsupportedFormatException::new),
    /** Mismatched sequence lengths, empty sequences, insufficient widths. */
    DIMENSION_MISMATCH(DimensionMismatchException::new);

    private final Function<String, ReturnException> factory;

    ErrorKind(Function<String, ReturnException> factory) {
        this.factory = factory;
    }

    public ReturnException toException(String message) {
        return factory.apply(message);
    }
}
