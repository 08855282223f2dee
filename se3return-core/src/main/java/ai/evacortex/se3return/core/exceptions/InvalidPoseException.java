/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.core.exceptions;

import ai.evacortex.se3return.core.ErrorKind;

public class InvalidPoseException extends ReturnException {
    public InvalidPoseException(String message) {
        super(ErrorKind.INVALID_POSE, "Invalid pose: " + message);
    }

    public InvalidPoseException(String message, Throwable cause) {
        super(ErrorKind.INVALID_POSE, "Invalid pose: " + message, cause);
    }
}
