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

public abstract class ReturnException extends RuntimeException {

    private final ErrorKind kind;

    protected ReturnException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ReturnException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
