/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.core;

import ai.evacortex.se3return.core.exceptions.BoundsViolationException;
import ai.evacortex.se3return.core.exceptions.DimensionMismatchException;
import ai.evacortex.se3return.core.exceptions.InvalidPoseException;
import ai.evacortex.se3return.core.exceptions.InvalidScaleException;
import ai.evacortex.se3return.core.exceptions.ReturnException;
import ai.evacortex.se3return.core.exceptions.UnsupportedFormatException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResultTest {

    @Test
    void ok_carriesValueAndMaps() {
        Result<Integer> r = Result.ok(2);
        assertTrue(r.isOk());
        assertEquals(4, r.map(v -> v * 2).value());
        assertEquals(2, r.orElseThrow());
        assertThrows(IllegalStateException.class, r::failure);
    }

    @Test
    void failure_shortCircuitsAndRethrowsTyped() {
        Result<Integer> r = Result.failure(ErrorKind.BOUNDS_VIOLATION, "too far");
        assertFalse(r.isOk());
        assertFalse(r.map(v -> v + 1).isOk());
        assertFalse(r.flatMap(v -> Result.ok(v + 1)).isOk());
        assertThrows(IllegalStateException.class, r::value);

        BoundsViolationException e = assertThrows(BoundsViolationException.class, r::orElseThrow);
        assertEquals(ErrorKind.BOUNDS_VIOLATION, e.kind());
        assertTrue(e.getMessage().contains("too far"));
    }

    @Test
    void everyKind_materializesItsOwnException() {
        assertInstanceOf(InvalidPoseException.class, ErrorKind.INVALID_POSE.toException("x"));
        assertInstanceOf(BoundsViolationException.class, ErrorKind.BOUNDS_VIOLATION.toException("x"));
        assertInstanceOf(InvalidScaleException.class, ErrorKind.INVALID_SCALE.toException("x"));
        assertInstanceOf(UnsupportedFormatException.class, ErrorKind.UNSUPPORTED_FORMAT.toException("x"));
        assertInstanceOf(DimensionMismatchException.class, ErrorKind.DIMENSION_MISMATCH.toException("x"));
        for (ErrorKind kind : ErrorKind.values()) {
            ReturnException e = kind.toException("msg");
            assertEquals(kind, e.kind());
        }
    }

    @Test
    void ok_rejectsNull() {
        assertThrows(NullPointerException.class, () -> Result.ok(null));
    }
}
