/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.service;

import ai.evacortex.se3return.core.engine.LambdaBounds;
import ai.evacortex.se3return.core.exceptions.InvalidScaleException;
import ai.evacortex.se3return.core.exceptions.UnsupportedFormatException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MetricsOptionsTest {

    @Test
    void defaults_matchServiceDefaults() {
        MetricsOptions o = MetricsOptions.defaultOptions();
        assertTrue(o.resonanceDetection());
        assertTrue(o.verificationCascade());
        assertTrue(o.bounded());
        assertEquals(1.0, o.rMax());
        assertEquals(LambdaBounds.DEFAULT, o.lambdaBounds());
        assertEquals(100.0, o.baseUnit());
        assertEquals(500, o.maxEvaluations());
        assertTrue(o.noiseSeed().isEmpty());
    }

    @Test
    void json_overlaysOnlyPresentFields() {
        MetricsOptions o = MetricsOptions.fromJson(MetricsJson.parse("""
                {"bounded": false, "r_max": 2.5, "noise_seed": 11, "max_evaluations": 50}
                """), MetricsOptions.defaultOptions());
        assertFalse(o.bounded());
        assertEquals(2.5, o.rMax());
        assertEquals(11L, o.noiseSeed().getAsLong());
        assertEquals(50, o.maxEvaluations());
        assertEquals(LambdaBounds.DEFAULT, o.lambdaBounds());
        assertTrue(o.resonanceDetection());
    }

    @Test
    void missingOptions_returnDefaults() {
        MetricsOptions d = MetricsOptions.defaultOptions();
        assertSame(d, MetricsOptions.fromJson(null, d));
    }

    @Test
    void badTypes_areUnsupportedFormat() {
        MetricsOptions d = MetricsOptions.defaultOptions();
        assertThrows(UnsupportedFormatException.class,
                () -> MetricsOptions.fromJson(MetricsJson.parse("{\"bounded\": \"yes\"}"), d));
        assertThrows(UnsupportedFormatException.class,
                () -> MetricsOptions.fromJson(MetricsJson.parse("{\"lambda_bounds\": [1]}"), d));
        assertThrows(UnsupportedFormatException.class,
                () -> MetricsOptions.fromJson(MetricsJson.parse("[1, 2]"), d));
    }

    @Test
    void nonIntegralMaxEvaluations_areUnsupportedFormat() {
        MetricsOptions d = MetricsOptions.defaultOptions();
        for (String json : new String[]{
                "{\"max_evaluations\": 0.5}",
                "{\"max_evaluations\": 1e12}",
                "{\"max_evaluations\": 0}",
                "{\"max_evaluations\": -3}",
                "{\"max_evaluations\": \"50\"}"}) {
            assertThrows(UnsupportedFormatException.class,
                    () -> MetricsOptions.fromJson(MetricsJson.parse(json), d), json);
        }
    }

    @Test
    void invertedLambdaBounds_areInvalidScale() {
        assertThrows(InvalidScaleException.class, () -> MetricsOptions.fromJson(
                MetricsJson.parse("{\"lambda_bounds\": [2.0, 0.5]}"), MetricsOptions.defaultOptions()));
    }
}
