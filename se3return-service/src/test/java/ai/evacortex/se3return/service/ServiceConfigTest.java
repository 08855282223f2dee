/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ServiceConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(ServiceConfig.R_MAX);
        System.clearProperty(ServiceConfig.LAMBDA_HI);
        System.clearProperty(ServiceConfig.NOISE_SEED);
        System.clearProperty(ServiceConfig.BATCH_PARALLELISM);
    }

    @Test
    void unsetProperties_fallBackToDefaults() {
        ServiceConfig c = ServiceConfig.fromSystemProperties();
        assertTrue(c.bounded());
        assertEquals(1.0, c.rMax());
        assertEquals(0.1, c.lambdaBounds().lo());
        assertEquals(2.0, c.lambdaBounds().hi());
        assertEquals(100.0, c.baseUnit());
        assertEquals(500, c.maxEvaluations());
        assertTrue(c.noiseSeed().isEmpty());
        assertTrue(c.batchParallelism() >= 1);
    }

    @Test
    void systemProperties_override() {
        System.setProperty(ServiceConfig.R_MAX, "3.5");
        System.setProperty(ServiceConfig.LAMBDA_HI, "4.0");
        System.setProperty(ServiceConfig.NOISE_SEED, "123");
        System.setProperty(ServiceConfig.BATCH_PARALLELISM, "3");

        ServiceConfig c = ServiceConfig.fromSystemProperties();
        assertEquals(3.5, c.rMax());
        assertEquals(4.0, c.lambdaBounds().hi());
        assertEquals(123L, c.noiseSeed().getAsLong());
        assertEquals(3, c.batchParallelism());

        MetricsOptions o = MetricsOptions.from(c);
        assertEquals(3.5, o.rMax());
        assertEquals(123L, o.noiseSeed().getAsLong());
    }
}
