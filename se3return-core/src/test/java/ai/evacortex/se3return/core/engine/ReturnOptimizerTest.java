/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.core.engine;

import ai.evacortex.se3return.core.PoseTestUtils;
import ai.evacortex.se3return.core.Trajectory;
import ai.evacortex.se3return.core.trace.ReturnTracer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Return optimizer")
class ReturnOptimizerTest {

    static final class RecordingTracer implements ReturnTracer {
        final List<double[]> evaluations = new ArrayList<>();
        final List<ReturnResult> results = new ArrayList<>();

        @Override
        public void evaluation(double lambda, double error) {
            evaluations.add(new double[] {lambda, error});
        }

        @Override
        public void optimized(ReturnResult result) {
            results.add(result);
        }
    }

    @Test
    void halfTurn_findsQuarterPiScale() {
        Trajectory t = Trajectory.of(List.of(PoseTestUtils.screw(2.0, 0.0)));
        ReturnResult r = new ReturnOptimizer().optimize(t);
        assertEquals(Math.PI / 2, r.lambda(), 1e-3);
        assertTrue(r.epsilon() < 1e-2);
        assertTrue(r.converged());
    }

    @Test
    void pureTranslation_prefersSmallestScale() {
        Trajectory t = Trajectory.of(List.of(PoseTestUtils.translation(0.4, 0, 0)));
        ReturnResult r = new ReturnOptimizer().optimize(t);
        assertEquals(0.1, r.lambda(), 1e-3);
        assertEquals(2 * r.lambda() * 0.4, r.epsilon(), 1e-12);
    }

    @Test
    void square_staysInBoundsWithNonNegativeError() {
        Trajectory t = Trajectory.of(PoseTestUtils.square());
        ReturnResult r = new ReturnOptimizer().optimize(t);
        assertTrue(LambdaBounds.DEFAULT.contains(r.lambda()));
        assertTrue(r.epsilon() >= 0.0);
        assertTrue(r.evaluations() >= 1);
    }

    @Test
    void tracer_seesEveryEvaluationAndTheResult() {
        RecordingTracer tracer = new RecordingTracer();
        ReturnOptimizer optimizer = new ReturnOptimizer(new BrentMinimizer(), OptimizerOptions.defaultOptions(), tracer);
        ReturnResult r = optimizer.optimize(Trajectory.of(PoseTestUtils.square()), LambdaBounds.DEFAULT, true);
        assertEquals(r.evaluations(), tracer.evaluations.size());
        assertEquals(List.of(r), tracer.results);
    }

    @Test
    void tinyBudget_reportsNonConvergenceInsteadOfThrowing() {
        ReturnOptimizer optimizer = new ReturnOptimizer(OptimizerOptions.defaultOptions().withMaxEvaluations(3));
        ReturnResult r = optimizer.optimize(Trajectory.of(PoseTestUtils.square()));
        assertFalse(r.converged());
        assertEquals(3, r.evaluations());
    }

    @Test
    void invalidBounds_areRejected() {
        assertThrows(RuntimeException.class, () -> new LambdaBounds(2.0, 0.1));
        assertThrows(RuntimeException.class, () -> new LambdaBounds(Double.NaN, 1.0));
    }
}
