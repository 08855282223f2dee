/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.core.engine;

import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

/**
 * Plain golden-section search. Slower than {@link BrentMinimizer} on smooth objectives but
 * never relies on parabolic fits, which makes it predictable on flat or kinked landscapes.
 */
public final class GoldenSectionMinimizer implements ScalarMinimizer {

    private static final double INV_PHI = (Math.sqrt(5.0) - 1.0) / 2.0;

    @Override
    public ScalarMinimum minimize(DoubleUnaryOperator f, LambdaBounds bounds) {
        return minimize(f, bounds, OptimizerOptions.defaultOptions());
    }

    @Override
    public ScalarMinimum minimize(DoubleUnaryOperator f, LambdaBounds bounds, OptimizerOptions options) {
        Objects.requireNonNull(f, "f must not be null");
        Objects.requireNonNull(bounds, "bounds must not be null");
        Objects.requireNonNull(options, "options must not be null");

        double a = bounds.lo();
        double b = bounds.hi();

        if (options.maxEvaluations() < 2) {
            double mid = 0.5 * (a + b);
            return new ScalarMinimum(mid, f.applyAsDouble(mid), false, 1);
        }

        double c = b - INV_PHI * (b - a);
        double d = a + INV_PHI * (b - a);
        double fc = f.applyAsDouble(c);
        double fd = f.applyAsDouble(d);
        int evaluations = 2;

        while ((b - a) > options.xatol() && evaluations < options.maxEvaluations()) {
            if (fc <= fd) {
                b = d;
                d = c;
                fd = fc;
                c = b - INV_PHI * (b - a);
                fc = f.applyAsDouble(c);
            } else {
                a = c;
                c = d;
                fc = fd;
                d = a + INV_PHI * (b - a);
                fd = f.applyAsDouble(d);
            }
            evaluations++;
        }

        boolean narrowed = (b - a) <= options.xatol();
        double x = fc <= fd ? c : d;
        double fx = Math.min(fc, fd);
        boolean nan = Double.isNaN(fc) || Double.isNaN(fd);
        return new ScalarMinimum(x, nan ? Double.NaN : fx, narrowed && !nan, evaluations);
    }
}
