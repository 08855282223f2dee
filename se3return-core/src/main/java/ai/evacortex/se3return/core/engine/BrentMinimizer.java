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
 * Bounded Brent minimizer: golden-section steps combined with successive parabolic interpolation.
 *
 * <p>The iteration starts from the golden point of the interval and stops once the bracket
 * around the best point is narrower than {@code 2·(√ε·|x| + xatol/3)}. When the evaluation
 * budget is spent first, the best point so far is returned with {@code converged = false}.</p>
 */
public final class BrentMinimizer implements ScalarMinimizer {

    private static final double SQRT_EPS = Math.sqrt(2.220446049250313e-16);
    private static final double GOLDEN_MEAN = 0.5 * (3.0 - Math.sqrt(5.0));

    @Override
    public ScalarMinimum minimize(DoubleUnaryOperator f, LambdaBounds bounds) {
        return minimize(f, bounds, OptimizerOptions.defaultOptions());
    }

    @Override
    public ScalarMinimum minimize(DoubleUnaryOperator f, LambdaBounds bounds, OptimizerOptions options) {
        Objects.requireNonNull(f, "f must not be null");
        Objects.requireNonNull(bounds, "bounds must not be null");
        Objects.requireNonNull(options, "options must not be null");

        final double xatol = options.xatol();
        final int maxEvaluations = options.maxEvaluations();

        double a = bounds.lo();
        double b = bounds.hi();
        double fulc = a + GOLDEN_MEAN * (b - a);
        double nfc = fulc;
        double xf = fulc;
        double rat = 0.0;
        double e = 0.0;

        double fx = f.applyAsDouble(xf);
        int evaluations = 1;
        if (maxEvaluations == 1) {
            return new ScalarMinimum(xf, fx, false, evaluations);
        }

        double fu = Double.POSITIVE_INFINITY;
        double ffulc = fx;
        double fnfc = fx;
        double xm = 0.5 * (a + b);
        double tol1 = SQRT_EPS * Math.abs(xf) + xatol / 3.0;
        double tol2 = 2.0 * tol1;
        boolean exhausted = false;

        while (Math.abs(xf - xm) > (tol2 - 0.5 * (b - a))) {
            boolean golden = true;

            if (Math.abs(e) > tol1) {
                golden = false;
                double r = (xf - nfc) * (fx - ffulc);
                double q = (xf - fulc) * (fx - fnfc);
                double p = (xf - fulc) * q - (xf - nfc) * r;
                q = 2.0 * (q - r);
                if (q > 0.0) p = -p;
                q = Math.abs(q);
                r = e;
                e = rat;

                if (Math.abs(p) < Math.abs(0.5 * q * r) && p > q * (a - xf) && p < q * (b - xf)) {
                    // parabolic step
                    rat = p / q;
                    double x = xf + rat;
                    if ((x - a) < tol2 || (b - x) < tol2) {
                        rat = tol1 * signOrOne(xm - xf);
                    }
                } else {
                    golden = true;
                }
            }

            if (golden) {
                e = (xf >= xm) ? a - xf : b - xf;
                rat = GOLDEN_MEAN * e;
            }

            double x = xf + signOrOne(rat) * Math.max(Math.abs(rat), tol1);
            fu = f.applyAsDouble(x);
            evaluations++;

            if (fu <= fx) {
                if (x >= xf) {
                    a = xf;
                } else {
                    b = xf;
                }
                fulc = nfc;
                ffulc = fnfc;
                nfc = xf;
                fnfc = fx;
                xf = x;
                fx = fu;
            } else {
                if (x < xf) {
                    a = x;
                } else {
                    b = x;
                }
                if (fu <= fnfc || nfc == xf) {
                    fulc = nfc;
                    ffulc = fnfc;
                    nfc = x;
                    fnfc = fu;
                } else if (fu <= ffulc || fulc == xf || fulc == nfc) {
                    fulc = x;
                    ffulc = fu;
                }
            }

            xm = 0.5 * (a + b);
            tol1 = SQRT_EPS * Math.abs(xf) + xatol / 3.0;
            tol2 = 2.0 * tol1;

            if (evaluations >= maxEvaluations) {
                exhausted = true;
                break;
            }
        }

        boolean nan = Double.isNaN(xf) || Double.isNaN(fx) || Double.isNaN(fu);
        return new ScalarMinimum(xf, fx, !exhausted && !nan, evaluations);
    }

    private static double signOrOne(double v) {
        return v < 0.0 ? -1.0 : 1.0;
    }
}
