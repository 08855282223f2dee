/*
 * SE3Return — Double-and-Scale Return Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.se3return.core;

import ai.evacortex.se3return.core.math.Vector3;

import java.util.Objects;
import java.util.Random;

/**
 * Random walk on rigid motions with an elastic pull back toward a home pose
 * (Ornstein–Uhlenbeck style: drift −k·deviation plus √dt-scaled Gaussian noise).
 *
 * <p>Not thread-safe: the walker holds its current position.</p>
 */
public final class TetheredWalker {

    public record ReturnForce(Vector3 translation, Vector3 rotation) {}

    private final Pose home;
    private final double elasticConstant;
    private final double translationNoise;
    private final double rotationNoise;
    private final Random random;
    private Pose current;

    public TetheredWalker(Pose home, double elasticConstant, double translationNoise,
                          double rotationNoise, Random random) {
        this.home = Objects.requireNonNull(home, "home must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
        this.elasticConstant = elasticConstant;
        this.translationNoise = translationNoise;
        this.rotationNoise = rotationNoise;
        this.current = Pose.identity();
    }

    public TetheredWalker(Random random) {
        this(Pose.identity(), 0.1, 0.05, 0.1, random);
    }

    public ReturnForce returnForce() {
        Vector3 translationForce = current.translation().subtract(home.translation()).scale(-elasticConstant);
        Vector3 deviation = Pose.compose(home.inverse(), current).rotationVector();
        return new ReturnForce(translationForce, deviation.scale(-elasticConstant));
    }

    public Pose step(double dt) {
        ReturnForce force = returnForce();
        double sqrtDt = Math.sqrt(dt);

        Vector3 translation = current.translation()
                .add(force.translation().scale(dt))
                .add(Trajectories.gaussian(random, translationNoise).scale(sqrtDt));

        Vector3 rotation = current.rotationVector()
                .add(force.rotation().scale(dt))
                .add(Trajectories.gaussian(random, rotationNoise).scale(sqrtDt));

        current = Pose.fromRotationVector(rotation, translation);
        return current;
    }

    public Pose current() {
        return current;
    }
}
