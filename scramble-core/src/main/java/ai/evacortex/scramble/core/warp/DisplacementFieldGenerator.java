/*
 * StimulusScramble — Perceptual Stimulus Scrambler
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.scramble.core.warp;

import ai.evacortex.scramble.core.exceptions.ParameterDomainException;

import java.util.Objects;
import java.util.Random;

/**
 * Builds smooth random displacement fields from a 6x6 basis of separable cosines.
 *
 * <p>Each basis term is {@code w · cos(2π·fx·x/width + φ1) · cos(2π·fy·y/height + φ2)} with
 * frequencies {@code fx, fy ∈ 1..6}. Phases and weights are both uniform on {@code [0, 2π)}.
 * Each axis is divided by its own RMS and then scaled by {@code maxDistortion / steps}.</p>
 *
 * <p>Fields depend only on the supplied {@link Random}; seeding it reproduces them.</p>
 */
public class DisplacementFieldGenerator {

    static final int COMPONENTS = 6;
    private static final double TWO_PI = 2 * Math.PI;

    private final Random random;

    public DisplacementFieldGenerator(Random random) {
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    public static DisplacementFieldGenerator seeded(long seed) {
        return new DisplacementFieldGenerator(new Random(seed));
    }

    public DisplacementField generate(int width, int height, WarpParameters params) {
        return generate(width, height, params.maxDistortion(), params.steps());
    }

    public DisplacementField generate(int width, int height, int maxDistortion, int steps) {
        if (width < 1 || height < 1) {
            throw new ParameterDomainException("field size must be positive, got " + width + "x" + height);
        }
        if (maxDistortion < 0 || steps < 1) {
            throw new ParameterDomainException("expected maxDistortion >= 0 and steps >= 1, got "
                    + maxDistortion + ", " + steps);
        }

        double[][] xn = new double[height][width];
        double[][] yn = new double[height][width];
        double[] colX = new double[width];
        double[] rowX = new double[height];
        double[] colY = new double[width];
        double[] rowY = new double[height];

        for (int fx = 1; fx <= COMPONENTS; fx++) {
            for (int fy = 1; fy <= COMPONENTS; fy++) {
                double ph1 = random.nextDouble() * TWO_PI;
                double ph2 = random.nextDouble() * TWO_PI;
                double ph3 = random.nextDouble() * TWO_PI;
                double ph4 = random.nextDouble() * TWO_PI;
                // amplitude weights are drawn from the same [0, 2π) range as the phases
                double wx = random.nextDouble() * TWO_PI;
                double wy = random.nextDouble() * TWO_PI;

                for (int c = 0; c < width; c++) {
                    double arg = fx * (c + 1) / (double) width * TWO_PI;
                    colX[c] = Math.cos(arg + ph1);
                    colY[c] = Math.cos(arg + ph3);
                }
                for (int r = 0; r < height; r++) {
                    double arg = fy * (r + 1) / (double) height * TWO_PI;
                    rowX[r] = wx * Math.cos(arg + ph2);
                    rowY[r] = wy * Math.cos(arg + ph4);
                }
                for (int r = 0; r < height; r++) {
                    double[] xRow = xn[r];
                    double[] yRow = yn[r];
                    for (int c = 0; c < width; c++) {
                        xRow[c] += rowX[r] * colX[c];
                        yRow[c] += rowY[r] * colY[c];
                    }
                }
            }
        }

        double scale = maxDistortion / (double) steps;
        normalize(xn, scale);
        normalize(yn, scale);
        return new DisplacementField(xn, yn);
    }

    private static void normalize(double[][] grid, double scale) {
        double rms = DisplacementField.rms(grid);
        double factor = rms == 0.0 ? 0.0 : scale / rms;
        for (double[] row : grid) {
            for (int c = 0; c < row.length; c++) {
                row[c] *= factor;
            }
        }
    }
}
