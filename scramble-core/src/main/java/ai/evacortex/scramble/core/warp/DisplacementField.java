/*
 * StimulusScramble — Perceptual Stimulus Scrambler
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.scramble.core.warp;

import ai.evacortex.scramble.core.exceptions.ArgumentCountException;
import ai.evacortex.scramble.core.exceptions.ShapeMismatchException;

/**
 * Per-pixel offsets on a {@code [row][col]} grid: {@code dx} moves along columns,
 * {@code dy} along rows.
 */
public record DisplacementField(double[][] dx, double[][] dy) {

    public DisplacementField {
        if (dx == null || dy == null) {
            throw new ArgumentCountException("dx and dy are required");
        }
        if (dx.length != dy.length || dx.length == 0) {
            throw new ShapeMismatchException("dx and dy must cover the same non-empty grid");
        }
        for (int r = 0; r < dx.length; r++) {
            if (dx[r] == null || dy[r] == null) {
                throw new ArgumentCountException("displacement row " + r + " is missing");
            }
        }
        int cols = dx[0].length;
        if (cols == 0) {
            throw new ShapeMismatchException("dx and dy must cover the same non-empty grid");
        }
        for (int r = 0; r < dx.length; r++) {
            if (dx[r].length != cols) {
                throw new ShapeMismatchException("dx row " + r + " width", cols, dx[r].length);
            }
            if (dy[r].length != cols) {
                throw new ShapeMismatchException("dy row " + r + " width", cols, dy[r].length);
            }
        }
    }

    public static DisplacementField zero(int rows, int cols) {
        return new DisplacementField(new double[rows][cols], new double[rows][cols]);
    }

    public int rows() {
        return dx.length;
    }

    public int cols() {
        return dx[0].length;
    }

    public DisplacementField minus(DisplacementField other) {
        if (rows() != other.rows() || cols() != other.cols()) {
            throw new ShapeMismatchException("cannot subtract a " + other.rows() + "x" + other.cols()
                    + " field from a " + rows() + "x" + cols() + " field");
        }
        double[][] x = new double[rows()][cols()];
        double[][] y = new double[rows()][cols()];
        for (int r = 0; r < rows(); r++) {
            for (int c = 0; c < cols(); c++) {
                x[r][c] = dx[r][c] - other.dx[r][c];
                y[r][c] = dy[r][c] - other.dy[r][c];
            }
        }
        return new DisplacementField(x, y);
    }

    public double rmsX() {
        return rms(dx);
    }

    public double rmsY() {
        return rms(dy);
    }

    static double rms(double[][] grid) {
        double sum = 0.0;
        int n = 0;
        for (double[] row : grid) {
            for (double v : row) {
                sum += v * v;
                n++;
            }
        }
        return Math.sqrt(sum / n);
    }
}
