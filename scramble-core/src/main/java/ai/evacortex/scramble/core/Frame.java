/*
 * StimulusScramble — Perceptual Stimulus Scrambler
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.scramble.core;

import ai.evacortex.scramble.core.exceptions.ArgumentCountException;
import ai.evacortex.scramble.core.exceptions.ParameterDomainException;

/**
 * Raster image stored as {@code planes[plane][row][col]}. Grayscale frames have one plane,
 * true-color frames three.
 */
public record Frame(double[][][] planes) {

    public Frame {
        if (planes == null) {
            throw new ArgumentCountException("frame data is required");
        }
        if (planes.length == 0 || planes[0] == null || planes[0].length == 0
                || planes[0][0] == null || planes[0][0].length == 0) {
            throw new ParameterDomainException("frame must have at least one plane, row and column");
        }
        int rows = planes[0].length;
        int cols = planes[0][0].length;
        for (int p = 0; p < planes.length; p++) {
            if (planes[p] == null || planes[p].length != rows) {
                throw new ParameterDomainException("plane " + p + " does not have " + rows + " rows");
            }
            for (int r = 0; r < rows; r++) {
                if (planes[p][r] == null || planes[p][r].length != cols) {
                    throw new ParameterDomainException("plane " + p + " row " + r + " does not have " + cols + " columns");
                }
            }
        }
    }

    public static Frame grayscale(double[][] pixels) {
        if (pixels == null) {
            throw new ArgumentCountException("frame data is required");
        }
        return new Frame(new double[][][]{pixels});
    }

    public int planeCount() {
        return planes.length;
    }

    public int rows() {
        return planes[0].length;
    }

    public int cols() {
        return planes[0][0].length;
    }

    public double get(int plane, int row, int col) {
        return planes[plane][row][col];
    }

    public double mean(int plane) {
        double sum = 0.0;
        for (double[] row : planes[plane]) {
            for (double v : row) {
                sum += v;
            }
        }
        return sum / ((double) rows() * cols());
    }

    public boolean sameShapeAs(Frame other) {
        return planeCount() == other.planeCount() && rows() == other.rows() && cols() == other.cols();
    }
}
