/*
 * StimulusScramble — Perceptual Stimulus Scrambler
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.scramble.core.warp;

import ai.evacortex.scramble.core.Frame;
import ai.evacortex.scramble.core.exceptions.ArgumentCountException;
import ai.evacortex.scramble.core.exceptions.ShapeMismatchException;

import java.util.Arrays;

/**
 * Smooth, tear-free spatial warp of a single frame.
 *
 * <p>The frame is replicated 2x2 onto a canvas of twice its size, filled beforehand with
 * each plane's mean intensity. Each of the four quadrant fields of the {@link WarpContext}
 * is then applied {@code steps} times in sequence by bilinear resampling, every pass
 * feeding the next, so small per-step offsets compound into a large deformation. Finally
 * every second row and column is kept, restoring the original size.</p>
 *
 * <p>Reference: Stojanoski &amp; Cusack (2014), Time to wave good-bye to phase scrambling,
 * Journal of Vision 14(12):6.</p>
 */
public class DiffeomorphicWarper implements FrameWarper {

    @Override
    public Frame warp(Frame frame, WarpContext context) {
        if (frame == null || context == null) {
            throw new ArgumentCountException("frame and warp context are required");
        }
        int rows = frame.rows();
        int cols = frame.cols();
        int canvasRows = context.canvasRows();
        int canvasCols = context.canvasCols();
        if (canvasRows != 2 * rows || canvasCols != 2 * cols) {
            throw new ShapeMismatchException("warp context canvas " + canvasRows + "x" + canvasCols
                    + " does not fit a " + rows + "x" + cols + " frame");
        }

        double[][][] out = new double[frame.planeCount()][][];
        double[] current = new double[canvasRows * canvasCols];
        double[] next = new double[canvasRows * canvasCols];

        for (int p = 0; p < frame.planeCount(); p++) {
            fillCanvas(frame, p, current, canvasRows, canvasCols);
            for (SamplingGrid grid : context.grids()) {
                for (int step = 0; step < context.steps(); step++) {
                    grid.resample(current, next);
                    double[] swap = current;
                    current = next;
                    next = swap;
                }
            }
            out[p] = downsample(current, rows, cols, canvasCols);
        }
        return new Frame(out);
    }

    private static void fillCanvas(Frame frame, int plane, double[] canvas, int canvasRows, int canvasCols) {
        Arrays.fill(canvas, frame.mean(plane));

        int upRows = 2 * frame.rows();
        int upCols = 2 * frame.cols();
        int top = (int) Math.round((canvasRows - upRows) / 2.0);
        int left = (int) Math.round((canvasCols - upCols) / 2.0);

        double[][] src = frame.planes()[plane];
        for (int r = 0; r < upRows; r++) {
            double[] srcRow = src[r / 2];
            int base = (top + r) * canvasCols + left;
            for (int c = 0; c < upCols; c++) {
                canvas[base + c] = srcRow[c / 2];
            }
        }
    }

    private static double[][] downsample(double[] canvas, int rows, int cols, int canvasCols) {
        double[][] plane = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            int base = 2 * r * canvasCols;
            for (int c = 0; c < cols; c++) {
                plane[r][c] = canvas[base + 2 * c];
            }
        }
        return plane;
    }
}
