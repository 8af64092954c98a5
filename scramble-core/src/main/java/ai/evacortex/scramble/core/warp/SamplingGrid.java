/*
 * StimulusScramble — Perceptual Stimulus Scrambler
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.scramble.core.warp;

/**
 * Bilinear sample positions for one quadrant, resolved once from a displacement field.
 *
 * <p>Positions that fall outside the canvas are redirected to {@link #FALLBACK_ROW},
 * {@link #FALLBACK_COL}; they neither wrap nor reflect.</p>
 */
final class SamplingGrid {

    static final int FALLBACK_ROW = 0;
    static final int FALLBACK_COL = 0;

    private final int rows;
    private final int cols;
    private final int[] row0;
    private final int[] col0;
    private final double[] rowFrac;
    private final double[] colFrac;

    private SamplingGrid(int rows, int cols) {
        this.rows = rows;
        this.cols = cols;
        int n = rows * cols;
        this.row0 = new int[n];
        this.col0 = new int[n];
        this.rowFrac = new double[n];
        this.colFrac = new double[n];
    }

    static SamplingGrid of(DisplacementField field) {
        int rows = field.rows();
        int cols = field.cols();
        SamplingGrid grid = new SamplingGrid(rows, cols);
        double[][] dx = field.dx();
        double[][] dy = field.dy();

        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                double sr = r + dy[r][c];
                double sc = c + dx[r][c];
                if (!(sr >= 0 && sr <= rows - 1 && sc >= 0 && sc <= cols - 1)) {
                    sr = FALLBACK_ROW;
                    sc = FALLBACK_COL;
                }
                int i = r * cols + c;
                int r0 = (int) Math.floor(sr);
                int c0 = (int) Math.floor(sc);
                grid.row0[i] = r0;
                grid.col0[i] = c0;
                grid.rowFrac[i] = sr - r0;
                grid.colFrac[i] = sc - c0;
            }
        }
        return grid;
    }

    int rows() {
        return rows;
    }

    int cols() {
        return cols;
    }

    /**
     * One bilinear pass over a row-major plane; {@code src} and {@code dst} must not alias.
     */
    void resample(double[] src, double[] dst) {
        for (int i = 0; i < dst.length; i++) {
            int r0 = row0[i];
            int c0 = col0[i];
            int r1 = Math.min(r0 + 1, rows - 1);
            int c1 = Math.min(c0 + 1, cols - 1);
            double fr = rowFrac[i];
            double fc = colFrac[i];

            double top = (1 - fc) * src[r0 * cols + c0] + fc * src[r0 * cols + c1];
            double bottom = (1 - fc) * src[r1 * cols + c0] + fc * src[r1 * cols + c1];
            dst[i] = (1 - fr) * top + fr * bottom;
        }
    }
}
