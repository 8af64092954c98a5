/*
 * StimulusScramble — Perceptual Stimulus Scrambler
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.scramble.core.math;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FftTest {

    @Test
    void forward_matchesDirectDft_forNonPowerOfTwoLength() {
        double[] x = {0.5, -1.25, 3.0, 0.0, 2.5, -0.75};
        Complex[] fast = Fft.forward(x);

        int n = x.length;
        for (int k = 0; k < n; k++) {
            double re = 0.0;
            double im = 0.0;
            for (int t = 0; t < n; t++) {
                double angle = -2 * Math.PI * k * t / n;
                re += x[t] * Math.cos(angle);
                im += x[t] * Math.sin(angle);
            }
            assertEquals(re, fast[k].real, 1e-12, "real part of bin " + k);
            assertEquals(im, fast[k].imag, 1e-12, "imaginary part of bin " + k);
        }
    }

    @Test
    void inverse_undoesForward() {
        double[] x = new double[30];
        for (int i = 0; i < x.length; i++) {
            x[i] = Math.sin(i * 0.7) + 0.1 * i;
        }

        Complex[] back = Fft.inverse(Fft.forward(x));

        for (int i = 0; i < x.length; i++) {
            assertEquals(x[i], back[i].real, 1e-12);
            assertEquals(0.0, back[i].imag, 1e-12);
        }
    }

    @Test
    void plans_areCached() {
        Fft.forward(new double[12]);
        Fft.forward(new double[12]);
        assertTrue(Fft.cachedPlanCount() >= 1);
    }
}
