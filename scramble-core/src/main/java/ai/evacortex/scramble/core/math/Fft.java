/*
 * StimulusScramble — Perceptual Stimulus Scrambler
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.scramble.core.math;

import ai.evacortex.scramble.core.ScrambleDefaults;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import org.jtransforms.fft.DoubleFFT_1D;

/**
 * Complex 1-D discrete Fourier transform over arbitrary lengths.
 *
 * <p>Forward transform is unnormalized, inverse is scaled by {@code 1/n}, so
 * {@code inverse(forward(x)) == x} up to rounding. Plans are cached per length.</p>
 */
public final class Fft {

    private static final LoadingCache<Integer, DoubleFFT_1D> PLANS = Caffeine.newBuilder()
            .maximumSize(ScrambleDefaults.FFT_PLAN_CACHE_SIZE)
            .build(n -> new DoubleFFT_1D(n));

    private Fft() {}

    public static Complex[] forward(double[] real) {
        int n = real.length;
        double[] buf = new double[2 * n];
        for (int i = 0; i < n; i++) {
            buf[2 * i] = real[i];
        }
        PLANS.get(n).complexForward(buf);
        return unpack(buf, n);
    }

    public static Complex[] inverse(Complex[] spectrum) {
        int n = spectrum.length;
        double[] buf = new double[2 * n];
        for (int i = 0; i < n; i++) {
            buf[2 * i] = spectrum[i].real;
            buf[2 * i + 1] = spectrum[i].imag;
        }
        PLANS.get(n).complexInverse(buf, true);
        return unpack(buf, n);
    }

    static long cachedPlanCount() {
        PLANS.cleanUp();
        return PLANS.estimatedSize();
    }

    private static Complex[] unpack(double[] buf, int n) {
        Complex[] out = new Complex[n];
        for (int i = 0; i < n; i++) {
            out[i] = new Complex(buf[2 * i], buf[2 * i + 1]);
        }
        return out;
    }
}
