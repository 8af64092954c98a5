/*
 * StimulusScramble — Perceptual Stimulus Scrambler
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.scramble.core.audio;

import ai.evacortex.scramble.core.Signal;
import ai.evacortex.scramble.core.exceptions.ArgumentCountException;
import ai.evacortex.scramble.core.exceptions.ParameterDomainException;
import ai.evacortex.scramble.core.exceptions.ShapeMismatchException;
import ai.evacortex.scramble.core.math.Complex;
import ai.evacortex.scramble.core.math.Fft;
import ai.evacortex.scramble.core.util.ScrambleTracer;
import ai.evacortex.scramble.core.util.StderrTracer;

import java.util.Objects;
import java.util.Random;

/**
 * Randomizes the phase of every non-DC, non-Nyquist frequency bin of a real signal
 * while leaving its amplitude spectrum untouched.
 *
 * <p>For an even-padded length {@code L} there are {@code H = L/2 - 1} shiftable bins.
 * Bin {@code k} in {@code 1..H} is multiplied by {@code e^{iφ_k}} and its mirror
 * {@code L-k} by {@code e^{-iφ_k}}, which keeps the spectrum conjugate-symmetric so the
 * inverse transform stays real. One shift vector is shared by all channels.</p>
 *
 * <p>The returned shift vector, passed back together with the same input, reproduces
 * the scramble exactly.</p>
 */
public class SpectralPhaseScrambler {

    private final Random random;
    private final ScrambleTracer tracer;

    public SpectralPhaseScrambler() {
        this(new Random(), new StderrTracer());
    }

    public SpectralPhaseScrambler(Random random) {
        this(random, new StderrTracer());
    }

    public SpectralPhaseScrambler(Random random, ScrambleTracer tracer) {
        this.random = Objects.requireNonNull(random, "random must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
    }

    /**
     * Number of shiftable bins for a signal of {@code samples} rows.
     */
    public static int shiftableBins(int samples) {
        int even = samples + (samples % 2);
        return even / 2 - 1;
    }

    /**
     * Scrambles with shifts drawn uniformly from {@code [0, maxShift)}.
     *
     * @throws ArgumentCountException   if {@code signal} is {@code null}
     * @throws ParameterDomainException if {@code maxShift} is NaN or infinite
     */
    public PhaseScrambleResult scramble(Signal signal, double maxShift) {
        requireSignal(signal);
        if (Double.isNaN(maxShift) || Double.isInfinite(maxShift)) {
            throw new ParameterDomainException("maxShift must be a finite number, got " + maxShift);
        }
        adviseOnChannels(signal);

        double[] shifts = new double[shiftableBins(signal.samples())];
        for (int k = 0; k < shifts.length; k++) {
            shifts[k] = random.nextDouble() * maxShift;
        }
        return apply(signal.paddedToEven(), shifts);
    }

    /**
     * Scrambles with a precomputed shift vector, typically one returned by an earlier call.
     *
     * @throws ArgumentCountException if {@code signal} or {@code shifts} is {@code null}
     * @throws ShapeMismatchException if {@code shifts.length} differs from {@link #shiftableBins(int)}
     */
    public PhaseScrambleResult scramble(Signal signal, double[] shifts) {
        requireSignal(signal);
        if (shifts == null) {
            throw new ArgumentCountException("shift vector is required");
        }
        int expected = shiftableBins(signal.samples());
        if (shifts.length != expected) {
            throw new ShapeMismatchException(
                    "only " + expected + " frequencies can be shifted for " + signal.samples() + " samples",
                    expected, shifts.length);
        }
        adviseOnChannels(signal);
        return apply(signal.paddedToEven(), shifts.clone());
    }

    static Complex[] multiplier(int length, double[] shifts) {
        int h = length / 2 - 1;
        Complex[] m = new Complex[length];
        m[0] = Complex.ONE;
        m[h + 1] = Complex.ONE;
        for (int k = 1; k <= h; k++) {
            Complex phasor = Complex.expI(shifts[k - 1]);
            m[k] = phasor;
            m[length - k] = phasor.conjugate();
        }
        return m;
    }

    private PhaseScrambleResult apply(Signal padded, double[] shifts) {
        int length = padded.samples();
        int channels = padded.channels();
        Complex[] m = multiplier(length, shifts);

        double[][] out = new double[length][channels];
        double residue = 0.0;

        for (int c = 0; c < channels; c++) {
            Complex[] spectrum = Fft.forward(padded.channel(c));
            for (int k = 0; k < length; k++) {
                spectrum[k] = spectrum[k].multiply(m[k]);
            }
            Complex[] restored = Fft.inverse(spectrum);
            for (int i = 0; i < length; i++) {
                out[i][c] = restored[i].real;
                residue = Math.max(residue, Math.abs(restored[i].imag));
            }
        }
        return new PhaseScrambleResult(new Signal(out), shifts, residue);
    }

    private static void requireSignal(Signal signal) {
        if (signal == null) {
            throw new ArgumentCountException("signal is required");
        }
    }

    private void adviseOnChannels(Signal signal) {
        if (signal.channels() > 2) {
            tracer.advisory("Detected " + signal.channels()
                    + " channels. The same phase shifts will be applied to every channel.");
        }
    }
}
