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

import java.util.Arrays;
import java.util.Objects;

/**
 * Output of one phase scramble. {@code shifts} is copied on the way in and out.
 *
 * @param signal           scrambled signal, even-length (zero-padded if the input was odd)
 * @param shifts           phase shift per positive-frequency bin, excluding DC and Nyquist
 * @param imaginaryResidue largest absolute imaginary part dropped by the inverse transform
 */
public record PhaseScrambleResult(Signal signal, double[] shifts, double imaginaryResidue) {

    public PhaseScrambleResult {
        shifts = Objects.requireNonNull(shifts, "shifts must not be null").clone();
    }

    @Override
    public double[] shifts() {
        return shifts.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PhaseScrambleResult other)) return false;
        return Double.compare(imaginaryResidue, other.imaginaryResidue) == 0
                && Objects.equals(signal, other.signal)
                && Arrays.equals(shifts, other.shifts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(signal, Arrays.hashCode(shifts), imaginaryResidue);
    }

    @Override
    public String toString() {
        return "PhaseScrambleResult[shifts=" + shifts.length + " bins, imaginaryResidue=" + imaginaryResidue + "]";
    }
}
