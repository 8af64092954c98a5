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
 * Real-valued multichannel time series, laid out as {@code data[sample][channel]}.
 */
public record Signal(double[][] data) {

    public Signal {
        if (data == null) {
            throw new ArgumentCountException("signal data is required");
        }
        if (data.length == 0) {
            throw new ParameterDomainException("signal must contain at least one sample");
        }
        int channels = data[0] == null ? 0 : data[0].length;
        if (channels == 0) {
            throw new ParameterDomainException("signal must contain at least one channel");
        }
        for (int i = 1; i < data.length; i++) {
            if (data[i] == null || data[i].length != channels) {
                throw new ParameterDomainException("signal row " + i + " does not have " + channels + " channels");
            }
        }
    }

    public static Signal mono(double... samples) {
        double[][] d = new double[samples.length][1];
        for (int i = 0; i < samples.length; i++) {
            d[i][0] = samples[i];
        }
        return new Signal(d);
    }

    public int samples() {
        return data.length;
    }

    public int channels() {
        return data[0].length;
    }

    public double[] channel(int c) {
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = data[i][c];
        }
        return out;
    }

    /**
     * Returns this signal, or a copy with one trailing zero row when the sample count is odd.
     */
    public Signal paddedToEven() {
        if (data.length % 2 == 0) {
            return this;
        }
        double[][] padded = new double[data.length + 1][];
        for (int i = 0; i < data.length; i++) {
            padded[i] = data[i].clone();
        }
        padded[data.length] = new double[channels()];
        return new Signal(padded);
    }
}
