/*
 * StimulusScramble — Perceptual Stimulus Scrambler
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.scramble.core.warp;

import ai.evacortex.scramble.core.ScrambleDefaults;
import ai.evacortex.scramble.core.exceptions.ArgumentCountException;
import ai.evacortex.scramble.core.exceptions.ParameterDomainException;
import ai.evacortex.scramble.core.exceptions.ShapeMismatchException;

/**
 * Warp strength settings.
 *
 * @param maxDistortion roughly the largest per-quadrant pixel displacement on the 2x canvas
 * @param steps         number of resampling passes per quadrant; the total is {@code 4 * steps}
 */
public record WarpParameters(int maxDistortion, int steps) {

    public WarpParameters {
        if (maxDistortion < 0) {
            throw new ParameterDomainException("maxDistortion must be non-negative, got " + maxDistortion);
        }
        if (steps < 1) {
            throw new ParameterDomainException("steps must be a positive integer, got " + steps);
        }
    }

    public static WarpParameters defaults() {
        return new WarpParameters(ScrambleDefaults.MAX_DISTORTION, ScrambleDefaults.WARP_STEPS);
    }

    /**
     * Validates a loosely typed {@code [maxDistortion, steps]} pair as handed over by a
     * parameter-collection layer.
     */
    public static WarpParameters of(double... values) {
        if (values == null) {
            throw new ArgumentCountException("warp parameters are required");
        }
        if (values.length != 2) {
            throw new ShapeMismatchException("warp parameters", 2, values.length);
        }
        for (double v : values) {
            if (Double.isNaN(v) || Double.isInfinite(v) || v < 0 || v != Math.rint(v)) {
                throw new ParameterDomainException("warp parameters must be non-negative integers, got " + v);
            }
            if (v > Integer.MAX_VALUE) {
                throw new ParameterDomainException("warp parameter out of range: " + v);
            }
        }
        return new WarpParameters((int) values[0], (int) values[1]);
    }
}
