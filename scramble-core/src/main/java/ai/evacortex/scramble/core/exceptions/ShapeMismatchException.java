/*
 * StimulusScramble — Perceptual Stimulus Scrambler
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.scramble.core.exceptions;

public class ShapeMismatchException extends RuntimeException {
    public ShapeMismatchException(String message) {
        super("Shape mismatch: " + message);
    }

    public ShapeMismatchException(String what, int expected, int actual) {
        super("Shape mismatch: " + what + " expected " + expected + " but got " + actual);
    }
}
