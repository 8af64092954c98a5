/*
 * StimulusScramble — Perceptual Stimulus Scrambler
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.scramble.core.exceptions;

public class ArgumentCountException extends RuntimeException {
    public ArgumentCountException(String message) {
        super("Missing or surplus argument: " + message);
    }
}
