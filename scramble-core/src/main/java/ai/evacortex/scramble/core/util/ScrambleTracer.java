/*
 * StimulusScramble — Perceptual Stimulus Scrambler
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.scramble.core.util;

/**
 * Receives non-fatal diagnostics and progress from the scramblers.
 */
public interface ScrambleTracer {

    /**
     * Reports a condition that is unusual but does not stop processing.
     */
    void advisory(String message);

    /**
     * Called once per finished frame; may be invoked from pool threads in any order.
     */
    void frameWarped(int frameIndex, int totalFrames);
}
