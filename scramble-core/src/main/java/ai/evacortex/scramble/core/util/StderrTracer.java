/*
 * StimulusScramble — Perceptual Stimulus Scrambler
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.scramble.core.util;

public class StderrTracer implements ScrambleTracer {

    private final boolean progress;

    public StderrTracer() {
        this(Boolean.getBoolean("scramble.trace.progress"));
    }

    public StderrTracer(boolean progress) {
        this.progress = progress;
    }

    @Override
    public void advisory(String message) {
        System.err.println("[WARN] " + message);
    }

    @Override
    public void frameWarped(int frameIndex, int totalFrames) {
        if (progress) {
            System.err.println("Applied warp for frame " + (frameIndex + 1) + " of " + totalFrames);
        }
    }
}
