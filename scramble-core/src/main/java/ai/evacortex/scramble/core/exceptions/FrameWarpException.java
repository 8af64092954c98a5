/*
 * StimulusScramble — Perceptual Stimulus Scrambler
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.scramble.core.exceptions;

public class FrameWarpException extends RuntimeException {

    private final int frameIndex;

    public FrameWarpException(int frameIndex, Throwable cause) {
        super("Warp failed for frame " + frameIndex + ", batch aborted", cause);
        this.frameIndex = frameIndex;
    }

    public int frameIndex() {
        return frameIndex;
    }
}
