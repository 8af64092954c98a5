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

/**
 * Decoded movie content handed over by a loader: optional audio and the frame sequence.
 */
public record Clip(Signal audio, FrameSequence video) {

    public Clip {
        if (video == null) {
            throw new ArgumentCountException("clip video is required");
        }
    }

    public static Clip silent(FrameSequence video) {
        return new Clip(null, video);
    }

    public boolean hasAudio() {
        return audio != null;
    }
}
