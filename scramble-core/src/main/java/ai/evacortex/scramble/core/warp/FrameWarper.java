/*
 * StimulusScramble — Perceptual Stimulus Scrambler
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.scramble.core.warp;

import ai.evacortex.scramble.core.Frame;

/**
 * Applies a prepared {@link WarpContext} to one frame. Implementations must be
 * side-effect free so that frames can be processed concurrently.
 */
@FunctionalInterface
public interface FrameWarper {

    Frame warp(Frame frame, WarpContext context);
}
