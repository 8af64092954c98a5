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
import ai.evacortex.scramble.core.exceptions.ShapeMismatchException;

import java.util.List;

/**
 * Ordered frames sharing one spatial size and plane count.
 */
public record FrameSequence(List<Frame> frames) {

    public FrameSequence {
        if (frames == null) {
            throw new ArgumentCountException("frame list is required");
        }
        if (frames.isEmpty()) {
            throw new ParameterDomainException("frame sequence must not be empty");
        }
        Frame first = frames.get(0);
        if (first == null) {
            throw new ArgumentCountException("frame 0 is missing");
        }
        for (int i = 1; i < frames.size(); i++) {
            Frame f = frames.get(i);
            if (f == null) {
                throw new ArgumentCountException("frame " + i + " is missing");
            }
            if (!first.sameShapeAs(f)) {
                throw new ShapeMismatchException("frame " + i + " is " + describe(f)
                        + " but frame 0 is " + describe(first));
            }
        }
        frames = List.copyOf(frames);
    }

    public static FrameSequence of(Frame... frames) {
        return new FrameSequence(List.of(frames));
    }

    public int size() {
        return frames.size();
    }

    public Frame get(int index) {
        return frames.get(index);
    }

    public int rows() {
        return frames.get(0).rows();
    }

    public int cols() {
        return frames.get(0).cols();
    }

    private static String describe(Frame f) {
        return f.rows() + "x" + f.cols() + "x" + f.planeCount();
    }
}
