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
import ai.evacortex.scramble.core.FrameSequence;
import ai.evacortex.scramble.core.ScrambleDefaults;
import ai.evacortex.scramble.core.exceptions.ArgumentCountException;
import ai.evacortex.scramble.core.exceptions.FrameWarpException;
import ai.evacortex.scramble.core.exceptions.ShapeMismatchException;
import ai.evacortex.scramble.core.util.ScrambleTracer;
import ai.evacortex.scramble.core.util.StderrTracer;

import java.io.Closeable;
import java.util.Arrays;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveAction;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Warps every frame of a sequence with one shared set of displacement fields, so the
 * whole clip is deformed coherently instead of flickering frame to frame.
 *
 * <p>Frames only read the shared {@link WarpContext}; each one gets its own canvas and
 * writes its result to the output slot of its own index. In parallel mode frames are
 * split across a fork/join pool; output order always matches input order. The first
 * failing frame aborts the batch with {@link FrameWarpException}.</p>
 */
public class FrameBatchProcessor implements Closeable {

    private static final int SPLIT_THRESHOLD = 1;

    private final FrameWarper warper;
    private final DisplacementFieldGenerator generator;
    private final ScrambleTracer tracer;
    private final ForkJoinPool pool;

    public FrameBatchProcessor() {
        this(new DiffeomorphicWarper(), new DisplacementFieldGenerator(new Random()), new StderrTracer());
    }

    public FrameBatchProcessor(FrameWarper warper, DisplacementFieldGenerator generator, ScrambleTracer tracer) {
        this(warper, generator, tracer, ScrambleDefaults.WARP_PARALLELISM);
    }

    public FrameBatchProcessor(FrameWarper warper, DisplacementFieldGenerator generator,
                               ScrambleTracer tracer, int parallelism) {
        this.warper = Objects.requireNonNull(warper, "warper must not be null");
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.pool = new ForkJoinPool(Math.max(1, parallelism));
    }

    /**
     * Warps {@code frames} with fields drawn from this processor's generator.
     */
    public FrameSequence warpSequence(FrameSequence frames, WarpParameters params, boolean parallel) {
        requireInputs(frames, params);
        return warpSequence(frames, WarpContext.generate(frames.rows(), frames.cols(), params, generator), parallel);
    }

    /**
     * Warps {@code frames} with fields drawn from a generator seeded with {@code seed}; the
     * same seed, size and parameters always give the same output.
     */
    public FrameSequence warpSequence(FrameSequence frames, WarpParameters params, boolean parallel, long seed) {
        requireInputs(frames, params);
        WarpContext context = WarpContext.generate(frames.rows(), frames.cols(), params,
                DisplacementFieldGenerator.seeded(seed));
        return warpSequence(frames, context, parallel);
    }

    /**
     * Warps {@code frames} with a prepared context, e.g. one built from stored fields.
     *
     * @throws ShapeMismatchException if the context canvas is not twice the frame size
     */
    public FrameSequence warpSequence(FrameSequence frames, WarpContext context, boolean parallel) {
        if (frames == null || context == null) {
            throw new ArgumentCountException("frames and warp context are required");
        }
        if (context.canvasRows() != 2 * frames.rows()) {
            throw new ShapeMismatchException("canvas rows", 2 * frames.rows(), context.canvasRows());
        }
        if (context.canvasCols() != 2 * frames.cols()) {
            throw new ShapeMismatchException("canvas cols", 2 * frames.cols(), context.canvasCols());
        }
        Frame[] slots = new Frame[frames.size()];
        AtomicBoolean aborted = new AtomicBoolean(false);

        if (parallel && frames.size() > 1) {
            pool.invoke(new WarpTask(frames, context, slots, aborted, 0, frames.size()));
        } else {
            for (int i = 0; i < frames.size(); i++) {
                slots[i] = warpOne(frames, context, i, aborted);
            }
        }
        return new FrameSequence(Arrays.asList(slots));
    }

    /**
     * Warps a single frame with fields generated for this call only.
     */
    public Frame warpFrame(Frame frame, WarpParameters params) {
        if (frame == null || params == null) {
            throw new ArgumentCountException("frame and warp parameters are required");
        }
        WarpContext context = WarpContext.generate(frame.rows(), frame.cols(), params, generator);
        return warper.warp(frame, context);
    }

    @Override
    public void close() {
        pool.shutdown();
    }

    private Frame warpOne(FrameSequence frames, WarpContext context, int index, AtomicBoolean aborted) {
        if (aborted.get()) {
            return null;
        }
        try {
            Frame warped = warper.warp(frames.get(index), context);
            tracer.frameWarped(index, frames.size());
            return warped;
        } catch (RuntimeException e) {
            aborted.set(true);
            throw new FrameWarpException(index, e);
        }
    }

    private static void requireInputs(FrameSequence frames, WarpParameters params) {
        if (frames == null || params == null) {
            throw new ArgumentCountException("frames and warp parameters are required");
        }
    }

    private class WarpTask extends RecursiveAction {
        private final FrameSequence frames;
        private final WarpContext context;
        private final Frame[] slots;
        private final AtomicBoolean aborted;
        private final int from;
        private final int to;

        WarpTask(FrameSequence frames, WarpContext context, Frame[] slots, AtomicBoolean aborted, int from, int to) {
            this.frames = frames;
            this.context = context;
            this.slots = slots;
            this.aborted = aborted;
            this.from = from;
            this.to = to;
        }

        @Override
        protected void compute() {
            if (to - from <= SPLIT_THRESHOLD) {
                for (int i = from; i < to; i++) {
                    slots[i] = warpOne(frames, context, i, aborted);
                }
            } else {
                int mid = (from + to) >>> 1;
                invokeAll(new WarpTask(frames, context, slots, aborted, from, mid),
                        new WarpTask(frames, context, slots, aborted, mid, to));
            }
        }
    }
}
