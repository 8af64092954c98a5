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
import ai.evacortex.scramble.core.ScrambleTestUtils;
import ai.evacortex.scramble.core.ScrambleTestUtils.RecordingTracer;
import ai.evacortex.scramble.core.exceptions.ArgumentCountException;
import ai.evacortex.scramble.core.exceptions.FrameWarpException;
import ai.evacortex.scramble.core.exceptions.ShapeMismatchException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class FrameBatchProcessorTest {

    private static final int FRAMES = 8;

    private RecordingTracer tracer;
    private FrameBatchProcessor processor;

    @BeforeEach
    void setUp() {
        tracer = new RecordingTracer();
        processor = new FrameBatchProcessor(new DiffeomorphicWarper(),
                new DisplacementFieldGenerator(new Random(1)), tracer, 4);
    }

    @AfterEach
    void tearDown() {
        processor.close();
    }

    private static FrameSequence movie(int frames, int rows, int cols, int planes) {
        List<Frame> list = new ArrayList<>();
        for (int i = 0; i < frames; i++) {
            list.add(ScrambleTestUtils.randomFrame(rows, cols, planes, 100 + i));
        }
        return new FrameSequence(list);
    }

    @Test @Timeout(60)
    void parallelAndSequential_giveIdenticalFrames() {
        FrameSequence frames = movie(FRAMES, 10, 12, 3);
        WarpParameters params = new WarpParameters(8, 4);

        FrameSequence seq = processor.warpSequence(frames, params, false, 77L);
        FrameSequence par = processor.warpSequence(frames, params, true, 77L);

        assertEquals(FRAMES, par.size());
        for (int i = 0; i < FRAMES; i++) {
            assertEquals(0.0, ScrambleTestUtils.maxAbsDiff(seq.get(i), par.get(i)), 0.0, "frame " + i);
        }
    }

    @Test @Timeout(60)
    void outputOrder_matchesInputOrder() {
        FrameSequence frames = movie(FRAMES, 8, 8, 1);
        WarpContext ctx = WarpContext.generate(8, 8, new WarpParameters(12, 3), DisplacementFieldGenerator.seeded(5));
        DiffeomorphicWarper single = new DiffeomorphicWarper();

        FrameSequence out = processor.warpSequence(frames, ctx, true);

        for (int i = 0; i < FRAMES; i++) {
            Frame expected = single.warp(frames.get(i), ctx);
            assertEquals(0.0, ScrambleTestUtils.maxAbsDiff(expected, out.get(i)), 0.0, "frame " + i);
        }
    }

    @Test
    void identicalFrames_areWarpedIdentically() {
        Frame frame = ScrambleTestUtils.checkerboard(16, 16, 2);
        FrameSequence frames = FrameSequence.of(frame, frame, frame);

        FrameSequence out = processor.warpSequence(frames, new WarpParameters(20, 5), true);

        assertEquals(0.0, ScrambleTestUtils.maxAbsDiff(out.get(0), out.get(1)), 0.0);
        assertEquals(0.0, ScrambleTestUtils.maxAbsDiff(out.get(0), out.get(2)), 0.0);
        assertTrue(ScrambleTestUtils.maxAbsDiff(frame, out.get(0)) > 0.0);
    }

    @Test
    void sameSeed_reproducesSequence() {
        FrameSequence frames = movie(3, 9, 7, 1);
        WarpParameters params = new WarpParameters(10, 3);

        FrameSequence a = processor.warpSequence(frames, params, true, 123L);
        FrameSequence b = processor.warpSequence(frames, params, true, 123L);
        FrameSequence c = processor.warpSequence(frames, params, true, 124L);

        assertEquals(0.0, ScrambleTestUtils.maxAbsDiff(a.get(2), b.get(2)), 0.0);
        assertTrue(ScrambleTestUtils.maxAbsDiff(a.get(2), c.get(2)) > 0.0);
    }

    @Test
    void everyFrame_isReported() {
        processor.warpSequence(movie(5, 6, 6, 1), new WarpParameters(4, 2), true);

        assertEquals(5, tracer.warpedFrames.size());
        assertTrue(tracer.warpedFrames.containsAll(List.of(0, 1, 2, 3, 4)));
    }

    @Test
    void failingFrame_abortsWholeBatch() {
        FrameWarper flaky = (frame, ctx) -> {
            if (frame.get(0, 0, 0) < 0) {
                throw new IllegalStateException("bad frame");
            }
            return new DiffeomorphicWarper().warp(frame, ctx);
        };
        List<Frame> list = new ArrayList<>(movie(5, 6, 6, 1).frames());
        double[][] bad = new double[6][6];
        bad[0][0] = -1.0;
        list.set(2, Frame.grayscale(bad));
        FrameSequence frames = new FrameSequence(list);

        try (FrameBatchProcessor failing = new FrameBatchProcessor(flaky, DisplacementFieldGenerator.seeded(9), tracer, 4)) {
            for (boolean parallel : new boolean[]{false, true}) {
                FrameWarpException ex = assertThrows(FrameWarpException.class,
                        () -> failing.warpSequence(frames, new WarpParameters(4, 2), parallel));
                assertEquals(2, ex.frameIndex());
                assertInstanceOf(IllegalStateException.class, ex.getCause());
            }
        }
    }

    @Test
    void contextForOtherFrameSize_isRejectedBeforeAnyFrameIsWarped() {
        FrameSequence frames = movie(3, 10, 10, 1);
        WarpContext context = WarpContext.generate(8, 8, new WarpParameters(4, 2), DisplacementFieldGenerator.seeded(3));

        for (boolean parallel : new boolean[]{false, true}) {
            assertThrows(ShapeMismatchException.class, () -> processor.warpSequence(frames, context, parallel));
        }
        assertTrue(tracer.warpedFrames.isEmpty());
    }

    @Test
    void warpFrame_withZeroDistortion_returnsInput() {
        Frame frame = ScrambleTestUtils.randomFrame(11, 13, 3, 3);

        Frame out = processor.warpFrame(frame, new WarpParameters(0, 3));

        assertEquals(0.0, ScrambleTestUtils.maxAbsDiff(frame, out), 0.0);
    }

    @Test
    void missingArguments_areRejected() {
        FrameSequence frames = movie(2, 4, 4, 1);
        assertThrows(ArgumentCountException.class, () -> processor.warpSequence(null, new WarpParameters(1, 1), false));
        assertThrows(ArgumentCountException.class, () -> processor.warpSequence(frames, (WarpParameters) null, false));
        assertThrows(ArgumentCountException.class, () -> processor.warpFrame(null, new WarpParameters(1, 1)));
    }

    @Test
    void framesOfDifferentSize_cannotFormSequence() {
        assertThrows(ShapeMismatchException.class, () -> FrameSequence.of(
                ScrambleTestUtils.randomFrame(4, 4, 1, 1),
                ScrambleTestUtils.randomFrame(4, 5, 1, 2)));
        assertThrows(ShapeMismatchException.class, () -> FrameSequence.of(
                ScrambleTestUtils.randomFrame(4, 4, 1, 1),
                ScrambleTestUtils.randomFrame(4, 4, 3, 2)));
    }
}
