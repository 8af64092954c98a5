/*
 * StimulusScramble — Perceptual Stimulus Scrambler
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.scramble.core;

import ai.evacortex.scramble.core.ScrambleTestUtils.RecordingTracer;
import ai.evacortex.scramble.core.exceptions.ArgumentCountException;
import ai.evacortex.scramble.core.exceptions.ParameterDomainException;
import ai.evacortex.scramble.core.exceptions.ShapeMismatchException;
import ai.evacortex.scramble.core.metadata.ScrambleRecord;
import ai.evacortex.scramble.core.metadata.ScrambleRecordStore;
import ai.evacortex.scramble.core.util.HashingUtil;
import ai.evacortex.scramble.core.warp.WarpParameters;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StimulusScramblerTest {

    @TempDir Path tempDir;

    private static Clip clip() {
        Signal audio = ScrambleTestUtils.randomSignal(301, 2, 1);
        FrameSequence video = FrameSequence.of(
                ScrambleTestUtils.randomFrame(10, 14, 3, 1),
                ScrambleTestUtils.randomFrame(10, 14, 3, 2),
                ScrambleTestUtils.randomFrame(10, 14, 3, 3));
        return new Clip(audio, video);
    }

    @Test
    void storedRecord_reproducesAudioAndVideo() {
        Clip clip = clip();
        ScrambleRecordStore store = ScrambleRecordStore.loadOrCreate(tempDir.resolve("records.json"));

        ScrambledClip first;
        try (StimulusScrambler scrambler = new StimulusScrambler(new RecordingTracer(), store, true)) {
            first = scrambler.scramble(clip, new WarpParameters(12, 4), Math.PI, 2024L);
        }

        String id = HashingUtil.computeContentHash(clip.audio());
        assertEquals(id, first.record().sourceId());
        assertEquals(150, first.record().phase().shifts().length);

        ScrambleRecord loaded = ScrambleRecordStore.loadOrCreate(tempDir.resolve("records.json")).get(id);
        ScrambledClip again;
        try (StimulusScrambler scrambler = new StimulusScrambler(new RecordingTracer(), null, false)) {
            again = scrambler.reproduce(clip, loaded);
        }

        assertEquals(0.0, ScrambleTestUtils.maxAbsDiff(first.audio(), again.audio()), 1e-12);
        for (int i = 0; i < clip.video().size(); i++) {
            assertEquals(0.0, ScrambleTestUtils.maxAbsDiff(first.video().get(i), again.video().get(i)), 0.0);
        }
    }

    @Test
    void silentClip_isKeyedByFirstFrame() {
        Clip silent = Clip.silent(clip().video());

        try (StimulusScrambler scrambler = new StimulusScrambler(new RecordingTracer(), null, false)) {
            ScrambledClip out = scrambler.scramble(silent, new WarpParameters(5, 2), Math.PI, 1L);

            assertNull(out.audio());
            assertNull(out.record().phase());
            assertEquals(HashingUtil.computeContentHash(silent.video().get(0)), out.record().sourceId());
            assertEquals(3, out.video().size());
        }
    }

    @Test
    void recordForOtherGeometry_isRejected() {
        Clip clip = clip();
        try (StimulusScrambler scrambler = new StimulusScrambler(new RecordingTracer(), null, false)) {
            ScrambleRecord record = scrambler.scramble(clip, new WarpParameters(5, 2), Math.PI, 1L).record();
            Clip smaller = Clip.silent(FrameSequence.of(ScrambleTestUtils.randomFrame(8, 8, 3, 4)));

            assertThrows(ShapeMismatchException.class, () -> scrambler.reproduce(smaller, record));
        }
    }

    @Test
    void recordWithoutWarp_isRejected() {
        Clip clip = clip();
        try (StimulusScrambler scrambler = new StimulusScrambler(new RecordingTracer(), null, false)) {
            ScrambleRecord full = scrambler.scramble(clip, new WarpParameters(5, 2), Math.PI, 1L).record();
            ScrambleRecord noWarp = new ScrambleRecord(full.sourceId(), full.phase(), null);

            assertThrows(ArgumentCountException.class, () -> scrambler.reproduce(clip, noWarp));
        }
    }

    @Test
    void geometryMismatch_failsBeforeAudioIsTouched() {
        Signal audio = ScrambleTestUtils.randomSignal(120, 3, 5);
        Clip clip = new Clip(audio, FrameSequence.of(ScrambleTestUtils.randomFrame(10, 14, 3, 1)));
        ScrambleRecord record;
        try (StimulusScrambler scrambler = new StimulusScrambler(new RecordingTracer(), null, false)) {
            record = scrambler.scramble(clip, new WarpParameters(5, 2), Math.PI, 1L).record();
        }

        Clip resized = new Clip(audio, FrameSequence.of(ScrambleTestUtils.randomFrame(8, 8, 3, 1)));
        RecordingTracer tracer = new RecordingTracer();
        try (StimulusScrambler scrambler = new StimulusScrambler(tracer, null, false)) {
            assertThrows(ShapeMismatchException.class, () -> scrambler.reproduce(resized, record));
        }
        assertTrue(tracer.advisories.isEmpty());
    }

    @Test
    void recordForOtherChannelCount_isRejected() {
        Clip clip = clip();
        try (StimulusScrambler scrambler = new StimulusScrambler(new RecordingTracer(), null, false)) {
            ScrambleRecord record = scrambler.scramble(clip, new WarpParameters(5, 2), Math.PI, 1L).record();
            Clip mono = new Clip(ScrambleTestUtils.randomSignal(301, 1, 1), clip.video());
            Clip shorter = new Clip(ScrambleTestUtils.randomSignal(299, 2, 1), clip.video());

            assertThrows(ShapeMismatchException.class, () -> scrambler.reproduce(mono, record));
            assertThrows(ShapeMismatchException.class, () -> scrambler.reproduce(shorter, record));
        }
    }

    @Test
    void recordFromOtherSource_isRejected() {
        Clip clip = clip();
        try (StimulusScrambler scrambler = new StimulusScrambler(new RecordingTracer(), null, false)) {
            ScrambleRecord record = scrambler.scramble(clip, new WarpParameters(5, 2), Math.PI, 1L).record();
            Clip other = new Clip(ScrambleTestUtils.randomSignal(301, 2, 99), clip.video());

            assertThrows(ParameterDomainException.class, () -> scrambler.reproduce(other, record));
        }
    }

    @Test
    void defaults_applyWhenParametersAreOmitted() {
        Clip clip = clip();
        try (StimulusScrambler scrambler = new StimulusScrambler(new RecordingTracer(), null, true)) {
            ScrambleRecord record = scrambler.scramble(clip, 9L).record();

            assertEquals(ScrambleDefaults.MAX_DISTORTION, record.warp().maxDistortion());
            assertEquals(ScrambleDefaults.WARP_STEPS, record.warp().steps());
            assertEquals(ScrambleDefaults.MAX_PHASE_SHIFT, record.phase().maxPhaseShift(), 0.0);
        }
    }
}
