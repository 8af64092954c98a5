/*
 * StimulusScramble — Perceptual Stimulus Scrambler
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.scramble.core;

import ai.evacortex.scramble.core.audio.PhaseScrambleResult;
import ai.evacortex.scramble.core.audio.SpectralPhaseScrambler;
import ai.evacortex.scramble.core.exceptions.ArgumentCountException;
import ai.evacortex.scramble.core.exceptions.ParameterDomainException;
import ai.evacortex.scramble.core.exceptions.ShapeMismatchException;
import ai.evacortex.scramble.core.metadata.ScrambleRecord;
import ai.evacortex.scramble.core.metadata.ScrambleRecord.PhaseRecord;
import ai.evacortex.scramble.core.metadata.ScrambleRecord.WarpRecord;
import ai.evacortex.scramble.core.metadata.ScrambleRecordStore;
import ai.evacortex.scramble.core.util.HashingUtil;
import ai.evacortex.scramble.core.util.ScrambleTracer;
import ai.evacortex.scramble.core.util.StderrTracer;
import ai.evacortex.scramble.core.warp.DiffeomorphicWarper;
import ai.evacortex.scramble.core.warp.DisplacementFieldGenerator;
import ai.evacortex.scramble.core.warp.FrameBatchProcessor;
import ai.evacortex.scramble.core.warp.WarpParameters;

import java.io.Closeable;
import java.util.Objects;
import java.util.Random;

/**
 * Scrambles a whole clip: phase-randomizes its audio and diffeomorphically warps its video,
 * returning a {@link ScrambleRecord} that regenerates both from the same source.
 *
 * <p>When constructed with a {@link ScrambleRecordStore}, each record is also persisted there.</p>
 */
public class StimulusScrambler implements Closeable {

    private final ScrambleTracer tracer;
    private final ScrambleRecordStore recordStore;
    private final FrameBatchProcessor batchProcessor;
    private final boolean parallel;

    public StimulusScrambler() {
        this(new StderrTracer(), null, true);
    }

    public StimulusScrambler(ScrambleTracer tracer, ScrambleRecordStore recordStore, boolean parallel) {
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.recordStore = recordStore;
        this.parallel = parallel;
        this.batchProcessor = new FrameBatchProcessor(new DiffeomorphicWarper(),
                new DisplacementFieldGenerator(new Random()), tracer);
    }

    /**
     * Scrambles with {@link WarpParameters#defaults()} and {@link ScrambleDefaults#MAX_PHASE_SHIFT}.
     */
    public ScrambledClip scramble(Clip clip, long seed) {
        return scramble(clip, WarpParameters.defaults(), ScrambleDefaults.MAX_PHASE_SHIFT, seed);
    }

    public ScrambledClip scramble(Clip clip, WarpParameters params, double maxPhaseShift, long seed) {
        if (clip == null || params == null) {
            throw new ArgumentCountException("clip and warp parameters are required");
        }
        String id = sourceId(clip);

        Signal audio = null;
        PhaseRecord phase = null;
        if (clip.hasAudio()) {
            SpectralPhaseScrambler scrambler = new SpectralPhaseScrambler(new Random(seed), tracer);
            PhaseScrambleResult result = scrambler.scramble(clip.audio(), maxPhaseShift);
            audio = result.signal();
            phase = new PhaseRecord(maxPhaseShift, clip.audio().samples(), clip.audio().channels(),
                    result.shifts(), HashingUtil.checksum(result.shifts()));
        }

        FrameSequence video = batchProcessor.warpSequence(clip.video(), params, parallel, seed);
        WarpRecord warp = new WarpRecord(seed, params.maxDistortion(), params.steps(),
                clip.video().rows(), clip.video().cols());

        ScrambleRecord record = new ScrambleRecord(id, phase, warp);
        if (recordStore != null) {
            recordStore.put(record);
        }
        return new ScrambledClip(audio, video, record);
    }

    /**
     * Re-applies a stored scramble to its source clip. The record is checked against the
     * clip in full before any transform runs.
     *
     * @throws ArgumentCountException   if the record carries no warp
     * @throws ShapeMismatchException   if the clip does not have the recorded geometry
     * @throws ParameterDomainException if the record was made from a different source
     */
    public ScrambledClip reproduce(Clip clip, ScrambleRecord record) {
        if (clip == null || record == null) {
            throw new ArgumentCountException("clip and scramble record are required");
        }
        WarpRecord warp = record.warp();
        if (warp == null) {
            throw new ArgumentCountException("scramble record has no warp");
        }
        if (warp.rows() != clip.video().rows() || warp.cols() != clip.video().cols()) {
            throw new ShapeMismatchException("record was made for " + warp.rows() + "x" + warp.cols()
                    + " frames, clip has " + clip.video().rows() + "x" + clip.video().cols());
        }
        PhaseRecord phase = record.phase();
        if (clip.hasAudio()) {
            if (phase == null) {
                throw new ShapeMismatchException("record has no phase scramble for a clip with audio");
            }
            if (phase.samples() != clip.audio().samples() || phase.channels() != clip.audio().channels()) {
                throw new ShapeMismatchException("record was made for " + phase.samples() + " samples x "
                        + phase.channels() + " channels, clip has " + clip.audio().samples() + " x "
                        + clip.audio().channels());
            }
        }
        String id = sourceId(clip);
        if (!id.equals(record.sourceId())) {
            throw new ParameterDomainException("record " + record.sourceId() + " does not belong to source " + id);
        }
        WarpParameters params = new WarpParameters(warp.maxDistortion(), warp.steps());

        Signal audio = null;
        if (clip.hasAudio()) {
            audio = new SpectralPhaseScrambler(new Random(), tracer)
                    .scramble(clip.audio(), phase.shifts())
                    .signal();
        }
        FrameSequence video = batchProcessor.warpSequence(clip.video(), params, parallel, warp.seed());
        return new ScrambledClip(audio, video, record);
    }

    @Override
    public void close() {
        batchProcessor.close();
    }

    private static String sourceId(Clip clip) {
        return clip.hasAudio()
                ? HashingUtil.computeContentHash(clip.audio())
                : HashingUtil.computeContentHash(clip.video().get(0));
    }
}
