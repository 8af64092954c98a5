/*
 * StimulusScramble — Perceptual Stimulus Scrambler
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.scramble.core;

/**
 * Defaults resolved once from JVM system properties.
 */
public final class ScrambleDefaults {

    public static final int MAX_DISTORTION = Integer.getInteger("scramble.warp.maxDistortion", 20);
    public static final int WARP_STEPS = Integer.getInteger("scramble.warp.steps", 10);
    public static final double MAX_PHASE_SHIFT =
            Double.parseDouble(System.getProperty("scramble.audio.maxPhaseShift", String.valueOf(2 * Math.PI)));
    public static final int WARP_PARALLELISM =
            Integer.getInteger("scramble.warp.parallelism", Runtime.getRuntime().availableProcessors());
    public static final int FFT_PLAN_CACHE_SIZE = Integer.getInteger("scramble.fft.planCacheSize", 16);

    private ScrambleDefaults() {}
}
