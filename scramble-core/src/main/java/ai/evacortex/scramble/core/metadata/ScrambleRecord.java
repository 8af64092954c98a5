/*
 * StimulusScramble — Perceptual Stimulus Scrambler
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.scramble.core.metadata;

import java.util.Arrays;
import java.util.Objects;

/**
 * Everything needed to regenerate a scrambled clip from its source.
 *
 * @param sourceId MD5 content hash of the source audio, or of the first frame when the clip is silent
 * @param phase    audio phase scramble, {@code null} for clips without audio
 * @param warp     video warp
 */
public record ScrambleRecord(String sourceId, PhaseRecord phase, WarpRecord warp) {

    /**
     * @param checksum xxHash64 of {@code shifts}, verified on load
     */
    public record PhaseRecord(double maxPhaseShift, int samples, int channels, double[] shifts, long checksum) {

        public PhaseRecord {
            shifts = shifts == null ? null : shifts.clone();
        }

        @Override
        public double[] shifts() {
            return shifts == null ? null : shifts.clone();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof PhaseRecord other)) return false;
            return Double.compare(maxPhaseShift, other.maxPhaseShift) == 0
                    && samples == other.samples
                    && channels == other.channels
                    && checksum == other.checksum
                    && Arrays.equals(shifts, other.shifts);
        }

        @Override
        public int hashCode() {
            return Objects.hash(maxPhaseShift, samples, channels, Arrays.hashCode(shifts), checksum);
        }

        @Override
        public String toString() {
            return "PhaseRecord[maxPhaseShift=" + maxPhaseShift + ", samples=" + samples + ", channels=" + channels
                    + ", shifts=" + Arrays.toString(shifts) + ", checksum=" + checksum + "]";
        }
    }

    /**
     * Fields are not stored; they are regenerated from {@code seed} for a
     * {@code rows x cols} frame.
     */
    public record WarpRecord(long seed, int maxDistortion, int steps, int rows, int cols) {}
}
