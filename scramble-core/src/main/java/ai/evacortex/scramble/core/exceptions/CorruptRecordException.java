/*
 * StimulusScramble — Perceptual Stimulus Scrambler
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.scramble.core.exceptions;

public class CorruptRecordException extends RuntimeException {
    public CorruptRecordException(String id) {
        super("Scramble record '" + id + "' failed checksum verification.");
    }
}
