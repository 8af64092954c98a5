/*
 * StimulusScramble — Perceptual Stimulus Scrambler
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.scramble.core.warp;

import ai.evacortex.scramble.core.exceptions.ArgumentCountException;
import ai.evacortex.scramble.core.exceptions.ParameterDomainException;
import ai.evacortex.scramble.core.exceptions.ShapeMismatchException;

import java.util.List;

/**
 * Everything a single frame warp needs, built once per batch and shared read-only
 * between frames and threads.
 *
 * <p>Holds the three generated fields A, B and F and derives the four quadrant fields
 * in their fixed order: A, F−A, B, F−B. The canvas is twice the source frame size
 * in both directions.</p>
 */
public final class WarpContext {

    private final DisplacementField fieldA;
    private final DisplacementField fieldB;
    private final DisplacementField fieldF;
    private final List<DisplacementField> quadrants;
    private final List<SamplingGrid> grids;
    private final int steps;

    private WarpContext(DisplacementField a, DisplacementField b, DisplacementField f, int steps) {
        this.fieldA = a;
        this.fieldB = b;
        this.fieldF = f;
        this.steps = steps;
        this.quadrants = List.of(a, f.minus(a), b, f.minus(b));
        this.grids = quadrants.stream().map(SamplingGrid::of).toList();
    }

    /**
     * Draws A, B and F (in that order) from {@code generator} for frames of {@code rows x cols}.
     */
    public static WarpContext generate(int rows, int cols, WarpParameters params,
                                       DisplacementFieldGenerator generator) {
        if (params == null || generator == null) {
            throw new ArgumentCountException("warp parameters and generator are required");
        }
        if (rows < 1 || cols < 1) {
            throw new ParameterDomainException("frame size must be positive, got " + rows + "x" + cols);
        }
        int width = 2 * cols;
        int height = 2 * rows;
        DisplacementField a = generator.generate(width, height, params);
        DisplacementField b = generator.generate(width, height, params);
        DisplacementField f = generator.generate(width, height, params);
        return new WarpContext(a, b, f, params.steps());
    }

    /**
     * Uses caller-supplied fields instead of drawing new ones. All three must share one
     * canvas grid with even dimensions.
     */
    public static WarpContext fromFields(DisplacementField a, DisplacementField b,
                                         DisplacementField f, int steps) {
        if (a == null || b == null || f == null) {
            throw new ArgumentCountException("three displacement fields are required");
        }
        if (steps < 1) {
            throw new ParameterDomainException("steps must be a positive integer, got " + steps);
        }
        for (DisplacementField other : List.of(b, f)) {
            if (other.rows() != a.rows() || other.cols() != a.cols()) {
                throw new ShapeMismatchException("all fields must be " + a.rows() + "x" + a.cols());
            }
        }
        if (a.rows() % 2 != 0 || a.cols() % 2 != 0) {
            throw new ShapeMismatchException("canvas must have even dimensions, got " + a.rows() + "x" + a.cols());
        }
        return new WarpContext(a, b, f, steps);
    }

    public DisplacementField fieldA() {
        return fieldA;
    }

    public DisplacementField fieldB() {
        return fieldB;
    }

    public DisplacementField fieldF() {
        return fieldF;
    }

    public List<DisplacementField> quadrantFields() {
        return quadrants;
    }

    public int steps() {
        return steps;
    }

    public int canvasRows() {
        return fieldA.rows();
    }

    public int canvasCols() {
        return fieldA.cols();
    }

    List<SamplingGrid> grids() {
        return grids;
    }
}
