package com.largomodo.ksynth.core;

/**
 * Bounded parameter categories of both dialects.
 * <p>
 * Each category fixes the legal range of a parameter, its zero point and the
 * bias that maps it onto the wire: {@code wire = value + bias}. Signed values
 * are stored with a positive bias (+50, +64, +24, +7) and one-based indices
 * with a bias of -1. All bias arithmetic in the codebase goes through this table.
 */
public enum Category {

    // Dialect A (K4)
    LEVEL(0, 100, 0, 0),
    DEPTH(-50, 50, 0, 50),
    EFFECT_NUMBER(1, 32, 1, -1),
    WAVE_NUMBER(1, 256, 1, -1),
    CURVE(1, 8, 1, -1),
    COARSE(-24, 24, 0, 24),
    KEY(0, 127, 0, 0),
    BENDER_RANGE(0, 12, 0, 0),
    RESONANCE(0, 7, 0, 0),
    SINGLE_NUMBER(0, 63, 0, 0),
    CHANNEL(1, 16, 1, -1),
    EFFECT_PARAMETER(-7, 7, 0, 7),
    EFFECT_VALUE(0, 31, 0, 0),

    // Dialect B (K5000)
    UNSIGNED_LEVEL(0, 127, 0, 0),
    SIGNED_LEVEL(-63, 63, 0, 64),
    MACRO_DEPTH(-31, 31, 0, 64),
    GEQ_LEVEL(-6, 6, 0, 64),
    LFO_DEPTH(0, 63, 0, 0),
    HARMONIC_ENVELOPE_LEVEL(0, 63, 0, 0),
    BENDER_PITCH(0, 24, 0, 0),
    BENDER_CUTOFF(0, 31, 0, 0),
    FILTER_LEVEL(0, 31, 0, 0),
    VELOCITY_CURVE(1, 12, 1, -1),
    SOURCE_COUNT(2, 6, 2, 0),
    WAVE_KIT(0, 1023, 0, 0),
    EFFECT_PATH(0, 3, 0, 0),
    EFFECT_ALGORITHM(1, 4, 1, -1),
    SINGLE_PATCH(0, 1023, 0, 0),
    PATCH_NUMBER(0, 127, 0, 0),
    EFFECT_DEPTH(0, 100, 0, 0);

    private final int min;
    private final int max;
    private final int zero;
    private final int bias;

    Category(int min, int max, int zero, int bias) {
        this.min = min;
        this.max = max;
        this.zero = zero;
        this.bias = bias;
    }

    public int min() {
        return min;
    }

    public int max() {
        return max;
    }

    /**
     * Neutral value used by default-constructed blocks.
     */
    public int zero() {
        return zero;
    }

    public int bias() {
        return bias;
    }

    public boolean contains(int value) {
        return value >= min && value <= max;
    }

    /**
     * Lowest wire value of this category.
     */
    public int minWire() {
        return min + bias;
    }

    /**
     * Highest wire value of this category.
     */
    public int maxWire() {
        return max + bias;
    }
}
