package com.largomodo.ksynth.k4;

import com.largomodo.ksynth.core.BoundedValue;

import java.util.Objects;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.DEPTH;
import static com.largomodo.ksynth.core.Category.LEVEL;

/**
 * Vibrato settings of a single.
 * <p>
 * Not a contiguous block: the shape shares s14 with the source mute bits, the
 * speed is s16, and pressure and depth are s22-s23. {@link SinglePatch} reads
 * and writes the fields in place.
 */
public record Vibrato(LfoShape shape, BoundedValue speed, BoundedValue pressure, BoundedValue depth) {

    public Vibrato {
        Objects.requireNonNull(shape, "shape must not be null");
        require(speed, LEVEL, "speed");
        require(pressure, DEPTH, "pressure");
        require(depth, DEPTH, "depth");
    }

    public static Vibrato defaults() {
        return new Vibrato(LfoShape.TRIANGLE, BoundedValue.zero(LEVEL), BoundedValue.zero(DEPTH),
                BoundedValue.zero(DEPTH));
    }
}
