package com.largomodo.ksynth.k4;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.Discriminants;
import com.largomodo.ksynth.core.SysexCodec;

import java.util.Objects;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.DEPTH;
import static com.largomodo.ksynth.core.Category.LEVEL;

/**
 * Low-frequency oscillator of a single (s24-s28).
 */
public record Lfo(LfoShape shape, BoundedValue speed, BoundedValue delay, BoundedValue depth,
                  BoundedValue pressureDepth) {

    public static final int DATA_SIZE = 5;
    public static final SysexCodec<Lfo> CODEC = SysexCodec.of("K4 LFO", DATA_SIZE, Lfo::read, Lfo::write);

    public Lfo {
        Objects.requireNonNull(shape, "shape must not be null");
        require(speed, LEVEL, "speed");
        require(delay, LEVEL, "delay");
        require(depth, DEPTH, "depth");
        require(pressureDepth, DEPTH, "pressureDepth");
    }

    public static Lfo defaults() {
        return new Lfo(LfoShape.TRIANGLE, BoundedValue.zero(LEVEL), BoundedValue.zero(LEVEL),
                BoundedValue.zero(DEPTH), BoundedValue.zero(DEPTH));
    }

    public static Lfo read(ByteReader in) {
        LfoShape shape = Discriminants.byOrdinal(LfoShape.values(), in.readByte() & 0x03, "LFO shape");
        return new Lfo(shape, in.readValue(LEVEL), in.readValue(LEVEL), in.readValue(DEPTH), in.readValue(DEPTH));
    }

    public void write(ByteWriter out) {
        out.writeByte(shape.ordinal());
        out.writeValue(speed);
        out.writeValue(delay);
        out.writeValue(depth);
        out.writeValue(pressureDepth);
    }
}
