package com.largomodo.ksynth.k4;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.SysexCodec;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.DEPTH;
import static com.largomodo.ksynth.core.Category.LEVEL;

/**
 * DCF envelope. Unlike the amplifier envelope, the sustain level is signed (±50).
 */
public record FilterEnvelope(BoundedValue attack, BoundedValue decay, BoundedValue sustain, BoundedValue release) {

    public static final int DATA_SIZE = 4;
    public static final SysexCodec<FilterEnvelope> CODEC =
            SysexCodec.of("K4 filter envelope", DATA_SIZE, FilterEnvelope::read, FilterEnvelope::write);

    public FilterEnvelope {
        require(attack, LEVEL, "attack");
        require(decay, LEVEL, "decay");
        require(sustain, DEPTH, "sustain");
        require(release, LEVEL, "release");
    }

    public static FilterEnvelope of(int attack, int decay, int sustain, int release) {
        return new FilterEnvelope(BoundedValue.of(LEVEL, attack), BoundedValue.of(LEVEL, decay),
                BoundedValue.of(DEPTH, sustain), BoundedValue.of(LEVEL, release));
    }

    public static FilterEnvelope defaults() {
        return of(0, 50, 0, 50);
    }

    public static FilterEnvelope read(ByteReader in) {
        return new FilterEnvelope(in.readValue(LEVEL), in.readValue(LEVEL), in.readValue(DEPTH), in.readValue(LEVEL));
    }

    public void write(ByteWriter out) {
        out.writeValue(attack);
        out.writeValue(decay);
        out.writeValue(sustain);
        out.writeValue(release);
    }
}
