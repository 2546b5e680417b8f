package com.largomodo.ksynth.k4;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.SysexCodec;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.LEVEL;

/**
 * Amplifier ADSR envelope, all four stages 0-100.
 */
public record Envelope(BoundedValue attack, BoundedValue decay, BoundedValue sustain, BoundedValue release) {

    public static final int DATA_SIZE = 4;
    public static final SysexCodec<Envelope> CODEC =
            SysexCodec.of("K4 envelope", DATA_SIZE, Envelope::read, Envelope::write);

    public Envelope {
        require(attack, LEVEL, "attack");
        require(decay, LEVEL, "decay");
        require(sustain, LEVEL, "sustain");
        require(release, LEVEL, "release");
    }

    public static Envelope of(int attack, int decay, int sustain, int release) {
        return new Envelope(BoundedValue.of(LEVEL, attack), BoundedValue.of(LEVEL, decay),
                BoundedValue.of(LEVEL, sustain), BoundedValue.of(LEVEL, release));
    }

    public static Envelope defaults() {
        return of(0, 50, 0, 50);
    }

    public static Envelope read(ByteReader in) {
        return new Envelope(in.readValue(LEVEL), in.readValue(LEVEL), in.readValue(LEVEL), in.readValue(LEVEL));
    }

    public void write(ByteWriter out) {
        out.writeValue(attack);
        out.writeValue(decay);
        out.writeValue(sustain);
        out.writeValue(release);
    }
}
