package com.largomodo.ksynth.k4;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.SysexCodec;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.DEPTH;

/**
 * Envelope time modulation: attack velocity, release velocity and key scaling, each ±50.
 */
public record TimeModulation(BoundedValue attackVelocity, BoundedValue releaseVelocity,
                             BoundedValue keyScaling) {

    public static final int DATA_SIZE = 3;
    public static final SysexCodec<TimeModulation> CODEC =
            SysexCodec.of("K4 time modulation", DATA_SIZE, TimeModulation::read, TimeModulation::write);

    public TimeModulation {
        require(attackVelocity, DEPTH, "attackVelocity");
        require(releaseVelocity, DEPTH, "releaseVelocity");
        require(keyScaling, DEPTH, "keyScaling");
    }

    public static TimeModulation of(int attackVelocity, int releaseVelocity, int keyScaling) {
        return new TimeModulation(BoundedValue.of(DEPTH, attackVelocity), BoundedValue.of(DEPTH, releaseVelocity),
                BoundedValue.of(DEPTH, keyScaling));
    }

    public static TimeModulation defaults() {
        return of(0, 0, 0);
    }

    public static TimeModulation read(ByteReader in) {
        return new TimeModulation(in.readValue(DEPTH), in.readValue(DEPTH), in.readValue(DEPTH));
    }

    public void write(ByteWriter out) {
        out.writeValue(attackVelocity);
        out.writeValue(releaseVelocity);
        out.writeValue(keyScaling);
    }
}
