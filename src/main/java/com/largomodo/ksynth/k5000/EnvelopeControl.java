package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.SysexCodec;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.SIGNED_LEVEL;

/**
 * Amount by which key scaling or velocity moves the DCA envelope, 4 × ±63.
 */
public record EnvelopeControl(BoundedValue level, BoundedValue attackTime, BoundedValue decay1Time,
                              BoundedValue releaseTime) {

    public static final int DATA_SIZE = 4;
    public static final SysexCodec<EnvelopeControl> CODEC =
            SysexCodec.of("K5000 envelope control", DATA_SIZE, EnvelopeControl::read, EnvelopeControl::write);

    public EnvelopeControl {
        require(level, SIGNED_LEVEL, "level");
        require(attackTime, SIGNED_LEVEL, "attackTime");
        require(decay1Time, SIGNED_LEVEL, "decay1Time");
        require(releaseTime, SIGNED_LEVEL, "releaseTime");
    }

    public static EnvelopeControl defaults() {
        BoundedValue zero = BoundedValue.zero(SIGNED_LEVEL);
        return new EnvelopeControl(zero, zero, zero, zero);
    }

    public static EnvelopeControl read(ByteReader in) {
        return new EnvelopeControl(in.readValue(SIGNED_LEVEL), in.readValue(SIGNED_LEVEL),
                in.readValue(SIGNED_LEVEL), in.readValue(SIGNED_LEVEL));
    }

    public void write(ByteWriter out) {
        out.writeValue(level);
        out.writeValue(attackTime);
        out.writeValue(decay1Time);
        out.writeValue(releaseTime);
    }
}
