package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.SysexCodec;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.SIGNED_LEVEL;
import static com.largomodo.ksynth.core.Category.UNSIGNED_LEVEL;

public record PitchEnvelope(BoundedValue start, BoundedValue attackTime, BoundedValue attackLevel,
                            BoundedValue decayTime, BoundedValue timeVelocitySensitivity,
                            BoundedValue levelVelocitySensitivity) {

    public static final int DATA_SIZE = 6;
    public static final SysexCodec<PitchEnvelope> CODEC =
            SysexCodec.of("K5000 pitch envelope", DATA_SIZE, PitchEnvelope::read, PitchEnvelope::write);

    public PitchEnvelope {
        require(start, SIGNED_LEVEL, "start");
        require(attackTime, UNSIGNED_LEVEL, "attackTime");
        require(attackLevel, SIGNED_LEVEL, "attackLevel");
        require(decayTime, UNSIGNED_LEVEL, "decayTime");
        require(timeVelocitySensitivity, SIGNED_LEVEL, "timeVelocitySensitivity");
        require(levelVelocitySensitivity, SIGNED_LEVEL, "levelVelocitySensitivity");
    }

    public static PitchEnvelope defaults() {
        return new PitchEnvelope(BoundedValue.zero(SIGNED_LEVEL), BoundedValue.zero(UNSIGNED_LEVEL),
                BoundedValue.zero(SIGNED_LEVEL), BoundedValue.zero(UNSIGNED_LEVEL), BoundedValue.zero(SIGNED_LEVEL),
                BoundedValue.zero(SIGNED_LEVEL));
    }

    public static PitchEnvelope read(ByteReader in) {
        return new PitchEnvelope(in.readValue(SIGNED_LEVEL), in.readValue(UNSIGNED_LEVEL),
                in.readValue(SIGNED_LEVEL), in.readValue(UNSIGNED_LEVEL), in.readValue(SIGNED_LEVEL),
                in.readValue(SIGNED_LEVEL));
    }

    public void write(ByteWriter out) {
        out.writeValue(start);
        out.writeValue(attackTime);
        out.writeValue(attackLevel);
        out.writeValue(decayTime);
        out.writeValue(timeVelocitySensitivity);
        out.writeValue(levelVelocitySensitivity);
    }
}
