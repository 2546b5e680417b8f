package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.SysexCodec;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.UNSIGNED_LEVEL;

public record AmplifierEnvelope(BoundedValue attackTime, BoundedValue decay1Time, BoundedValue decay1Level,
                                BoundedValue decay2Time, BoundedValue decay2Level, BoundedValue releaseTime) {

    public static final int DATA_SIZE = 6;
    public static final SysexCodec<AmplifierEnvelope> CODEC = SysexCodec.of("K5000 amplifier envelope", DATA_SIZE,
            AmplifierEnvelope::read, AmplifierEnvelope::write);

    public AmplifierEnvelope {
        require(attackTime, UNSIGNED_LEVEL, "attackTime");
        require(decay1Time, UNSIGNED_LEVEL, "decay1Time");
        require(decay1Level, UNSIGNED_LEVEL, "decay1Level");
        require(decay2Time, UNSIGNED_LEVEL, "decay2Time");
        require(decay2Level, UNSIGNED_LEVEL, "decay2Level");
        require(releaseTime, UNSIGNED_LEVEL, "releaseTime");
    }

    public static AmplifierEnvelope defaults() {
        return new AmplifierEnvelope(BoundedValue.zero(UNSIGNED_LEVEL), BoundedValue.zero(UNSIGNED_LEVEL),
                BoundedValue.of(UNSIGNED_LEVEL, 127), BoundedValue.zero(UNSIGNED_LEVEL),
                BoundedValue.of(UNSIGNED_LEVEL, 127), BoundedValue.zero(UNSIGNED_LEVEL));
    }

    public static AmplifierEnvelope read(ByteReader in) {
        return new AmplifierEnvelope(in.readValue(UNSIGNED_LEVEL), in.readValue(UNSIGNED_LEVEL),
                in.readValue(UNSIGNED_LEVEL), in.readValue(UNSIGNED_LEVEL), in.readValue(UNSIGNED_LEVEL),
                in.readValue(UNSIGNED_LEVEL));
    }

    public void write(ByteWriter out) {
        out.writeValue(attackTime);
        out.writeValue(decay1Time);
        out.writeValue(decay1Level);
        out.writeValue(decay2Time);
        out.writeValue(decay2Level);
        out.writeValue(releaseTime);
    }
}
