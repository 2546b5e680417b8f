package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.SysexCodec;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.SIGNED_LEVEL;
import static com.largomodo.ksynth.core.Category.UNSIGNED_LEVEL;

/**
 * DCF envelope. Times are 0-127, levels ±63.
 */
public record FilterEnvelope(BoundedValue attackTime, BoundedValue decay1Time, BoundedValue decay1Level,
                             BoundedValue decay2Time, BoundedValue decay2Level, BoundedValue releaseTime) {

    public static final int DATA_SIZE = 6;
    public static final SysexCodec<FilterEnvelope> CODEC =
            SysexCodec.of("K5000 filter envelope", DATA_SIZE, FilterEnvelope::read, FilterEnvelope::write);

    public FilterEnvelope {
        require(attackTime, UNSIGNED_LEVEL, "attackTime");
        require(decay1Time, UNSIGNED_LEVEL, "decay1Time");
        require(decay1Level, SIGNED_LEVEL, "decay1Level");
        require(decay2Time, UNSIGNED_LEVEL, "decay2Time");
        require(decay2Level, SIGNED_LEVEL, "decay2Level");
        require(releaseTime, UNSIGNED_LEVEL, "releaseTime");
    }

    public static FilterEnvelope defaults() {
        return new FilterEnvelope(BoundedValue.zero(UNSIGNED_LEVEL), BoundedValue.zero(UNSIGNED_LEVEL),
                BoundedValue.zero(SIGNED_LEVEL), BoundedValue.zero(UNSIGNED_LEVEL), BoundedValue.zero(SIGNED_LEVEL),
                BoundedValue.zero(UNSIGNED_LEVEL));
    }

    public static FilterEnvelope read(ByteReader in) {
        return new FilterEnvelope(in.readValue(UNSIGNED_LEVEL), in.readValue(UNSIGNED_LEVEL),
                in.readValue(SIGNED_LEVEL), in.readValue(UNSIGNED_LEVEL), in.readValue(SIGNED_LEVEL),
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
