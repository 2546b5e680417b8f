package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.Discriminants;
import com.largomodo.ksynth.core.SysexCodec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.SIGNED_LEVEL;
import static com.largomodo.ksynth.core.Category.UNSIGNED_LEVEL;

/**
 * Formant filter envelope (11 bytes): attack, decay 1, decay 2 and release as
 * rate/level pairs, then loop, velocity depth and key scaling depth.
 *
 * @param rates  four segment rates, 0-127
 * @param levels four segment levels, ±63
 */
public record FormantEnvelope(List<BoundedValue> rates, List<BoundedValue> levels, LoopType loop,
                              BoundedValue velocityDepth, BoundedValue keyScalingDepth) {

    public static final int SEGMENT_COUNT = 4;
    public static final int DATA_SIZE = 2 * SEGMENT_COUNT + 3;
    public static final SysexCodec<FormantEnvelope> CODEC =
            SysexCodec.of("K5000 formant envelope", DATA_SIZE, FormantEnvelope::read, FormantEnvelope::write);

    public FormantEnvelope {
        Objects.requireNonNull(rates, "rates must not be null");
        Objects.requireNonNull(levels, "levels must not be null");
        if (rates.size() != SEGMENT_COUNT || levels.size() != SEGMENT_COUNT) {
            throw new IllegalArgumentException("Formant envelope needs " + SEGMENT_COUNT + " segments");
        }
        rates.forEach(r -> require(r, UNSIGNED_LEVEL, "rate"));
        levels.forEach(l -> require(l, SIGNED_LEVEL, "level"));
        rates = List.copyOf(rates);
        levels = List.copyOf(levels);
        Objects.requireNonNull(loop, "loop must not be null");
        require(velocityDepth, SIGNED_LEVEL, "velocityDepth");
        require(keyScalingDepth, SIGNED_LEVEL, "keyScalingDepth");
    }

    public static FormantEnvelope defaults() {
        BoundedValue rate = BoundedValue.zero(UNSIGNED_LEVEL);
        BoundedValue level = BoundedValue.zero(SIGNED_LEVEL);
        return new FormantEnvelope(List.of(rate, rate, rate, rate), List.of(level, level, level, level),
                LoopType.OFF, level, level);
    }

    public static FormantEnvelope read(ByteReader in) {
        List<BoundedValue> rates = new ArrayList<>(SEGMENT_COUNT);
        List<BoundedValue> levels = new ArrayList<>(SEGMENT_COUNT);
        for (int i = 0; i < SEGMENT_COUNT; i++) {
            rates.add(in.readValue(UNSIGNED_LEVEL));
            levels.add(in.readValue(SIGNED_LEVEL));
        }
        LoopType loop = Discriminants.byOrdinal(LoopType.values(), in.readByte(), "formant envelope loop");
        return new FormantEnvelope(rates, levels, loop, in.readValue(SIGNED_LEVEL), in.readValue(SIGNED_LEVEL));
    }

    public void write(ByteWriter out) {
        for (int i = 0; i < SEGMENT_COUNT; i++) {
            out.writeValue(rates.get(i));
            out.writeValue(levels.get(i));
        }
        out.writeByte(loop.ordinal());
        out.writeValue(velocityDepth);
        out.writeValue(keyScalingDepth);
    }
}
