package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.Bits;
import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.SysexCodec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.HARMONIC_ENVELOPE_LEVEL;
import static com.largomodo.ksynth.core.Category.UNSIGNED_LEVEL;

/**
 * Envelope of one harmonic (8 bytes): four rate/level pairs.
 * <p>
 * Levels use the low six bits. The loop type lives in bit 6 of the decay 1
 * and decay 2 level bytes: both set is loop 1, only decay 2 set is loop 2.
 */
public record HarmonicEnvelope(List<BoundedValue> rates, List<BoundedValue> levels, LoopType loop) {

    public static final int SEGMENT_COUNT = 4;
    public static final int DATA_SIZE = 2 * SEGMENT_COUNT;
    public static final SysexCodec<HarmonicEnvelope> CODEC =
            SysexCodec.of("K5000 harmonic envelope", DATA_SIZE, HarmonicEnvelope::read, HarmonicEnvelope::write);

    private static final int LOOP_BIT = 6;
    private static final int DECAY1 = 1;
    private static final int DECAY2 = 2;

    public HarmonicEnvelope {
        Objects.requireNonNull(rates, "rates must not be null");
        Objects.requireNonNull(levels, "levels must not be null");
        if (rates.size() != SEGMENT_COUNT || levels.size() != SEGMENT_COUNT) {
            throw new IllegalArgumentException("Harmonic envelope needs " + SEGMENT_COUNT + " segments");
        }
        rates.forEach(r -> require(r, UNSIGNED_LEVEL, "rate"));
        levels.forEach(l -> require(l, HARMONIC_ENVELOPE_LEVEL, "level"));
        rates = List.copyOf(rates);
        levels = List.copyOf(levels);
        Objects.requireNonNull(loop, "loop must not be null");
    }

    public static HarmonicEnvelope defaults() {
        BoundedValue rate = BoundedValue.zero(UNSIGNED_LEVEL);
        BoundedValue level = BoundedValue.zero(HARMONIC_ENVELOPE_LEVEL);
        return new HarmonicEnvelope(List.of(rate, rate, rate, rate), List.of(level, level, level, level),
                LoopType.OFF);
    }

    public static HarmonicEnvelope read(ByteReader in) {
        List<BoundedValue> rates = new ArrayList<>(SEGMENT_COUNT);
        List<BoundedValue> levels = new ArrayList<>(SEGMENT_COUNT);
        int[] rawLevels = new int[SEGMENT_COUNT];
        for (int i = 0; i < SEGMENT_COUNT; i++) {
            rates.add(in.readValue(UNSIGNED_LEVEL));
            rawLevels[i] = in.readByte();
            levels.add(BoundedValue.of(HARMONIC_ENVELOPE_LEVEL, rawLevels[i] & 0x3F));
        }
        boolean decay1Loop = Bits.flag(rawLevels[DECAY1], LOOP_BIT);
        boolean decay2Loop = Bits.flag(rawLevels[DECAY2], LOOP_BIT);
        LoopType loop = !decay2Loop ? LoopType.OFF : decay1Loop ? LoopType.LOOP1 : LoopType.LOOP2;
        return new HarmonicEnvelope(rates, levels, loop);
    }

    public void write(ByteWriter out) {
        for (int i = 0; i < SEGMENT_COUNT; i++) {
            int level = levels.get(i).value();
            if (i == DECAY1) {
                level = Bits.withFlag(level, LOOP_BIT, loop == LoopType.LOOP1);
            } else if (i == DECAY2) {
                level = Bits.withFlag(level, LOOP_BIT, loop != LoopType.OFF);
            }
            out.writeValue(rates.get(i));
            out.writeByte(level);
        }
    }
}
