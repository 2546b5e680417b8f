package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.Discriminants;
import com.largomodo.ksynth.core.SysexCodec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static com.largomodo.ksynth.core.Category.UNSIGNED_LEVEL;

/**
 * MORF harmonic settings (13 bytes): four copy steps, the four envelope times
 * between them and the loop type.
 */
public record MorfHarmonic(List<MorfCopy> copies, List<BoundedValue> times, LoopType loop) {

    public static final int STEP_COUNT = 4;
    public static final int DATA_SIZE = STEP_COUNT * MorfCopy.DATA_SIZE + STEP_COUNT + 1;
    public static final SysexCodec<MorfHarmonic> CODEC =
            SysexCodec.of("K5000 MORF harmonic", DATA_SIZE, MorfHarmonic::read, MorfHarmonic::write);

    public MorfHarmonic {
        Objects.requireNonNull(copies, "copies must not be null");
        Objects.requireNonNull(times, "times must not be null");
        Objects.requireNonNull(loop, "loop must not be null");
        if (copies.size() != STEP_COUNT || times.size() != STEP_COUNT) {
            throw new IllegalArgumentException("MORF needs " + STEP_COUNT + " copies and times");
        }
        times.forEach(t -> BoundedValue.require(t, UNSIGNED_LEVEL, "time"));
        copies = List.copyOf(copies);
        times = List.copyOf(times);
    }

    public static MorfHarmonic defaults() {
        return new MorfHarmonic(Collections.nCopies(STEP_COUNT, MorfCopy.defaults()),
                Collections.nCopies(STEP_COUNT, BoundedValue.zero(UNSIGNED_LEVEL)), LoopType.OFF);
    }

    public static MorfHarmonic read(ByteReader in) {
        List<MorfCopy> copies = new ArrayList<>(STEP_COUNT);
        for (int i = 0; i < STEP_COUNT; i++) {
            copies.add(in.read(MorfCopy.CODEC));
        }
        List<BoundedValue> times = new ArrayList<>(STEP_COUNT);
        for (int i = 0; i < STEP_COUNT; i++) {
            times.add(in.readValue(UNSIGNED_LEVEL));
        }
        LoopType loop = Discriminants.byOrdinal(LoopType.values(), in.readByte(), "MORF loop");
        return new MorfHarmonic(copies, times, loop);
    }

    public void write(ByteWriter out) {
        copies.forEach(copy -> out.write(MorfCopy.CODEC, copy));
        times.forEach(out::writeValue);
        out.writeByte(loop.ordinal());
    }
}
