package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.SysexCodec;

import java.util.Objects;

/**
 * The two effect control routings of a single or multi (6 bytes).
 */
public record EffectControl(EffectControlSource source1, EffectControlSource source2) {

    public static final int DATA_SIZE = 2 * EffectControlSource.DATA_SIZE;
    public static final SysexCodec<EffectControl> CODEC =
            SysexCodec.of("K5000 effect control block", DATA_SIZE, EffectControl::read, EffectControl::write);

    public EffectControl {
        Objects.requireNonNull(source1, "source1 must not be null");
        Objects.requireNonNull(source2, "source2 must not be null");
    }

    public static EffectControl defaults() {
        return new EffectControl(EffectControlSource.defaults(), EffectControlSource.defaults());
    }

    public static EffectControl read(ByteReader in) {
        return new EffectControl(in.read(EffectControlSource.CODEC), in.read(EffectControlSource.CODEC));
    }

    public void write(ByteWriter out) {
        out.write(EffectControlSource.CODEC, source1);
        out.write(EffectControlSource.CODEC, source2);
    }
}
