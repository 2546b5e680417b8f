package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.Discriminants;
import com.largomodo.ksynth.core.SysexCodec;

import java.util.Objects;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.SIGNED_LEVEL;

/**
 * Routes a performance controller to an effect parameter (3 bytes).
 */
public record EffectControlSource(ControlSource source, EffectDestination destination, BoundedValue depth) {

    public static final int DATA_SIZE = 3;
    public static final SysexCodec<EffectControlSource> CODEC =
            SysexCodec.of("K5000 effect control", DATA_SIZE, EffectControlSource::read, EffectControlSource::write);

    public EffectControlSource {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(destination, "destination must not be null");
        require(depth, SIGNED_LEVEL, "depth");
    }

    public static EffectControlSource defaults() {
        return new EffectControlSource(ControlSource.BENDER, EffectDestination.EFFECT1_DRY_WET,
                BoundedValue.zero(SIGNED_LEVEL));
    }

    public static EffectControlSource read(ByteReader in) {
        ControlSource source = Discriminants.byOrdinal(ControlSource.values(), in.readByte(), "effect control source");
        EffectDestination destination =
                Discriminants.byOrdinal(EffectDestination.values(), in.readByte(), "effect control destination");
        return new EffectControlSource(source, destination, in.readValue(SIGNED_LEVEL));
    }

    public void write(ByteWriter out) {
        out.writeByte(source.ordinal());
        out.writeByte(destination.ordinal());
        out.writeValue(depth);
    }
}
