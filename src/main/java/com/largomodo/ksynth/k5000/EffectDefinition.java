package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.Discriminants;
import com.largomodo.ksynth.core.SysexCodec;

import java.util.List;
import java.util.Objects;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.EFFECT_DEPTH;
import static com.largomodo.ksynth.core.Category.UNSIGNED_LEVEL;

/**
 * One effect slot: type, depth and four type-specific parameters (6 bytes).
 */
public record EffectDefinition(Effect effect, BoundedValue depth, BoundedValue parameter1, BoundedValue parameter2,
                               BoundedValue parameter3, BoundedValue parameter4) {

    public static final int DATA_SIZE = 6;
    public static final SysexCodec<EffectDefinition> CODEC =
            SysexCodec.of("K5000 effect", DATA_SIZE, EffectDefinition::read, EffectDefinition::write);

    public EffectDefinition {
        Objects.requireNonNull(effect, "effect must not be null");
        require(depth, EFFECT_DEPTH, "depth");
        require(parameter1, UNSIGNED_LEVEL, "parameter1");
        require(parameter2, UNSIGNED_LEVEL, "parameter2");
        require(parameter3, UNSIGNED_LEVEL, "parameter3");
        require(parameter4, UNSIGNED_LEVEL, "parameter4");
    }

    public static EffectDefinition of(Effect effect) {
        return new EffectDefinition(effect, BoundedValue.zero(EFFECT_DEPTH), BoundedValue.zero(UNSIGNED_LEVEL),
                BoundedValue.zero(UNSIGNED_LEVEL), BoundedValue.zero(UNSIGNED_LEVEL),
                BoundedValue.zero(UNSIGNED_LEVEL));
    }

    public static EffectDefinition read(ByteReader in) {
        Effect effect = Discriminants.byOrdinal(Effect.values(), in.readByte(), "effect type");
        return new EffectDefinition(effect, in.readValue(EFFECT_DEPTH), in.readValue(UNSIGNED_LEVEL),
                in.readValue(UNSIGNED_LEVEL), in.readValue(UNSIGNED_LEVEL), in.readValue(UNSIGNED_LEVEL));
    }

    public void write(ByteWriter out) {
        out.writeByte(effect.ordinal());
        out.writeValue(depth);
        out.writeValue(parameter1);
        out.writeValue(parameter2);
        out.writeValue(parameter3);
        out.writeValue(parameter4);
    }

    @Override
    public String toString() {
        List<String> names = effect.parameterNames();
        return String.format("%s, depth = %s, %s = %s, %s = %s, %s = %s, %s = %s", effect.displayName(), depth,
                names.get(0), parameter1, names.get(1), parameter2, names.get(2), parameter3,
                names.get(3), parameter4);
    }
}
