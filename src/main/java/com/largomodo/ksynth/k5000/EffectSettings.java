package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.SysexCodec;
import com.largomodo.ksynth.core.SysexParseException;

import java.util.List;
import java.util.Objects;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.EFFECT_ALGORITHM;

/**
 * Effect block shared by singles and multis (31 bytes): algorithm, reverb and
 * effects 1-4.
 */
public record EffectSettings(BoundedValue algorithm, EffectDefinition reverb, List<EffectDefinition> effects) {

    public static final int EFFECT_COUNT = 4;
    public static final int DATA_SIZE = 1 + (1 + EFFECT_COUNT) * EffectDefinition.DATA_SIZE;
    public static final SysexCodec<EffectSettings> CODEC =
            SysexCodec.of("K5000 effect settings", DATA_SIZE, EffectSettings::read, EffectSettings::write);

    public EffectSettings {
        require(algorithm, EFFECT_ALGORITHM, "algorithm");
        Objects.requireNonNull(reverb, "reverb must not be null");
        if (!reverb.effect().isReverb()) {
            throw new IllegalArgumentException("Reverb slot holds non-reverb " + reverb.effect());
        }
        Objects.requireNonNull(effects, "effects must not be null");
        if (effects.size() != EFFECT_COUNT) {
            throw new IllegalArgumentException("Expected " + EFFECT_COUNT + " effects, got " + effects.size());
        }
        for (EffectDefinition effect : effects) {
            if (effect.effect().isReverb()) {
                throw new IllegalArgumentException("Effect slot holds reverb " + effect.effect());
            }
        }
        effects = List.copyOf(effects);
    }

    public static EffectSettings defaults() {
        EffectDefinition effect = EffectDefinition.of(Effect.values()[Effect.FIRST_NON_REVERB]);
        return new EffectSettings(BoundedValue.of(EFFECT_ALGORITHM, 1), EffectDefinition.of(Effect.HALL1),
                List.of(effect, effect, effect, effect));
    }

    public static EffectSettings read(ByteReader in) {
        BoundedValue algorithm = in.readValue(EFFECT_ALGORITHM);
        EffectDefinition reverb = in.read(EffectDefinition.CODEC);
        if (!reverb.effect().isReverb()) {
            throw SysexParseException.invalidDiscriminant("reverb type", reverb.effect().ordinal());
        }
        EffectDefinition[] effects = new EffectDefinition[EFFECT_COUNT];
        for (int i = 0; i < EFFECT_COUNT; i++) {
            effects[i] = in.read(EffectDefinition.CODEC);
            if (effects[i].effect().isReverb()) {
                throw SysexParseException.invalidDiscriminant("effect " + (i + 1) + " type",
                        effects[i].effect().ordinal());
            }
        }
        return new EffectSettings(algorithm, reverb, List.of(effects));
    }

    public void write(ByteWriter out) {
        out.writeValue(algorithm);
        out.write(EffectDefinition.CODEC, reverb);
        for (EffectDefinition effect : effects) {
            out.write(EffectDefinition.CODEC, effect);
        }
    }
}
