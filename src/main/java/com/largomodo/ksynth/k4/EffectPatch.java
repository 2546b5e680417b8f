package com.largomodo.ksynth.k4;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.Discriminants;
import com.largomodo.ksynth.core.SysexCodec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.EFFECT_PARAMETER;
import static com.largomodo.ksynth.core.Category.EFFECT_VALUE;

/**
 * An effect patch (35 bytes including the checksum): algorithm, three
 * parameters, six reserved bytes and the settings of the eight submixes.
 */
public record EffectPatch(EffectType effect, BoundedValue parameter1, BoundedValue parameter2,
                          BoundedValue parameter3, List<SubmixSettings> submixes) {

    public static final int SUBMIX_COUNT = Submix.values().length;
    public static final int DATA_SIZE = 35;
    public static final SysexCodec<EffectPatch> CODEC =
            SysexCodec.of("K4 effect", DATA_SIZE, EffectPatch::read, EffectPatch::write);

    private static final int RESERVED = 6;

    public EffectPatch {
        Objects.requireNonNull(effect, "effect must not be null");
        require(parameter1, EFFECT_PARAMETER, "parameter1");
        require(parameter2, EFFECT_PARAMETER, "parameter2");
        require(parameter3, EFFECT_VALUE, "parameter3");
        Objects.requireNonNull(submixes, "submixes must not be null");
        if (submixes.size() != SUBMIX_COUNT) {
            throw new IllegalArgumentException("An effect has " + SUBMIX_COUNT + " submixes, got " + submixes.size());
        }
        submixes = List.copyOf(submixes);
    }

    public static EffectPatch defaults() {
        return new EffectPatch(EffectType.REVERB_1, BoundedValue.zero(EFFECT_PARAMETER),
                BoundedValue.zero(EFFECT_PARAMETER), BoundedValue.zero(EFFECT_VALUE),
                Collections.nCopies(SUBMIX_COUNT, SubmixSettings.defaults()));
    }

    public SubmixSettings submix(Submix submix) {
        return submixes.get(submix.ordinal());
    }

    public static EffectPatch read(ByteReader in) {
        int bodyStart = in.position();
        EffectType effect = Discriminants.byOrdinal(EffectType.values(), in.readByte(), "effect type");
        BoundedValue parameter1 = in.readValue(EFFECT_PARAMETER);
        BoundedValue parameter2 = in.readValue(EFFECT_PARAMETER);
        BoundedValue parameter3 = in.readValue(EFFECT_VALUE);
        in.skip(RESERVED);
        List<SubmixSettings> submixes = new ArrayList<>(SUBMIX_COUNT);
        for (int i = 0; i < SUBMIX_COUNT; i++) {
            submixes.add(in.read(SubmixSettings.CODEC));
        }
        in.readChecksum("K4 effect", bodyStart);
        in.context().blockDecoded("K4 effect " + effect.displayName(), bodyStart);
        return new EffectPatch(effect, parameter1, parameter2, parameter3, submixes);
    }

    public void write(ByteWriter out) {
        int bodyStart = out.position();
        out.writeByte(effect.ordinal());
        out.writeValue(parameter1);
        out.writeValue(parameter2);
        out.writeValue(parameter3);
        out.writeZeros(RESERVED);
        for (SubmixSettings settings : submixes) {
            out.write(SubmixSettings.CODEC, settings);
        }
        out.writeChecksum(bodyStart);
    }

    @Override
    public String toString() {
        List<String> names = effect.parameterNames();
        return String.format("%s: %s=%s, %s=%s, %s=%s", effect.displayName(),
                names.get(0), parameter1, names.get(1), parameter2, names.get(2), parameter3);
    }
}
