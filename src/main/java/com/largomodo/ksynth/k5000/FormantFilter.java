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
 * Formant filter of an additive kit (17 bytes).
 */
public record FormantFilter(BoundedValue bias, FormantMode mode, BoundedValue envelopeDepth,
                            FormantEnvelope envelope, FormantLfo lfo) {

    public static final int DATA_SIZE = 3 + FormantEnvelope.DATA_SIZE + FormantLfo.DATA_SIZE;
    public static final SysexCodec<FormantFilter> CODEC =
            SysexCodec.of("K5000 formant filter", DATA_SIZE, FormantFilter::read, FormantFilter::write);

    public FormantFilter {
        require(bias, SIGNED_LEVEL, "bias");
        Objects.requireNonNull(mode, "mode must not be null");
        require(envelopeDepth, SIGNED_LEVEL, "envelopeDepth");
        Objects.requireNonNull(envelope, "envelope must not be null");
        Objects.requireNonNull(lfo, "lfo must not be null");
    }

    public static FormantFilter defaults() {
        return new FormantFilter(BoundedValue.zero(SIGNED_LEVEL), FormantMode.ENVELOPE,
                BoundedValue.zero(SIGNED_LEVEL), FormantEnvelope.defaults(), FormantLfo.defaults());
    }

    public static FormantFilter read(ByteReader in) {
        BoundedValue bias = in.readValue(SIGNED_LEVEL);
        FormantMode mode = Discriminants.byOrdinal(FormantMode.values(), in.readByte(), "formant filter mode");
        BoundedValue envelopeDepth = in.readValue(SIGNED_LEVEL);
        return new FormantFilter(bias, mode, envelopeDepth, in.read(FormantEnvelope.CODEC),
                in.read(FormantLfo.CODEC));
    }

    public void write(ByteWriter out) {
        out.writeValue(bias);
        out.writeByte(mode.ordinal());
        out.writeValue(envelopeDepth);
        out.write(FormantEnvelope.CODEC, envelope);
        out.write(FormantLfo.CODEC, lfo);
    }
}
