package com.largomodo.ksynth.k4;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.Bits;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.SysexCodec;

import java.util.Objects;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.DEPTH;
import static com.largomodo.ksynth.core.Category.LEVEL;
import static com.largomodo.ksynth.core.Category.RESONANCE;

/**
 * DCF settings for one source pair.
 * <p>
 * Byte 1 packs the resonance (bits 0-2) with the LFO modulation switch (bit 3).
 */
public record Filter(BoundedValue cutoff, BoundedValue resonance, boolean lfoModulatesCutoff,
                     LevelModulation cutoffModulation, BoundedValue envelopeDepth,
                     BoundedValue envelopeVelocityDepth, FilterEnvelope envelope,
                     TimeModulation timeModulation) {

    public static final int DATA_SIZE = 14;
    public static final SysexCodec<Filter> CODEC = SysexCodec.of("K4 filter", DATA_SIZE, Filter::read, Filter::write);

    private static final int LFO_SWITCH_BIT = 3;

    public Filter {
        require(cutoff, LEVEL, "cutoff");
        require(resonance, RESONANCE, "resonance");
        Objects.requireNonNull(cutoffModulation, "cutoffModulation must not be null");
        require(envelopeDepth, DEPTH, "envelopeDepth");
        require(envelopeVelocityDepth, DEPTH, "envelopeVelocityDepth");
        Objects.requireNonNull(envelope, "envelope must not be null");
        Objects.requireNonNull(timeModulation, "timeModulation must not be null");
    }

    public static Filter defaults() {
        return new Filter(BoundedValue.of(LEVEL, 88), BoundedValue.of(RESONANCE, 2), false,
                LevelModulation.defaults(), BoundedValue.zero(DEPTH), BoundedValue.zero(DEPTH),
                FilterEnvelope.defaults(), TimeModulation.defaults());
    }

    public static Filter read(ByteReader in) {
        BoundedValue cutoff = in.readValue(LEVEL);
        int b = in.readByte();
        BoundedValue resonance = BoundedValue.fromWireByte(RESONANCE, Bits.field(b, 0, 3));
        boolean lfo = Bits.flag(b, LFO_SWITCH_BIT);
        LevelModulation cutoffModulation = in.read(LevelModulation.CODEC);
        BoundedValue envelopeDepth = in.readValue(DEPTH);
        BoundedValue envelopeVelocityDepth = in.readValue(DEPTH);
        FilterEnvelope envelope = in.read(FilterEnvelope.CODEC);
        TimeModulation timeModulation = in.read(TimeModulation.CODEC);
        return new Filter(cutoff, resonance, lfo, cutoffModulation, envelopeDepth, envelopeVelocityDepth,
                envelope, timeModulation);
    }

    public void write(ByteWriter out) {
        out.writeValue(cutoff);
        int b = Bits.withField(0, 0, 3, resonance.toWireByte());
        out.writeByte(Bits.withFlag(b, LFO_SWITCH_BIT, lfoModulatesCutoff));
        out.write(LevelModulation.CODEC, cutoffModulation);
        out.writeValue(envelopeDepth);
        out.writeValue(envelopeVelocityDepth);
        out.write(FilterEnvelope.CODEC, envelope);
        out.write(TimeModulation.CODEC, timeModulation);
    }
}
