package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.Discriminants;
import com.largomodo.ksynth.core.SysexCodec;

import java.util.Objects;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.FILTER_LEVEL;
import static com.largomodo.ksynth.core.Category.SIGNED_LEVEL;
import static com.largomodo.ksynth.core.Category.UNSIGNED_LEVEL;
import static com.largomodo.ksynth.core.Category.VELOCITY_CURVE;

/**
 * DCF of one source (20 bytes). A first byte of 1 means the filter is
 * bypassed.
 */
public record Filter(boolean bypassed, FilterMode mode, BoundedValue velocityCurve, BoundedValue resonance,
                     BoundedValue level, BoundedValue cutoff, BoundedValue keyScalingToCutoff,
                     BoundedValue velocityToCutoff, BoundedValue envelopeDepth, FilterEnvelope envelope,
                     FilterModulation modulation) {

    public static final int DATA_SIZE = 20;
    public static final SysexCodec<Filter> CODEC = SysexCodec.of("K5000 filter", DATA_SIZE, Filter::read, Filter::write);

    public Filter {
        Objects.requireNonNull(mode, "mode must not be null");
        require(velocityCurve, VELOCITY_CURVE, "velocityCurve");
        require(resonance, FILTER_LEVEL, "resonance");
        require(level, FILTER_LEVEL, "level");
        require(cutoff, UNSIGNED_LEVEL, "cutoff");
        require(keyScalingToCutoff, SIGNED_LEVEL, "keyScalingToCutoff");
        require(velocityToCutoff, SIGNED_LEVEL, "velocityToCutoff");
        require(envelopeDepth, SIGNED_LEVEL, "envelopeDepth");
        Objects.requireNonNull(envelope, "envelope must not be null");
        Objects.requireNonNull(modulation, "modulation must not be null");
    }

    public static Filter defaults() {
        return new Filter(false, FilterMode.LOW_PASS, BoundedValue.of(VELOCITY_CURVE, 5),
                BoundedValue.zero(FILTER_LEVEL), BoundedValue.of(FILTER_LEVEL, 7), BoundedValue.of(UNSIGNED_LEVEL, 55),
                BoundedValue.zero(SIGNED_LEVEL), BoundedValue.zero(SIGNED_LEVEL), BoundedValue.zero(SIGNED_LEVEL),
                FilterEnvelope.defaults(), FilterModulation.defaults());
    }

    public static Filter read(ByteReader in) {
        boolean bypassed = in.readByte() == 1;
        FilterMode mode = Discriminants.byOrdinal(FilterMode.values(), in.readByte(), "filter mode");
        BoundedValue velocityCurve = in.readValue(VELOCITY_CURVE);
        BoundedValue resonance = in.readValue(FILTER_LEVEL);
        BoundedValue level = in.readValue(FILTER_LEVEL);
        BoundedValue cutoff = in.readValue(UNSIGNED_LEVEL);
        BoundedValue keyScalingToCutoff = in.readValue(SIGNED_LEVEL);
        BoundedValue velocityToCutoff = in.readValue(SIGNED_LEVEL);
        BoundedValue envelopeDepth = in.readValue(SIGNED_LEVEL);
        return new Filter(bypassed, mode, velocityCurve, resonance, level, cutoff, keyScalingToCutoff,
                velocityToCutoff, envelopeDepth, in.read(FilterEnvelope.CODEC), in.read(FilterModulation.CODEC));
    }

    public void write(ByteWriter out) {
        out.writeByte(bypassed ? 1 : 0);
        out.writeByte(mode.ordinal());
        out.writeValue(velocityCurve);
        out.writeValue(resonance);
        out.writeValue(level);
        out.writeValue(cutoff);
        out.writeValue(keyScalingToCutoff);
        out.writeValue(velocityToCutoff);
        out.writeValue(envelopeDepth);
        out.write(FilterEnvelope.CODEC, envelope);
        out.write(FilterModulation.CODEC, modulation);
    }
}
