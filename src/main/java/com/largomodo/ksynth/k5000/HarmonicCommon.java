package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.Discriminants;
import com.largomodo.ksynth.core.SysexCodec;

import java.util.Objects;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.SIGNED_LEVEL;
import static com.largomodo.ksynth.core.Category.UNSIGNED_LEVEL;
import static com.largomodo.ksynth.core.Category.VELOCITY_CURVE;

public record HarmonicCommon(boolean morfEnabled, BoundedValue totalGain, HarmonicGroup group,
                             BoundedValue keyScalingToGain, BoundedValue velocityCurve, BoundedValue velocityDepth) {

    public static final int DATA_SIZE = 6;
    public static final SysexCodec<HarmonicCommon> CODEC =
            SysexCodec.of("K5000 harmonic common", DATA_SIZE, HarmonicCommon::read, HarmonicCommon::write);

    public HarmonicCommon {
        require(totalGain, UNSIGNED_LEVEL, "totalGain");
        Objects.requireNonNull(group, "group must not be null");
        require(keyScalingToGain, SIGNED_LEVEL, "keyScalingToGain");
        require(velocityCurve, VELOCITY_CURVE, "velocityCurve");
        require(velocityDepth, UNSIGNED_LEVEL, "velocityDepth");
    }

    public static HarmonicCommon defaults() {
        return new HarmonicCommon(false, BoundedValue.of(UNSIGNED_LEVEL, 51), HarmonicGroup.LOW,
                BoundedValue.zero(SIGNED_LEVEL), BoundedValue.of(VELOCITY_CURVE, 1), BoundedValue.zero(UNSIGNED_LEVEL));
    }

    public static HarmonicCommon read(ByteReader in) {
        boolean morfEnabled = in.readFlag();
        BoundedValue totalGain = in.readValue(UNSIGNED_LEVEL);
        HarmonicGroup group = Discriminants.byOrdinal(HarmonicGroup.values(), in.readByte(), "harmonic group");
        return new HarmonicCommon(morfEnabled, totalGain, group, in.readValue(SIGNED_LEVEL),
                in.readValue(VELOCITY_CURVE), in.readValue(UNSIGNED_LEVEL));
    }

    public void write(ByteWriter out) {
        out.writeFlag(morfEnabled);
        out.writeValue(totalGain);
        out.writeByte(group.ordinal());
        out.writeValue(keyScalingToGain);
        out.writeValue(velocityCurve);
        out.writeValue(velocityDepth);
    }
}
