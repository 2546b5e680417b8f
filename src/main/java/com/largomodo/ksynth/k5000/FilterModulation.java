package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.SysexCodec;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.SIGNED_LEVEL;

/**
 * Key scaling (attack, decay 1) and velocity (depth, attack, decay 1) applied
 * to the DCF envelope, 5 bytes, all ±63.
 */
public record FilterModulation(BoundedValue keyScalingToAttack, BoundedValue keyScalingToDecay1,
                               BoundedValue velocityToDepth, BoundedValue velocityToAttack,
                               BoundedValue velocityToDecay1) {

    public static final int DATA_SIZE = 5;
    public static final SysexCodec<FilterModulation> CODEC =
            SysexCodec.of("K5000 filter modulation", DATA_SIZE, FilterModulation::read, FilterModulation::write);

    public FilterModulation {
        require(keyScalingToAttack, SIGNED_LEVEL, "keyScalingToAttack");
        require(keyScalingToDecay1, SIGNED_LEVEL, "keyScalingToDecay1");
        require(velocityToDepth, SIGNED_LEVEL, "velocityToDepth");
        require(velocityToAttack, SIGNED_LEVEL, "velocityToAttack");
        require(velocityToDecay1, SIGNED_LEVEL, "velocityToDecay1");
    }

    public static FilterModulation defaults() {
        BoundedValue zero = BoundedValue.zero(SIGNED_LEVEL);
        return new FilterModulation(zero, zero, zero, zero, zero);
    }

    public static FilterModulation read(ByteReader in) {
        return new FilterModulation(in.readValue(SIGNED_LEVEL), in.readValue(SIGNED_LEVEL),
                in.readValue(SIGNED_LEVEL), in.readValue(SIGNED_LEVEL), in.readValue(SIGNED_LEVEL));
    }

    public void write(ByteWriter out) {
        out.writeValue(keyScalingToAttack);
        out.writeValue(keyScalingToDecay1);
        out.writeValue(velocityToDepth);
        out.writeValue(velocityToAttack);
        out.writeValue(velocityToDecay1);
    }
}
