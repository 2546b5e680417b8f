package com.largomodo.ksynth.k4;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.SysexCodec;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.DEPTH;

/**
 * Velocity, pressure and key scaling depths (each ±50) applied to a level or cutoff.
 */
public record LevelModulation(BoundedValue velocityDepth, BoundedValue pressureDepth,
                              BoundedValue keyScalingDepth) {

    public static final int DATA_SIZE = 3;
    public static final SysexCodec<LevelModulation> CODEC =
            SysexCodec.of("K4 level modulation", DATA_SIZE, LevelModulation::read, LevelModulation::write);

    public LevelModulation {
        require(velocityDepth, DEPTH, "velocityDepth");
        require(pressureDepth, DEPTH, "pressureDepth");
        require(keyScalingDepth, DEPTH, "keyScalingDepth");
    }

    public static LevelModulation of(int velocityDepth, int pressureDepth, int keyScalingDepth) {
        return new LevelModulation(BoundedValue.of(DEPTH, velocityDepth), BoundedValue.of(DEPTH, pressureDepth),
                BoundedValue.of(DEPTH, keyScalingDepth));
    }

    public static LevelModulation defaults() {
        return of(0, 0, 0);
    }

    public static LevelModulation read(ByteReader in) {
        return new LevelModulation(in.readValue(DEPTH), in.readValue(DEPTH), in.readValue(DEPTH));
    }

    public void write(ByteWriter out) {
        out.writeValue(velocityDepth);
        out.writeValue(pressureDepth);
        out.writeValue(keyScalingDepth);
    }
}
