package com.largomodo.ksynth.k4;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.SysexCodec;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.DEPTH;
import static com.largomodo.ksynth.core.Category.LEVEL;

/**
 * Automatic pitch bend applied at note on.
 */
public record AutoBend(BoundedValue time, BoundedValue depth, BoundedValue keyScalingTime,
                       BoundedValue velocityDepth) {

    public static final int DATA_SIZE = 4;
    public static final SysexCodec<AutoBend> CODEC =
            SysexCodec.of("K4 auto bend", DATA_SIZE, AutoBend::read, AutoBend::write);

    public AutoBend {
        require(time, LEVEL, "time");
        require(depth, DEPTH, "depth");
        require(keyScalingTime, DEPTH, "keyScalingTime");
        require(velocityDepth, DEPTH, "velocityDepth");
    }

    public static AutoBend defaults() {
        return new AutoBend(BoundedValue.zero(LEVEL), BoundedValue.zero(DEPTH), BoundedValue.zero(DEPTH),
                BoundedValue.zero(DEPTH));
    }

    public static AutoBend read(ByteReader in) {
        return new AutoBend(in.readValue(LEVEL), in.readValue(DEPTH), in.readValue(DEPTH), in.readValue(DEPTH));
    }

    public void write(ByteWriter out) {
        out.writeValue(time);
        out.writeValue(depth);
        out.writeValue(keyScalingTime);
        out.writeValue(velocityDepth);
    }
}
