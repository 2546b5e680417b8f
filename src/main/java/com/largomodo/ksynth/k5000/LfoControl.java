package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.SysexCodec;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.LFO_DEPTH;
import static com.largomodo.ksynth.core.Category.SIGNED_LEVEL;

/**
 * Depth and key scaling of one LFO target (vibrato, growl or tremolo).
 */
public record LfoControl(BoundedValue depth, BoundedValue keyScaling) {

    public static final int DATA_SIZE = 2;
    public static final SysexCodec<LfoControl> CODEC =
            SysexCodec.of("K5000 LFO control", DATA_SIZE, LfoControl::read, LfoControl::write);

    public LfoControl {
        require(depth, LFO_DEPTH, "depth");
        require(keyScaling, SIGNED_LEVEL, "keyScaling");
    }

    public static LfoControl defaults() {
        return new LfoControl(BoundedValue.zero(LFO_DEPTH), BoundedValue.zero(SIGNED_LEVEL));
    }

    public static LfoControl read(ByteReader in) {
        return new LfoControl(in.readValue(LFO_DEPTH), in.readValue(SIGNED_LEVEL));
    }

    public void write(ByteWriter out) {
        out.writeValue(depth);
        out.writeValue(keyScaling);
    }
}
