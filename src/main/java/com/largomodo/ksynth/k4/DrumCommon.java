package com.largomodo.ksynth.k4;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.SysexCodec;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.CHANNEL;
import static com.largomodo.ksynth.core.Category.LEVEL;

/**
 * Drum common block: receive channel, volume, velocity depth, seven reserved
 * bytes and a checksum (11 bytes).
 */
public record DrumCommon(BoundedValue channel, BoundedValue volume, BoundedValue velocityDepth) {

    public static final int DATA_SIZE = 11;
    public static final SysexCodec<DrumCommon> CODEC =
            SysexCodec.of("K4 drum common", DATA_SIZE, DrumCommon::read, DrumCommon::write);

    private static final int RESERVED = 7;

    public DrumCommon {
        require(channel, CHANNEL, "channel");
        require(volume, LEVEL, "volume");
        require(velocityDepth, LEVEL, "velocityDepth");
    }

    public static DrumCommon defaults() {
        return new DrumCommon(BoundedValue.of(CHANNEL, 10), BoundedValue.of(LEVEL, 100), BoundedValue.zero(LEVEL));
    }

    public static DrumCommon read(ByteReader in) {
        int bodyStart = in.position();
        DrumCommon common = new DrumCommon(in.readValue(CHANNEL), in.readValue(LEVEL), in.readValue(LEVEL));
        in.skip(RESERVED);
        in.readChecksum("K4 drum common", bodyStart);
        return common;
    }

    public void write(ByteWriter out) {
        int bodyStart = out.position();
        out.writeValue(channel);
        out.writeValue(volume);
        out.writeValue(velocityDepth);
        out.writeZeros(RESERVED);
        out.writeChecksum(bodyStart);
    }
}
