package com.largomodo.ksynth.k4;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.SysexCodec;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.DEPTH;
import static com.largomodo.ksynth.core.Category.LEVEL;
import static com.largomodo.ksynth.core.Category.WAVE_NUMBER;

/**
 * One of the two sources of a drum note (5 bytes): wave high bit, wave low
 * bits, decay, tune and level.
 */
public record DrumSource(BoundedValue wave, BoundedValue decay, BoundedValue tune, BoundedValue level) {

    public static final int DATA_SIZE = 5;
    public static final SysexCodec<DrumSource> CODEC =
            SysexCodec.of("K4 drum source", DATA_SIZE, DrumSource::read, DrumSource::write);

    public DrumSource {
        require(wave, WAVE_NUMBER, "wave");
        require(decay, LEVEL, "decay");
        require(tune, DEPTH, "tune");
        require(level, LEVEL, "level");
    }

    public static DrumSource defaults() {
        return new DrumSource(BoundedValue.zero(WAVE_NUMBER), BoundedValue.of(LEVEL, 1), BoundedValue.zero(DEPTH),
                BoundedValue.of(LEVEL, 100));
    }

    public static DrumSource read(ByteReader in) {
        int high = in.readByte();
        int low = in.readByte();
        return new DrumSource(Wave.fromWire(high, low), in.readValue(LEVEL), in.readValue(DEPTH),
                in.readValue(LEVEL));
    }

    public void write(ByteWriter out) {
        out.writeByte(Wave.highBit(wave));
        out.writeByte(Wave.lowBits(wave));
        out.writeValue(decay);
        out.writeValue(tune);
        out.writeValue(level);
    }
}
