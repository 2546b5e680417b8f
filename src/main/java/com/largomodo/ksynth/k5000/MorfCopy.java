package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.SysexCodec;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.UNSIGNED_LEVEL;

/**
 * Patch and source a MORF step copies its harmonics from.
 */
public record MorfCopy(BoundedValue patch, BoundedValue source) {

    public static final int DATA_SIZE = 2;
    public static final SysexCodec<MorfCopy> CODEC =
            SysexCodec.of("K5000 MORF copy", DATA_SIZE, MorfCopy::read, MorfCopy::write);

    public MorfCopy {
        require(patch, UNSIGNED_LEVEL, "patch");
        require(source, UNSIGNED_LEVEL, "source");
    }

    public static MorfCopy defaults() {
        return new MorfCopy(BoundedValue.zero(UNSIGNED_LEVEL), BoundedValue.zero(UNSIGNED_LEVEL));
    }

    public static MorfCopy read(ByteReader in) {
        return new MorfCopy(in.readValue(UNSIGNED_LEVEL), in.readValue(UNSIGNED_LEVEL));
    }

    public void write(ByteWriter out) {
        out.writeValue(patch);
        out.writeValue(source);
    }
}
