package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.Discriminants;
import com.largomodo.ksynth.core.SysexCodec;

import java.util.Objects;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.LFO_DEPTH;
import static com.largomodo.ksynth.core.Category.UNSIGNED_LEVEL;

public record FormantLfo(BoundedValue speed, FormantLfoShape shape, BoundedValue depth) {

    public static final int DATA_SIZE = 3;
    public static final SysexCodec<FormantLfo> CODEC =
            SysexCodec.of("K5000 formant LFO", DATA_SIZE, FormantLfo::read, FormantLfo::write);

    public FormantLfo {
        require(speed, UNSIGNED_LEVEL, "speed");
        Objects.requireNonNull(shape, "shape must not be null");
        require(depth, LFO_DEPTH, "depth");
    }

    public static FormantLfo defaults() {
        return new FormantLfo(BoundedValue.zero(UNSIGNED_LEVEL), FormantLfoShape.TRIANGLE,
                BoundedValue.zero(LFO_DEPTH));
    }

    public static FormantLfo read(ByteReader in) {
        BoundedValue speed = in.readValue(UNSIGNED_LEVEL);
        FormantLfoShape shape = Discriminants.byOrdinal(FormantLfoShape.values(), in.readByte(), "formant LFO shape");
        return new FormantLfo(speed, shape, in.readValue(LFO_DEPTH));
    }

    public void write(ByteWriter out) {
        out.writeValue(speed);
        out.writeByte(shape.ordinal());
        out.writeValue(depth);
    }
}
