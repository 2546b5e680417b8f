package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.Discriminants;
import com.largomodo.ksynth.core.SysexCodec;

import java.util.Objects;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.SIGNED_LEVEL;

public record PanSettings(PanKind kind, BoundedValue value) {

    public static final int DATA_SIZE = 2;
    public static final SysexCodec<PanSettings> CODEC =
            SysexCodec.of("K5000 pan", DATA_SIZE, PanSettings::read, PanSettings::write);

    public PanSettings {
        Objects.requireNonNull(kind, "kind must not be null");
        require(value, SIGNED_LEVEL, "value");
    }

    public static PanSettings defaults() {
        return new PanSettings(PanKind.NORMAL, BoundedValue.zero(SIGNED_LEVEL));
    }

    public static PanSettings read(ByteReader in) {
        PanKind kind = Discriminants.byOrdinal(PanKind.values(), in.readByte(), "pan type");
        return new PanSettings(kind, in.readValue(SIGNED_LEVEL));
    }

    public void write(ByteWriter out) {
        out.writeByte(kind.ordinal());
        out.writeValue(value);
    }
}
