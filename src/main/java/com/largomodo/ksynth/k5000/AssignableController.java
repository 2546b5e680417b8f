package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.Discriminants;
import com.largomodo.ksynth.core.SysexCodec;

import java.util.Objects;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.SIGNED_LEVEL;

public record AssignableController(ControlSource source, ControlDestination destination, BoundedValue depth) {

    public static final int DATA_SIZE = 3;
    public static final SysexCodec<AssignableController> CODEC = SysexCodec.of("K5000 assignable controller",
            DATA_SIZE, AssignableController::read, AssignableController::write);

    public AssignableController {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(destination, "destination must not be null");
        require(depth, SIGNED_LEVEL, "depth");
    }

    public static AssignableController defaults() {
        return new AssignableController(ControlSource.BENDER, ControlDestination.PITCH_OFFSET,
                BoundedValue.zero(SIGNED_LEVEL));
    }

    public static AssignableController read(ByteReader in) {
        ControlSource source = Discriminants.byOrdinal(ControlSource.values(), in.readByte(), "control source");
        ControlDestination destination = MacroController.destination(in.readByte());
        return new AssignableController(source, destination, in.readValue(SIGNED_LEVEL));
    }

    public void write(ByteWriter out) {
        out.writeByte(source.ordinal());
        out.writeByte(destination.ordinal());
        out.writeValue(depth);
    }
}
