package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.Discriminants;
import com.largomodo.ksynth.core.SysexCodec;

import java.util.Objects;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.MACRO_DEPTH;

/**
 * A fixed controller (pressure, wheel or expression) driving two destinations.
 */
public record MacroController(ControlDestination destination1, BoundedValue depth1,
                              ControlDestination destination2, BoundedValue depth2) {

    public static final int DATA_SIZE = 4;
    public static final SysexCodec<MacroController> CODEC =
            SysexCodec.of("K5000 macro controller", DATA_SIZE, MacroController::read, MacroController::write);

    public MacroController {
        Objects.requireNonNull(destination1, "destination1 must not be null");
        require(depth1, MACRO_DEPTH, "depth1");
        Objects.requireNonNull(destination2, "destination2 must not be null");
        require(depth2, MACRO_DEPTH, "depth2");
    }

    public static MacroController defaults() {
        return new MacroController(ControlDestination.PITCH_OFFSET, BoundedValue.zero(MACRO_DEPTH),
                ControlDestination.PITCH_OFFSET, BoundedValue.zero(MACRO_DEPTH));
    }

    static ControlDestination destination(int raw) {
        return Discriminants.byOrdinal(ControlDestination.values(), raw, "control destination");
    }

    public static MacroController read(ByteReader in) {
        ControlDestination destination1 = destination(in.readByte());
        BoundedValue depth1 = in.readValue(MACRO_DEPTH);
        ControlDestination destination2 = destination(in.readByte());
        return new MacroController(destination1, depth1, destination2, in.readValue(MACRO_DEPTH));
    }

    public void write(ByteWriter out) {
        out.writeByte(destination1.ordinal());
        out.writeValue(depth1);
        out.writeByte(destination2.ordinal());
        out.writeValue(depth2);
    }
}
