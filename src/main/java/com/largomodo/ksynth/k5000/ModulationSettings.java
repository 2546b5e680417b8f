package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.SysexCodec;

import java.util.Objects;

/**
 * Per-source modulation routing (18 bytes). The three macro controllers take
 * four bytes each, the two assignable controllers three.
 */
public record ModulationSettings(MacroController pressure, MacroController wheel, MacroController expression,
                                 AssignableController assignable1, AssignableController assignable2) {

    public static final int DATA_SIZE = 3 * MacroController.DATA_SIZE + 2 * AssignableController.DATA_SIZE;
    public static final SysexCodec<ModulationSettings> CODEC = SysexCodec.of("K5000 modulation", DATA_SIZE,
            ModulationSettings::read, ModulationSettings::write);

    public ModulationSettings {
        Objects.requireNonNull(pressure, "pressure must not be null");
        Objects.requireNonNull(wheel, "wheel must not be null");
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(assignable1, "assignable1 must not be null");
        Objects.requireNonNull(assignable2, "assignable2 must not be null");
    }

    public static ModulationSettings defaults() {
        return new ModulationSettings(MacroController.defaults(), MacroController.defaults(),
                MacroController.defaults(), AssignableController.defaults(), AssignableController.defaults());
    }

    public static ModulationSettings read(ByteReader in) {
        return new ModulationSettings(in.read(MacroController.CODEC), in.read(MacroController.CODEC),
                in.read(MacroController.CODEC), in.read(AssignableController.CODEC),
                in.read(AssignableController.CODEC));
    }

    public void write(ByteWriter out) {
        out.write(MacroController.CODEC, pressure);
        out.write(MacroController.CODEC, wheel);
        out.write(MacroController.CODEC, expression);
        out.write(AssignableController.CODEC, assignable1);
        out.write(AssignableController.CODEC, assignable2);
    }
}
