package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.Bits;
import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.Discriminants;
import com.largomodo.ksynth.core.SysexCodec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.MACRO_DEPTH;
import static com.largomodo.ksynth.core.Category.SOURCE_COUNT;
import static com.largomodo.ksynth.core.Category.UNSIGNED_LEVEL;

/**
 * Common block of a single patch (81 bytes).
 * <p>
 * The four user macro controllers are stored split: all eight destinations
 * first, then all eight depths. Source mute bits are set for muted sources.
 */
public record Common(EffectSettings effects, Geq geq, boolean drumMark, String name, BoundedValue volume,
                     Polyphony polyphony, BoundedValue sourceCount, List<Boolean> sourceMuted,
                     AmplitudeModulation amplitudeModulation, EffectControl effectControl, boolean portamento,
                     BoundedValue portamentoSpeed, List<MacroController> macros, SwitchControl switches) {

    public static final int NAME_LENGTH = 8;
    public static final int MAX_SOURCES = 6;
    public static final int MACRO_COUNT = 4;
    public static final int DATA_SIZE = 81;
    public static final SysexCodec<Common> CODEC = SysexCodec.of("K5000 common", DATA_SIZE, Common::read, Common::write);

    public Common {
        Objects.requireNonNull(effects, "effects must not be null");
        Objects.requireNonNull(geq, "geq must not be null");
        name = checkName(name);
        require(volume, UNSIGNED_LEVEL, "volume");
        Objects.requireNonNull(polyphony, "polyphony must not be null");
        require(sourceCount, SOURCE_COUNT, "sourceCount");
        Objects.requireNonNull(sourceMuted, "sourceMuted must not be null");
        if (sourceMuted.size() != MAX_SOURCES) {
            throw new IllegalArgumentException("sourceMuted must have " + MAX_SOURCES + " entries, got "
                    + sourceMuted.size());
        }
        sourceMuted = List.copyOf(sourceMuted);
        Objects.requireNonNull(amplitudeModulation, "amplitudeModulation must not be null");
        Objects.requireNonNull(effectControl, "effectControl must not be null");
        require(portamentoSpeed, UNSIGNED_LEVEL, "portamentoSpeed");
        Objects.requireNonNull(macros, "macros must not be null");
        if (macros.size() != MACRO_COUNT) {
            throw new IllegalArgumentException("macros must have " + MACRO_COUNT + " entries, got " + macros.size());
        }
        macros = List.copyOf(macros);
        Objects.requireNonNull(switches, "switches must not be null");
    }

    /**
     * Common block for a new patch with the given number of sources.
     */
    public static Common defaults(String name, int sourceCount) {
        return new Common(EffectSettings.defaults(), Geq.flat(), false, name, BoundedValue.of(UNSIGNED_LEVEL, 115),
                Polyphony.POLY, BoundedValue.of(SOURCE_COUNT, sourceCount),
                Collections.nCopies(MAX_SOURCES, false), AmplitudeModulation.OFF, EffectControl.defaults(), false,
                BoundedValue.zero(UNSIGNED_LEVEL), Collections.nCopies(MACRO_COUNT, MacroController.defaults()),
                SwitchControl.defaults());
    }

    public Common withSourceCount(int count) {
        return new Common(effects, geq, drumMark, name, volume, polyphony, BoundedValue.of(SOURCE_COUNT, count),
                sourceMuted, amplitudeModulation, effectControl, portamento, portamentoSpeed, macros, switches);
    }

    public static Common read(ByteReader in) {
        EffectSettings effects = in.read(EffectSettings.CODEC);
        Geq geq = in.read(Geq.CODEC);
        boolean drumMark = in.readFlag();
        String name = in.readName("K5000 single name", NAME_LENGTH);
        BoundedValue volume = in.readValue(UNSIGNED_LEVEL);
        Polyphony polyphony = Discriminants.byOrdinal(Polyphony.values(), in.readByte(), "polyphony");
        in.skip(1);
        BoundedValue sourceCount = in.readValue(SOURCE_COUNT);
        int mutes = in.readByte();
        List<Boolean> sourceMuted = new ArrayList<>(MAX_SOURCES);
        for (int i = 0; i < MAX_SOURCES; i++) {
            sourceMuted.add(Bits.flag(mutes, i));
        }
        AmplitudeModulation am =
                Discriminants.byOrdinal(AmplitudeModulation.values(), in.readByte(), "amplitude modulation");
        EffectControl effectControl = in.read(EffectControl.CODEC);
        boolean portamento = in.readFlag();
        BoundedValue portamentoSpeed = in.readValue(UNSIGNED_LEVEL);

        ControlDestination[] destinations = new ControlDestination[2 * MACRO_COUNT];
        for (int i = 0; i < destinations.length; i++) {
            destinations[i] = MacroController.destination(in.readByte());
        }
        List<MacroController> macros = new ArrayList<>(MACRO_COUNT);
        for (int i = 0; i < MACRO_COUNT; i++) {
            BoundedValue depth1 = in.readValue(MACRO_DEPTH);
            BoundedValue depth2 = in.readValue(MACRO_DEPTH);
            macros.add(new MacroController(destinations[2 * i], depth1, destinations[2 * i + 1], depth2));
        }
        return new Common(effects, geq, drumMark, name, volume, polyphony, sourceCount, sourceMuted, am,
                effectControl, portamento, portamentoSpeed, macros, in.read(SwitchControl.CODEC));
    }

    public void write(ByteWriter out) {
        out.write(EffectSettings.CODEC, effects);
        out.write(Geq.CODEC, geq);
        out.writeFlag(drumMark);
        out.writeName(name, NAME_LENGTH);
        out.writeValue(volume);
        out.writeByte(polyphony.ordinal());
        out.writeZeros(1);
        out.writeValue(sourceCount);
        int mutes = 0;
        for (int i = 0; i < MAX_SOURCES; i++) {
            mutes = Bits.withFlag(mutes, i, sourceMuted.get(i));
        }
        out.writeByte(mutes);
        out.writeByte(amplitudeModulation.ordinal());
        out.write(EffectControl.CODEC, effectControl);
        out.writeFlag(portamento);
        out.writeValue(portamentoSpeed);
        for (MacroController macro : macros) {
            out.writeByte(macro.destination1().ordinal());
            out.writeByte(macro.destination2().ordinal());
        }
        for (MacroController macro : macros) {
            out.writeValue(macro.depth1());
            out.writeValue(macro.depth2());
        }
        out.write(SwitchControl.CODEC, switches);
    }

    /**
     * Validates a patch name and pads it with spaces to its wire width.
     */
    static String checkName(String name) {
        Objects.requireNonNull(name, "name must not be null");
        if (name.length() > NAME_LENGTH) {
            throw new IllegalArgumentException("Name longer than " + NAME_LENGTH + " characters: " + name);
        }
        if (!name.chars().allMatch(c -> c >= 0x20 && c <= 0x7E)) {
            throw new IllegalArgumentException("Name must be printable ASCII: " + name);
        }
        return String.format("%-" + NAME_LENGTH + "s", name);
    }
}
