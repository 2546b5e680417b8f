package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.Discriminants;
import com.largomodo.ksynth.core.SysexCodec;

import java.util.Objects;

/**
 * Functions of the two panel switches and the two footswitches.
 */
public record SwitchControl(Switch switch1, Switch switch2, Switch footswitch1, Switch footswitch2) {

    public static final int DATA_SIZE = 4;
    public static final SysexCodec<SwitchControl> CODEC =
            SysexCodec.of("K5000 switches", DATA_SIZE, SwitchControl::read, SwitchControl::write);

    public SwitchControl {
        Objects.requireNonNull(switch1, "switch1 must not be null");
        Objects.requireNonNull(switch2, "switch2 must not be null");
        Objects.requireNonNull(footswitch1, "footswitch1 must not be null");
        Objects.requireNonNull(footswitch2, "footswitch2 must not be null");
    }

    public static SwitchControl defaults() {
        return new SwitchControl(Switch.OFF, Switch.OFF, Switch.OFF, Switch.OFF);
    }

    private static Switch readSwitch(ByteReader in, String field) {
        return Discriminants.byOrdinal(Switch.values(), in.readByte(), field);
    }

    public static SwitchControl read(ByteReader in) {
        return new SwitchControl(readSwitch(in, "switch 1"), readSwitch(in, "switch 2"),
                readSwitch(in, "footswitch 1"), readSwitch(in, "footswitch 2"));
    }

    public void write(ByteWriter out) {
        out.writeByte(switch1.ordinal());
        out.writeByte(switch2.ordinal());
        out.writeByte(footswitch1.ordinal());
        out.writeByte(footswitch2.ordinal());
    }
}
