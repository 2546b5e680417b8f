package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.Bits;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.Discriminants;
import com.largomodo.ksynth.core.SysexCodec;

import java.util.Objects;

/**
 * Velocity switch of a source, packed in one byte: threshold index in bits 0-4,
 * switch type in bits 5-6.
 *
 * @param type      off, loud or soft
 * @param threshold velocity threshold, one of 4, 8, ..., 124 or 127
 */
public record VelocitySwitchSettings(VelocitySwitch type, int threshold) {

    public static final int DATA_SIZE = 1;
    public static final SysexCodec<VelocitySwitchSettings> CODEC = SysexCodec.of("K5000 velocity switch",
            DATA_SIZE, VelocitySwitchSettings::read, VelocitySwitchSettings::write);

    private static final int THRESHOLD_COUNT = 32;

    public VelocitySwitchSettings {
        Objects.requireNonNull(type, "type must not be null");
        thresholdIndex(threshold);
    }

    public static VelocitySwitchSettings defaults() {
        return new VelocitySwitchSettings(VelocitySwitch.OFF, 68);
    }

    static int threshold(int index) {
        return index == THRESHOLD_COUNT - 1 ? 127 : 4 * (index + 1);
    }

    static int thresholdIndex(int threshold) {
        for (int i = 0; i < THRESHOLD_COUNT; i++) {
            if (threshold(i) == threshold) {
                return i;
            }
        }
        throw new IllegalArgumentException("Velocity threshold " + threshold
                + " must be a multiple of 4 between 4 and 124, or 127");
    }

    public static VelocitySwitchSettings read(ByteReader in) {
        int b = in.readByte();
        VelocitySwitch type = Discriminants.byOrdinal(VelocitySwitch.values(), Bits.field(b, 5, 2),
                "velocity switch type");
        return new VelocitySwitchSettings(type, threshold(Bits.field(b, 0, 5)));
    }

    public void write(ByteWriter out) {
        out.writeByte(Bits.withField(thresholdIndex(threshold), 5, 2, type.ordinal()));
    }

    @Override
    public String toString() {
        return type == VelocitySwitch.OFF ? type.displayName() : type.displayName() + " " + threshold;
    }
}
