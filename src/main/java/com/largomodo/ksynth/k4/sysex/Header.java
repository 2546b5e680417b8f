package com.largomodo.ksynth.k4.sysex;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.Discriminants;
import com.largomodo.ksynth.core.SysexCodec;

import java.util.Objects;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.CHANNEL;

/**
 * The six bytes following the manufacturer ID of a K4 message.
 */
public record Header(BoundedValue channel, Function function, int group, int machineId, int subStatus1,
                     int subStatus2) {

    public static final int DATA_SIZE = 6;
    public static final int GROUP = 0x00;
    public static final int MACHINE_ID = 0x04;
    public static final SysexCodec<Header> CODEC = SysexCodec.of("K4 header", DATA_SIZE, Header::read, Header::write);

    public Header {
        require(channel, CHANNEL, "channel");
        Objects.requireNonNull(function, "function must not be null");
        checkByte(group, "group");
        checkByte(machineId, "machineId");
        checkByte(subStatus1, "subStatus1");
        checkByte(subStatus2, "subStatus2");
    }

    /**
     * Header of a data dump on the given 1-based channel.
     */
    public static Header of(int channel, Function function, int subStatus1, int subStatus2) {
        return new Header(BoundedValue.of(CHANNEL, channel), function, GROUP, MACHINE_ID, subStatus1, subStatus2);
    }

    public static Header read(ByteReader in) {
        BoundedValue channel = BoundedValue.fromWireByte(CHANNEL, in.readByte() & 0x0F);
        Function function = Discriminants.byCode(Function.values(), in.readByte(), "function");
        return new Header(channel, function, in.readByte(), in.readByte(), in.readByte(), in.readByte());
    }

    public void write(ByteWriter out) {
        out.writeValue(channel);
        out.writeByte(function.code());
        out.writeByte(group);
        out.writeByte(machineId);
        out.writeByte(subStatus1);
        out.writeByte(subStatus2);
    }

    @Override
    public String toString() {
        return String.format("Ch: %s  Fn: %s, Sub1: %d, Sub2: %d", channel, function.displayName(), subStatus1,
                subStatus2);
    }

    private static void checkByte(int value, String name) {
        if (value < 0 || value > 0x7F) {
            throw new IllegalArgumentException(name + " must be a 7-bit value, got " + value);
        }
    }
}
