package com.largomodo.ksynth.k4;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.Bits;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.Discriminants;
import com.largomodo.ksynth.core.SysexCodec;

import java.util.Objects;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.CHANNEL;
import static com.largomodo.ksynth.core.Category.COARSE;
import static com.largomodo.ksynth.core.Category.DEPTH;
import static com.largomodo.ksynth.core.Category.KEY;
import static com.largomodo.ksynth.core.Category.LEVEL;
import static com.largomodo.ksynth.core.Category.SINGLE_NUMBER;

/**
 * One of the eight sections of a multi (8 bytes).
 */
public record MultiSection(BoundedValue singleNumber, BoundedValue lowKey, BoundedValue highKey,
                           BoundedValue receiveChannel, VelocitySwitch velocitySwitch, boolean muted,
                           Submix submix, PlayMode playMode, BoundedValue level, BoundedValue transpose,
                           BoundedValue tune) {

    public static final int DATA_SIZE = 8;
    public static final SysexCodec<MultiSection> CODEC =
            SysexCodec.of("K4 multi section", DATA_SIZE, MultiSection::read, MultiSection::write);

    public MultiSection {
        require(singleNumber, SINGLE_NUMBER, "singleNumber");
        require(lowKey, KEY, "lowKey");
        require(highKey, KEY, "highKey");
        require(receiveChannel, CHANNEL, "receiveChannel");
        Objects.requireNonNull(velocitySwitch, "velocitySwitch must not be null");
        Objects.requireNonNull(submix, "submix must not be null");
        Objects.requireNonNull(playMode, "playMode must not be null");
        require(level, LEVEL, "level");
        require(transpose, COARSE, "transpose");
        require(tune, DEPTH, "tune");
    }

    public static MultiSection defaults() {
        return new MultiSection(BoundedValue.zero(SINGLE_NUMBER), BoundedValue.of(KEY, 0), BoundedValue.of(KEY, 127),
                BoundedValue.of(CHANNEL, 1), VelocitySwitch.ALL, false, Submix.A, PlayMode.KEYBOARD,
                BoundedValue.of(LEVEL, 100), BoundedValue.zero(COARSE), BoundedValue.zero(DEPTH));
    }

    public static MultiSection read(ByteReader in) {
        BoundedValue singleNumber = in.readValue(SINGLE_NUMBER);
        BoundedValue lowKey = in.readValue(KEY);
        BoundedValue highKey = in.readValue(KEY);
        int b3 = in.readByte();
        BoundedValue channel = BoundedValue.fromWireByte(CHANNEL, Bits.field(b3, 0, 4));
        VelocitySwitch velocitySwitch =
                Discriminants.byOrdinal(VelocitySwitch.values(), Bits.field(b3, 4, 2), "velocity switch");
        boolean muted = Bits.flag(b3, 6);
        int b4 = in.readByte();
        Submix submix = Discriminants.byOrdinal(Submix.values(), Bits.field(b4, 0, 3), "section submix");
        PlayMode playMode = Discriminants.byOrdinal(PlayMode.values(), Bits.field(b4, 3, 2), "play mode");
        return new MultiSection(singleNumber, lowKey, highKey, channel, velocitySwitch, muted, submix, playMode,
                in.readValue(LEVEL), in.readValue(COARSE), in.readValue(DEPTH));
    }

    public void write(ByteWriter out) {
        out.writeValue(singleNumber);
        out.writeValue(lowKey);
        out.writeValue(highKey);
        int b3 = Bits.withField(receiveChannel.toWireByte(), 4, 2, velocitySwitch.ordinal());
        out.writeByte(Bits.withFlag(b3, 6, muted));
        out.writeByte(Bits.withField(submix.ordinal(), 3, 2, playMode.ordinal()));
        out.writeValue(level);
        out.writeValue(transpose);
        out.writeValue(tune);
    }
}
