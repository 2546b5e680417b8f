package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.SysexCodec;
import com.largomodo.ksynth.core.SysexParseException;

import java.util.Objects;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.CHANNEL;
import static com.largomodo.ksynth.core.Category.COARSE;
import static com.largomodo.ksynth.core.Category.EFFECT_PATH;
import static com.largomodo.ksynth.core.Category.KEY;
import static com.largomodo.ksynth.core.Category.SIGNED_LEVEL;
import static com.largomodo.ksynth.core.Category.SINGLE_PATCH;
import static com.largomodo.ksynth.core.Category.UNSIGNED_LEVEL;

/**
 * One section of a multi (11 bytes). The single number is split into a
 * 3-bit MSB and a 7-bit LSB.
 */
public record MultiSection(BoundedValue single, BoundedValue volume, BoundedValue pan, BoundedValue effectPath,
                           BoundedValue transpose, BoundedValue tune, BoundedValue zoneLow, BoundedValue zoneHigh,
                           VelocitySwitchSettings velocitySwitch, BoundedValue receiveChannel) {

    public static final int DATA_SIZE = 11;
    public static final SysexCodec<MultiSection> CODEC =
            SysexCodec.of("K5000 multi section", DATA_SIZE, MultiSection::read, MultiSection::write);

    public MultiSection {
        require(single, SINGLE_PATCH, "single");
        require(volume, UNSIGNED_LEVEL, "volume");
        require(pan, SIGNED_LEVEL, "pan");
        require(effectPath, EFFECT_PATH, "effectPath");
        require(transpose, COARSE, "transpose");
        require(tune, SIGNED_LEVEL, "tune");
        require(zoneLow, KEY, "zoneLow");
        require(zoneHigh, KEY, "zoneHigh");
        Objects.requireNonNull(velocitySwitch, "velocitySwitch must not be null");
        require(receiveChannel, CHANNEL, "receiveChannel");
    }

    public static MultiSection defaults() {
        return new MultiSection(BoundedValue.zero(SINGLE_PATCH), BoundedValue.of(UNSIGNED_LEVEL, 127),
                BoundedValue.zero(SIGNED_LEVEL), BoundedValue.zero(EFFECT_PATH), BoundedValue.zero(COARSE),
                BoundedValue.zero(SIGNED_LEVEL), BoundedValue.zero(KEY), BoundedValue.of(KEY, 127),
                VelocitySwitchSettings.defaults(), BoundedValue.of(CHANNEL, 1));
    }

    public static MultiSection read(ByteReader in) {
        int msb = in.readByte();
        int lsb = in.readByte();
        if (msb > 0x07 || lsb > 0x7F) {
            throw SysexParseException.rangeError(SINGLE_PATCH, (msb << 7) + lsb);
        }
        BoundedValue single = BoundedValue.of(SINGLE_PATCH, (msb << 7) | lsb);
        BoundedValue volume = in.readValue(UNSIGNED_LEVEL);
        BoundedValue pan = in.readValue(SIGNED_LEVEL);
        BoundedValue effectPath = in.readValue(EFFECT_PATH);
        BoundedValue transpose = in.readValue(COARSE);
        BoundedValue tune = in.readValue(SIGNED_LEVEL);
        BoundedValue zoneLow = in.readValue(KEY);
        BoundedValue zoneHigh = in.readValue(KEY);
        VelocitySwitchSettings velocitySwitch = in.read(VelocitySwitchSettings.CODEC);
        return new MultiSection(single, volume, pan, effectPath, transpose, tune, zoneLow, zoneHigh, velocitySwitch,
                in.readValue(CHANNEL));
    }

    public void write(ByteWriter out) {
        out.writeByte(single.value() >> 7);
        out.writeByte(single.value() & 0x7F);
        out.writeValue(volume);
        out.writeValue(pan);
        out.writeValue(effectPath);
        out.writeValue(transpose);
        out.writeValue(tune);
        out.writeValue(zoneLow);
        out.writeValue(zoneHigh);
        out.write(VelocitySwitchSettings.CODEC, velocitySwitch);
        out.writeValue(receiveChannel);
    }
}
