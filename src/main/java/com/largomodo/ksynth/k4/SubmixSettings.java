package com.largomodo.ksynth.k4;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.SysexCodec;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.EFFECT_PARAMETER;
import static com.largomodo.ksynth.core.Category.LEVEL;

/**
 * Pan and effect sends of one submix channel.
 */
public record SubmixSettings(BoundedValue pan, BoundedValue send1, BoundedValue send2) {

    public static final int DATA_SIZE = 3;
    public static final SysexCodec<SubmixSettings> CODEC =
            SysexCodec.of("K4 submix", DATA_SIZE, SubmixSettings::read, SubmixSettings::write);

    public SubmixSettings {
        require(pan, EFFECT_PARAMETER, "pan");
        require(send1, LEVEL, "send1");
        require(send2, LEVEL, "send2");
    }

    public static SubmixSettings defaults() {
        return new SubmixSettings(BoundedValue.zero(EFFECT_PARAMETER), BoundedValue.of(LEVEL, 50),
                BoundedValue.of(LEVEL, 50));
    }

    public static SubmixSettings read(ByteReader in) {
        return new SubmixSettings(in.readValue(EFFECT_PARAMETER), in.readValue(LEVEL), in.readValue(LEVEL));
    }

    public void write(ByteWriter out) {
        out.writeValue(pan);
        out.writeValue(send1);
        out.writeValue(send2);
    }
}
