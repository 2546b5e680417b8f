package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.generators.PatchDataGenerator;
import net.jqwik.api.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommonTest {

    private static final int MUTE_OFFSET = 51;

    @Test
    void commonIs81Bytes() {
        assertEquals(81, Common.CODEC.encode(Common.defaults("Init", 2)).length);
    }

    @Test
    void sourceMuteBitSetMeansMuted() {
        Common defaults = Common.defaults("Mutes", 6);
        Common common = new Common(defaults.effects(), defaults.geq(), false, defaults.name(), defaults.volume(),
                defaults.polyphony(), defaults.sourceCount(), List.of(true, false, false, false, false, true),
                defaults.amplitudeModulation(), defaults.effectControl(), false, defaults.portamentoSpeed(),
                defaults.macros(), defaults.switches());

        byte[] data = Common.CODEC.encode(common);

        assertEquals(6, data[MUTE_OFFSET - 1]);
        assertEquals(0b100001, data[MUTE_OFFSET]);
    }

    @Property
    void decodeInvertsEncode(@ForAll("commons") Common common) {
        assertEquals(common, Common.CODEC.decode(Common.CODEC.encode(common)));
    }

    @Provide
    Arbitrary<Common> commons() {
        return PatchDataGenerator.commons();
    }
}
