package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.Checksum;
import com.largomodo.ksynth.core.ChecksumPolicy;
import com.largomodo.ksynth.core.Decoded;
import com.largomodo.ksynth.core.ParseError;
import com.largomodo.ksynth.core.SysexDecoder;
import com.largomodo.ksynth.core.SysexParseException;
import com.largomodo.ksynth.generators.PatchDataGenerator;
import net.jqwik.api.*;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AdditiveKitTest {

    @Test
    void kitIs806Bytes() {
        assertEquals(806, AdditiveKit.DATA_SIZE);
        assertEquals(806, AdditiveKit.CODEC.encode(AdditiveKit.defaults()).length);
    }

    @Test
    void checksumLeadsAndCoversTheRest() {
        byte[] data = AdditiveKit.CODEC.encode(AdditiveKit.defaults());

        assertEquals(Checksum.of(data, 1, data.length), data[0]);
    }

    @Test
    void defaultsRoundTrip() {
        AdditiveKit kit = AdditiveKit.defaults();

        Decoded<AdditiveKit> decoded = new SysexDecoder(ChecksumPolicy.STRICT)
                .decode(AdditiveKit.CODEC, AdditiveKit.CODEC.encode(kit));

        assertTrue(decoded.isClean());
        assertEquals(kit, decoded.value());
        assertEquals(127, decoded.value().softLevels().get(0).value());
        assertEquals(0, decoded.value().softLevels().get(1).value());
    }

    @Test
    void strictPolicyRejectsCorruptedKit() {
        byte[] data = AdditiveKit.CODEC.encode(AdditiveKit.defaults());
        data[500] ^= 0x01;

        SysexParseException e = assertThrows(SysexParseException.class,
                () -> new SysexDecoder(ChecksumPolicy.STRICT).decode(AdditiveKit.CODEC, data));
        assertEquals(ParseError.CHECKSUM_MISMATCH, e.kind());
    }

    @Test
    void harmonicListsMustBeComplete() {
        AdditiveKit kit = AdditiveKit.defaults();

        assertThrows(IllegalArgumentException.class, () -> new AdditiveKit(kit.common(), kit.morf(),
                kit.formantFilter(), kit.softLevels().subList(0, 63), kit.loudLevels(), kit.bands(),
                kit.envelopes(), kit.loudSenseSelect()));
    }

    @Property(tries = 200)
    void decodeInvertsEncode(@ForAll("kits") AdditiveKit kit) {
        Decoded<AdditiveKit> decoded = new SysexDecoder(ChecksumPolicy.STRICT)
                .decode(AdditiveKit.CODEC, AdditiveKit.CODEC.encode(kit));

        assertEquals(kit, decoded.value());
    }

    @Provide
    Arbitrary<AdditiveKit> kits() {
        return PatchDataGenerator.additiveKits();
    }
}
