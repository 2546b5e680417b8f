package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.Checksum;
import com.largomodo.ksynth.core.ChecksumPolicy;
import com.largomodo.ksynth.core.Decoded;
import com.largomodo.ksynth.core.ParseError;
import com.largomodo.ksynth.core.SysexDecoder;
import com.largomodo.ksynth.core.SysexParseException;
import com.largomodo.ksynth.generators.PatchDataGenerator;
import net.jqwik.api.*;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SinglePatchTest {

    private static final int COMMON_START = 1;
    private static final int SOURCE_COUNT_OFFSET = COMMON_START + 50;

    @Test
    void sizeGrowsWithSourcesAndAdditiveKits() {
        assertEquals(1 + 81 + 2 * 86, SinglePatch.of("PCM", 2, 0).dataSize());
        assertEquals(1 + 81 + 2 * 86 + 806, SinglePatch.of("Add Pad", 1, 1).dataSize());
        assertEquals(1 + 81 + 6 * 86 + 6 * 806, SinglePatch.of("Full", 0, 6).dataSize());
    }

    @Test
    void additiveSourceRoundTripsWithItsKit() {
        SinglePatch patch = SinglePatch.of("Add Pad", 1, 1);

        byte[] data = patch.toBytes();
        SinglePatch decoded = new SysexDecoder(ChecksumPolicy.STRICT).decode(SinglePatch::read, data).value();

        assertEquals(patch.dataSize(), data.length);
        assertEquals(patch, decoded);
        assertEquals("Add Pad ", decoded.name());
        assertEquals("PA", decoded.sourceString());
        assertTrue(decoded.kitFor(0).isEmpty());
        assertEquals(AdditiveKit.defaults(), decoded.kitFor(1).orElseThrow());
    }

    @Test
    void checksumCoversCommonAndSourcesOnly() {
        byte[] data = SinglePatch.of("Add Pad", 1, 1).toBytes();
        int sourcesEnd = 1 + Common.DATA_SIZE + 2 * Source.DATA_SIZE;

        assertEquals(Checksum.of(data, 1, sourcesEnd), data[0]);
        assertEquals(Checksum.of(data, sourcesEnd + 1, data.length), data[sourcesEnd]);
    }

    @Test
    void commonCarriesNameAndSourceCount() {
        byte[] data = SinglePatch.of("Bells", 3, 0).toBytes();

        assertEquals(3, data[SOURCE_COUNT_OFFSET]);
        assertEquals("Bells   ", new String(data, COMMON_START + 39, 8, StandardCharsets.US_ASCII));
    }

    @Test
    void corruptedSingleChecksumIsReported() {
        byte[] data = SinglePatch.of("Bells", 2, 0).toBytes();
        data[0] = (byte) ((data[0] + 1) & 0x7F);

        Decoded<SinglePatch> decoded = new SysexDecoder(ChecksumPolicy.WARN).decode(SinglePatch::read, data);

        assertEquals(1, decoded.checksumMismatches().size());
        assertEquals("K5000 single", decoded.checksumMismatches().get(0).block());
        assertEquals(0, decoded.checksumMismatches().get(0).offset());
    }

    @Test
    void missingAdditiveKitIsTooShort() {
        byte[] data = SinglePatch.of("Add Pad", 1, 1).toBytes();
        byte[] withoutKit = Arrays.copyOf(data, data.length - AdditiveKit.DATA_SIZE);

        SysexParseException e = assertThrows(SysexParseException.class,
                () -> SinglePatch.read(new ByteReader(withoutKit)));
        assertEquals(ParseError.TOO_SHORT, e.kind());
    }

    @Test
    void sourceCountBelowTwoIsRangeError() {
        byte[] data = SinglePatch.of("Bells", 2, 0).toBytes();
        data[SOURCE_COUNT_OFFSET] = 1;

        SysexParseException e = assertThrows(SysexParseException.class,
                () -> SinglePatch.read(new ByteReader(data)));
        assertEquals(ParseError.RANGE, e.kind());
    }

    @Test
    void sourcesMustMatchDeclaredCount() {
        SinglePatch patch = SinglePatch.of("Bells", 2, 0);

        assertThrows(IllegalArgumentException.class,
                () -> new SinglePatch(patch.common(), List.of(Source.pcm(1)), List.of()));
    }

    @Test
    void everyAdditiveSourceNeedsAKit() {
        Common common = Common.defaults("Add", 2);

        assertThrows(IllegalArgumentException.class,
                () -> new SinglePatch(common, List.of(Source.pcm(1), Source.additive()), List.of()));
    }

    @Test
    void sourceStringListsPcmThenAdditive() {
        SinglePatch patch = SinglePatch.of("Mix", 2, 1);

        assertEquals("PPA", patch.sourceString());
        assertTrue(patch.toString().startsWith("Mix      volume=115"), patch.toString());
    }

    @Test
    void mutedSourcesShowAsDash() {
        byte[] data = SinglePatch.of("Mix", 2, 1).toBytes();
        data[SOURCE_COUNT_OFFSET + 1] = 0b010;

        Decoded<SinglePatch> decoded = new SysexDecoder(ChecksumPolicy.IGNORE).decode(SinglePatch::read, data);

        assertEquals("P-A", decoded.value().sourceString());
        assertFalse(decoded.isClean());
    }

    @Property(tries = 100)
    void decodeInvertsEncode(@ForAll("singles") SinglePatch patch) {
        byte[] data = patch.toBytes();

        Decoded<SinglePatch> decoded = new SysexDecoder(ChecksumPolicy.STRICT).decode(SinglePatch::read, data);

        assertEquals(patch.dataSize(), data.length);
        assertEquals(patch, decoded.value());
    }

    @Provide
    Arbitrary<SinglePatch> singles() {
        return PatchDataGenerator.singlePatches();
    }
}
