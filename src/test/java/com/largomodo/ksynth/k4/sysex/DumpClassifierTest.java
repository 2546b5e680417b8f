package com.largomodo.ksynth.k4.sysex;

import com.largomodo.ksynth.core.Locality;
import com.largomodo.ksynth.core.ParseError;
import com.largomodo.ksynth.core.SysexParseException;
import com.largomodo.ksynth.generators.PatchDataGenerator;
import net.jqwik.api.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class DumpClassifierTest {

    private static byte[] header(int function, int sub1, int sub2) {
        return new byte[]{0x00, (byte) function, 0x00, 0x04, (byte) sub1, (byte) sub2};
    }

    @ParameterizedTest
    @CsvSource({
            "0x20, 0x00, 0,   ONE_SINGLE,   INTERNAL, 0",
            "0x20, 0x00, 63,  ONE_SINGLE,   INTERNAL, 63",
            "0x20, 0x00, 64,  ONE_MULTI,    INTERNAL, 0",
            "0x20, 0x02, 127, ONE_MULTI,    EXTERNAL, 63",
            "0x20, 0x01, 31,  ONE_EFFECT,   INTERNAL, 31",
            "0x20, 0x03, 0,   ONE_EFFECT,   EXTERNAL, 0"
    })
    void onePatchDumpsCarryPatchNumber(String function, String sub1, int sub2, DumpKind kind, Locality locality,
                                       int number) {
        Dump dump = DumpClassifier.classify(header(Integer.decode(function), Integer.decode(sub1), sub2));

        assertEquals(kind, dump.kind());
        assertEquals(locality, dump.locality());
        assertEquals(number, dump.number().getAsInt());
        assertEquals(Header.DATA_SIZE, dump.payloadOffset());
    }

    @ParameterizedTest
    @CsvSource({
            "0x20, 0x01, 0x20, DRUM,         INTERNAL",
            "0x20, 0x03, 0x20, DRUM,         EXTERNAL",
            "0x21, 0x00, 0x00, BLOCK_SINGLE, INTERNAL",
            "0x21, 0x02, 0x40, BLOCK_MULTI,  EXTERNAL",
            "0x21, 0x01, 0x00, BLOCK_EFFECT, INTERNAL",
            "0x22, 0x00, 0x00, ALL,          INTERNAL",
            "0x22, 0x02, 0x00, ALL,          EXTERNAL"
    })
    void collectionDumpsHaveNoPatchNumber(String function, String sub1, String sub2, DumpKind kind,
                                          Locality locality) {
        Dump dump = DumpClassifier.classify(header(Integer.decode(function), Integer.decode(sub1),
                Integer.decode(sub2)));

        assertEquals(kind, dump.kind());
        assertEquals(locality, dump.locality());
        assertTrue(dump.number().isEmpty());
    }

    @Test
    void effectNumberAboveDrumIsUnidentified() {
        SysexParseException e = assertThrows(SysexParseException.class,
                () -> DumpClassifier.classify(header(0x20, 0x01, 33)));

        assertEquals(ParseError.UNIDENTIFIED, e.kind());
    }

    @Test
    void otherMachineIsUnidentified() {
        byte[] k5000 = {0x00, 0x20, 0x00, 0x0A, 0x00, 0x00};

        SysexParseException e = assertThrows(SysexParseException.class, () -> DumpClassifier.classify(k5000));
        assertEquals(ParseError.UNIDENTIFIED, e.kind());
    }

    @Test
    void incompleteHeaderIsTooShort() {
        SysexParseException e = assertThrows(SysexParseException.class,
                () -> DumpClassifier.classify(new byte[]{0x00, 0x20, 0x00, 0x04}));

        assertEquals(ParseError.TOO_SHORT, e.kind());
    }

    @Test
    void tableCoversEveryKindAtBothLocalities() {
        assertEquals(16, DumpClassifier.table().size());
    }

    @Property
    void rulesAreMutuallyExclusive(@ForAll("k4Headers") byte[] header) {
        try {
            Dump dump = DumpClassifier.classify(header);
            assertNotNull(dump.kind());
        } catch (SysexParseException e) {
            assertEquals(ParseError.UNIDENTIFIED, e.kind());
        }
    }

    @Provide
    Arbitrary<byte[]> k4Headers() {
        return PatchDataGenerator.headerBytes(Header.MACHINE_ID);
    }
}
