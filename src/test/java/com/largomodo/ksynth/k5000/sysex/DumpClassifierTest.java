package com.largomodo.ksynth.k5000.sysex;

import com.largomodo.ksynth.core.ParseError;
import com.largomodo.ksynth.core.SysexParseException;
import com.largomodo.ksynth.generators.PatchDataGenerator;
import net.jqwik.api.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class DumpClassifierTest {

    private static byte[] header(int function, int kind, int sub) {
        return new byte[]{0x00, (byte) function, 0x00, 0x0A, (byte) kind, (byte) sub, 0x00};
    }

    @ParameterizedTest
    @CsvSource({
            "0x20, 0x00, 0x00, ONE,   SINGLE,          PATCH_NUMBER, 7",
            "0x21, 0x00, 0x00, BLOCK, SINGLE,          TONE_MAP,     25",
            "0x21, 0x00, 0x01, BLOCK, SINGLE,          NONE,         6",
            "0x21, 0x00, 0x04, BLOCK, SINGLE,          TONE_MAP,     25",
            "0x20, 0x20, 0x00, ONE,   MULTI,           PATCH_NUMBER, 6",
            "0x21, 0x20, 0x00, BLOCK, MULTI,           NONE,         5",
            "0x20, 0x10, 0x00, ONE,   DRUM_KIT,        NONE,         5",
            "0x20, 0x11, 0x00, ONE,   DRUM_INSTRUMENT, PATCH_NUMBER, 6",
            "0x21, 0x11, 0x00, BLOCK, DRUM_INSTRUMENT, NONE,         5"
    })
    void classifiesEveryDumpKind(String function, String kind, String sub, Cardinality cardinality,
                                 PatchKind patchKind, SubData subData, int headerSize) {
        Dump dump = DumpClassifier.classify(header(Integer.decode(function), Integer.decode(kind),
                Integer.decode(sub)));

        assertEquals(cardinality, dump.cardinality());
        assertEquals(patchKind, dump.kind());
        assertEquals(subData, dump.subData());
        assertEquals(headerSize, dump.headerSize());
    }

    @Test
    void bankCIsUnidentified() {
        SysexParseException e = assertThrows(SysexParseException.class,
                () -> DumpClassifier.classify(header(0x20, 0x00, 0x05)));

        assertEquals(ParseError.UNIDENTIFIED, e.kind());
        assertTrue(e.getMessage().contains("K5000 header 00 20 00 0A 00 05"), e.getMessage());
    }

    @Test
    void k4HeaderIsUnidentified() {
        SysexParseException e = assertThrows(SysexParseException.class,
                () -> DumpClassifier.classify(new byte[]{0x00, 0x20, 0x00, 0x04, 0x00, 0x00}));

        assertEquals(ParseError.UNIDENTIFIED, e.kind());
    }

    @Test
    void headerShorterThanFixedPartIsTooShort() {
        SysexParseException e = assertThrows(SysexParseException.class,
                () -> DumpClassifier.classify(new byte[]{0x00, 0x20, 0x00, 0x0A}));

        assertEquals(ParseError.TOO_SHORT, e.kind());
        assertEquals(5, e.expected());
        assertEquals(4, e.actual());
    }

    @Test
    void tableHasTwoRulesPerBankPlusMultisAndDrums() {
        assertEquals(2 * BankIdentifier.values().length + 5, DumpClassifier.table().size());
    }

    @Property
    void rulesAreMutuallyExclusive(@ForAll("k5000Headers") byte[] header) {
        try {
            Dump dump = DumpClassifier.classify(header);
            assertTrue(header.length >= dump.headerSize() - dump.subData().size());
        } catch (SysexParseException e) {
            assertEquals(ParseError.UNIDENTIFIED, e.kind());
        }
    }

    @Provide
    Arbitrary<byte[]> k5000Headers() {
        return PatchDataGenerator.headerBytes(DumpClassifier.MACHINE_ID);
    }
}
