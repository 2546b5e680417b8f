package com.largomodo.ksynth.inspect;

import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.ChecksumPolicy;
import com.largomodo.ksynth.core.ParseError;
import com.largomodo.ksynth.core.SysexDecoder;
import com.largomodo.ksynth.core.SysexParseException;
import com.largomodo.ksynth.k5000.MultiPatch;
import com.largomodo.ksynth.k5000.SingleBlock;
import com.largomodo.ksynth.k5000.SinglePatch;
import com.largomodo.ksynth.k5000.ToneMap;
import com.largomodo.ksynth.k5000.sysex.BankIdentifier;
import com.largomodo.ksynth.k5000.sysex.Header;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class K5000InspectorTest {

    private final K5000Inspector inspector = new K5000Inspector();
    private final SysexDecoder warn = new SysexDecoder(ChecksumPolicy.WARN);

    private static byte[] message(Header header, byte[] payload) {
        ByteWriter out = new ByteWriter();
        header.write(out);
        out.writeBytes(payload);
        return out.toByteArray();
    }

    @Test
    void oneSingleShowsBankSlot() {
        byte[] message = message(Header.oneSingle(1, BankIdentifier.A, 4), SinglePatch.of("Add Pad", 1, 1).toBytes());

        Inspection inspection = inspector.inspect(message, warn);

        assertEquals("K5000 ONE Single bank A, channel 1", inspection.title());
        assertTrue(inspection.entries().get(0).startsWith("A005  Add Pad  volume=115"),
                inspection.entries().get(0));
        assertTrue(inspection.mismatches().isEmpty());
    }

    @Test
    void blockSingleFollowsToneMap() {
        ToneMap toneMap = ToneMap.of(0, 10);
        ByteWriter payload = new ByteWriter();
        new SingleBlock(toneMap, List.of(SinglePatch.of("First", 2, 0), SinglePatch.of("Second", 1, 1)))
                .write(payload);

        Inspection inspection = inspector.inspect(message(Header.blockSingle(1, BankIdentifier.D, toneMap),
                payload.toByteArray()), warn);

        assertEquals(2, inspection.entries().size());
        assertTrue(inspection.entries().get(0).startsWith("D001  First"));
        assertTrue(inspection.entries().get(1).startsWith("D011  Second"));
    }

    @Test
    void oneMultiIsNumberedFromOne() {
        byte[] message = message(Header.oneMulti(2, 0), MultiPatch.CODEC.encode(MultiPatch.defaults()));

        Inspection inspection = inspector.inspect(message, warn);

        assertEquals("K5000 ONE Multi/Combi, channel 2", inspection.title());
        assertEquals(List.of("M01  NewMulti volume=127"), inspection.entries());
    }

    @Test
    void drumKitIsClassifiedButNotDecoded() {
        byte[] message = {0x00, 0x20, 0x00, 0x0A, 0x10, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10};

        Inspection inspection = inspector.inspect(message, warn);

        assertEquals("K5000 ONE Drum Kit, channel 1", inspection.title());
        assertEquals(List.of("10 bytes of drum data (not decoded)"), inspection.entries());
    }

    @Test
    void corruptedSingleIsReportedUnderWarn() {
        byte[] single = SinglePatch.of("Bells", 2, 0).toBytes();
        single[0] = (byte) ((single[0] + 1) & 0x7F);

        Inspection inspection = inspector.inspect(message(Header.oneSingle(1, BankIdentifier.A, 0), single), warn);

        assertEquals(1, inspection.mismatches().size());
        assertEquals("K5000 single", inspection.mismatches().get(0).block());
    }

    @Test
    void unknownKindIsUnidentified() {
        byte[] message = {0x00, 0x20, 0x00, 0x0A, 0x30, 0x00};

        SysexParseException e = assertThrows(SysexParseException.class, () -> inspector.inspect(message, warn));
        assertEquals(ParseError.UNIDENTIFIED, e.kind());
    }

    @Test
    void slotNamesAreBankAndThreeDigits() {
        assertEquals("E128", K5000Inspector.slotName(BankIdentifier.E, 127));
        assertEquals("A001", K5000Inspector.slotName(BankIdentifier.A, 0));
    }
}
