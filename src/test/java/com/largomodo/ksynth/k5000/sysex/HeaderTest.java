package com.largomodo.ksynth.k5000.sysex;

import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.ParseError;
import com.largomodo.ksynth.core.SysexParseException;
import com.largomodo.ksynth.k5000.ToneMap;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class HeaderTest {

    private static byte[] bytes(Header header) {
        ByteWriter out = new ByteWriter();
        header.write(out);
        return out.toByteArray();
    }

    @Test
    void oneSingleCarriesBankAndNumber() {
        byte[] data = bytes(Header.oneSingle(3, BankIdentifier.D, 17));

        assertArrayEquals(new byte[]{0x02, 0x20, 0x00, 0x0A, 0x00, 0x02, 17}, data);
        assertEquals(7, Header.oneSingle(3, BankIdentifier.D, 17).size());
    }

    @Test
    void blockSingleCarriesToneMap() {
        Header header = Header.blockSingle(1, BankIdentifier.A, ToneMap.of(0, 1));

        byte[] data = bytes(header);

        assertEquals(25, header.size());
        assertEquals(25, data.length);
        assertEquals(0x03, data[6]);
        assertEquals(header, Header.parse(data));
    }

    @Test
    void bankBBlockHasNoToneMap() {
        Header header = Header.blockPcmSingles(1);

        assertEquals(6, header.size());
        assertTrue(header.toneMap().isEmpty());
        assertEquals(BankIdentifier.B, header.dump().bank().orElseThrow());
        assertEquals(header, Header.parse(bytes(header)));
        assertEquals(SubData.NONE, Header.parse(bytes(header)).dump().subData());
    }

    @Test
    void blockSingleRejectsBankB() {
        assertThrows(IllegalArgumentException.class, () -> Header.blockSingle(1, BankIdentifier.B, ToneMap.of(0)));
    }

    @Test
    void patchNumberAboveSevenBitsIsRangeError() {
        byte[] data = {0x00, 0x20, 0x00, 0x0A, 0x00, 0x00, (byte) 0xFF};

        SysexParseException e = assertThrows(SysexParseException.class, () -> Header.parse(data));
        assertEquals(ParseError.RANGE, e.kind());
        assertEquals(0xFF, e.actual());
    }

    @Test
    void parseReadsChannelFromLowNibble() {
        Header header = Header.parse(new byte[]{0x0F, 0x20, 0x00, 0x0A, 0x20, 0x05});

        assertEquals(16, header.channel().value());
        assertEquals(PatchKind.MULTI, header.dump().kind());
        assertEquals(5, header.patchNumber().getAsInt());
        assertEquals("Ch: 16  ONE Multi/Combi #5", header.toString());
    }

    @Test
    void truncatedToneMapIsTooShort() {
        byte[] data = Arrays.copyOf(bytes(Header.blockSingle(1, BankIdentifier.E, ToneMap.full())), 20);

        SysexParseException e = assertThrows(SysexParseException.class, () -> Header.parse(data));
        assertEquals(ParseError.TOO_SHORT, e.kind());
    }

    @Test
    void subDataMustMatchDump() {
        Header single = Header.oneSingle(1, BankIdentifier.A, 0);

        assertThrows(IllegalArgumentException.class, () -> new Header(single.channel(), single.dump(),
                java.util.OptionalInt.empty(), single.toneMap()));
    }
}
