package com.largomodo.ksynth.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ByteReaderTest {

    private static final SysexCodec<Integer> PAIR = SysexCodec.of("pair", 2,
            in -> (in.readByte() << 7) | in.readByte(),
            (value, out) -> {
                out.writeByte(value >> 7);
                out.writeByte(value & 0x7F);
            });

    private static final SysexCodec<Integer> GREEDY = SysexCodec.of("greedy", 2, ByteReader::readByte,
            (value, out) -> out.writeByte(value));

    @Test
    void readNameTurnsNulIntoSpace() {
        ByteReader in = new ByteReader(new byte[]{'A', 'b', 0, 0});

        assertEquals("Ab  ", in.readName("name", 4));
        assertEquals(0, in.remaining());
    }

    @Test
    void readNameRejectsControlCharacters() {
        ByteReader in = new ByteReader(new byte[]{'O', 'K', 0x07, 'X'});

        SysexParseException e = assertThrows(SysexParseException.class, () -> in.readName("name", 4));
        assertEquals(ParseError.INVALID_TEXT, e.kind());
    }

    @Test
    void readingPastEndFailsWithTooShort() {
        ByteReader in = new ByteReader(new byte[]{1, 2});

        SysexParseException e = assertThrows(SysexParseException.class, () -> in.readBytes(3));
        assertEquals(ParseError.TOO_SHORT, e.kind());
        assertEquals(3, e.expected());
        assertEquals(2, e.actual());
    }

    @Test
    void readCodecConsumesDeclaredSize() {
        ByteReader in = new ByteReader(new byte[]{0x01, 0x7F, 0x33});

        assertEquals(255, in.read(PAIR));
        assertEquals(2, in.position());
        assertEquals(0x33, in.readByte());
    }

    @Test
    void codecLeavingBytesUnreadIsAProgrammingError() {
        ByteReader in = new ByteReader(new byte[]{1, 2});

        assertThrows(IllegalStateException.class, () -> in.read(GREEDY));
    }

    @Test
    void sliceCannotReadIntoNeighbour() {
        ByteReader in = new ByteReader(new byte[]{1, 2, 3});
        ByteReader slice = in.slice(1);

        assertEquals(1, slice.readByte());
        assertThrows(SysexParseException.class, slice::readByte);
        assertEquals(2, in.readByte());
    }

    @Test
    void interleavedEntitiesAreGatheredPerLane() {
        ByteReader in = new ByteReader(new byte[]{0x01, 0x00, 0x02, 0x05});

        assertEquals(List.of(0x82, 0x05), in.readInterleaved(PAIR, 2));
    }

    @Test
    void writerMirrorsInterleavedLayout() {
        ByteWriter out = new ByteWriter();
        out.writeInterleaved(PAIR, List.of(0x82, 0x05));

        assertArrayEquals(new byte[]{0x01, 0x00, 0x02, 0x05}, out.toByteArray());
    }

    @Test
    void writerPadsNameWithSpaces() {
        ByteWriter out = new ByteWriter();
        out.writeName("Vox", 5);

        assertArrayEquals(new byte[]{'V', 'o', 'x', ' ', ' '}, out.toByteArray());
    }

    @Test
    void trailingChecksumMatchesReader() {
        ByteWriter out = new ByteWriter();
        out.writeBytes(new byte[]{0x10, 0x20});
        out.writeChecksum(0);
        byte[] block = out.toByteArray();

        DecodeContext context = new DecodeContext(ChecksumPolicy.STRICT, DecodeObserver.NONE);
        ByteReader in = new ByteReader(block, context);
        in.skip(2);
        assertDoesNotThrow(() -> in.readChecksum("block", 0));
        assertEquals(Checksum.reduce(0x30), block[2]);
    }
}
