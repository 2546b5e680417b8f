package com.largomodo.ksynth.core;

import net.jqwik.api.*;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChecksumTest {

    @Test
    void emptyBodyYieldsSaltOnly() {
        assertEquals(0x25, Checksum.of(new byte[0]));
    }

    @Test
    void sumWrapsModulo128() {
        byte[] body = {0x7F, 0x7F, 0x01};

        assertEquals((0x7F + 0x7F + 0x01 + 0xA5) & 0x7F, Checksum.of(body));
    }

    @Test
    void rangeIsHalfOpen() {
        byte[] data = {0x10, 0x20, 0x30, 0x40};

        assertEquals(Checksum.reduce(0x20 + 0x30), Checksum.of(data, 1, 3));
    }

    @Test
    void invalidRangeIsRejected() {
        assertThrows(IndexOutOfBoundsException.class, () -> Checksum.of(new byte[4], 2, 5));
        assertThrows(IndexOutOfBoundsException.class, () -> Checksum.of(new byte[4], 3, 2));
    }

    @Property
    void checksumIsSevenBits(@ForAll byte[] body) {
        int checksum = Checksum.of(body);

        assertTrue(checksum >= 0 && checksum <= 0x7F);
    }

    @Property
    void reducingPartialSumsEqualsChecksumOfWhole(@ForAll byte[] first, @ForAll byte[] second) {
        byte[] whole = new byte[first.length + second.length];
        System.arraycopy(first, 0, whole, 0, first.length);
        System.arraycopy(second, 0, whole, first.length, second.length);

        int partial = Checksum.sum(first, 0, first.length) + Checksum.sum(second, 0, second.length);
        assertEquals(Checksum.of(whole), Checksum.reduce(partial));
    }

    @Property
    void maskingPartialSumsToEightBitsDoesNotChangeChecksum(@ForAll byte[] first, @ForAll byte[] second) {
        int plain = Checksum.sum(first, 0, first.length) + Checksum.sum(second, 0, second.length);
        int masked = (Checksum.sum(first, 0, first.length) & 0xFF) + Checksum.sum(second, 0, second.length);

        assertEquals(Checksum.reduce(plain), Checksum.reduce(masked));
    }
}
