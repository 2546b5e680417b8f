package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.ParseError;
import com.largomodo.ksynth.core.SysexParseException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OscillatorTest {

    @Test
    void waveIsSplitIntoMsbAndLsb() {
        byte[] data = Oscillator.CODEC.encode(Oscillator.pcm(300));

        assertEquals(2, data[0]);
        assertEquals(44, data[1]);
        assertEquals(300, Oscillator.CODEC.decode(data).wave().value());
    }

    @Test
    void wave512SelectsAdditiveEngine() {
        byte[] data = Oscillator.CODEC.encode(Oscillator.additive());

        assertEquals(4, data[0]);
        assertEquals(0, data[1]);
        assertTrue(Oscillator.CODEC.decode(data).isAdditive());
        assertFalse(Oscillator.pcm(511).isAdditive());
    }

    @Test
    void msbAboveThreeBitsIsRangeError() {
        byte[] data = Oscillator.CODEC.encode(Oscillator.pcm(0));
        data[0] = 8;

        SysexParseException e = assertThrows(SysexParseException.class, () -> Oscillator.CODEC.decode(data));
        assertEquals(ParseError.RANGE, e.kind());
        assertEquals(8 << 7, e.actual());
    }

    @Test
    void coarseTuningIsBiasedBy24() {
        byte[] data = Oscillator.CODEC.encode(Oscillator.pcm(0));

        assertEquals(24, data[2]);
        assertEquals(64, data[3]);
    }
}
