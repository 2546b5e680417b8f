package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.generators.PatchDataGenerator;
import net.jqwik.api.*;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HarmonicEnvelopeTest {

    @Test
    void bothDecayBitsMeanLoop1() {
        HarmonicEnvelope envelope = HarmonicEnvelope.CODEC.decode(
                new byte[]{10, 63, 20, 0x40 | 30, 30, 0x40 | 20, 40, 0});

        assertEquals(LoopType.LOOP1, envelope.loop());
        assertEquals(63, envelope.levels().get(0).value());
        assertEquals(30, envelope.levels().get(1).value());
        assertEquals(20, envelope.levels().get(2).value());
    }

    @Test
    void decay2BitAloneMeansLoop2() {
        HarmonicEnvelope envelope = HarmonicEnvelope.CODEC.decode(new byte[]{0, 0, 0, 5, 0, 0x40 | 5, 0, 0});

        assertEquals(LoopType.LOOP2, envelope.loop());
    }

    @Test
    void decay1BitWithoutDecay2IsNoLoop() {
        HarmonicEnvelope envelope = HarmonicEnvelope.CODEC.decode(new byte[]{0, 0, 0, 0x40 | 5, 0, 5, 0, 0});

        assertEquals(LoopType.OFF, envelope.loop());
        assertEquals(5, envelope.levels().get(1).value());
    }

    @Test
    void loopBitsAreWrittenIntoDecayLevels() {
        HarmonicEnvelope defaults = HarmonicEnvelope.defaults();
        HarmonicEnvelope looped = new HarmonicEnvelope(defaults.rates(), defaults.levels(), LoopType.LOOP2);

        byte[] data = HarmonicEnvelope.CODEC.encode(looped);

        assertEquals(0, data[3]);
        assertEquals(0x40, data[5]);
    }

    @Test
    void wrongSegmentCountIsRejected() {
        HarmonicEnvelope defaults = HarmonicEnvelope.defaults();

        assertThrows(IllegalArgumentException.class, () -> new HarmonicEnvelope(defaults.rates().subList(0, 3),
                defaults.levels(), LoopType.OFF));
    }

    @Property
    void decodingRestoresEncodedEnvelope(@ForAll("envelopes") HarmonicEnvelope envelope) {
        assertEquals(envelope, HarmonicEnvelope.CODEC.decode(HarmonicEnvelope.CODEC.encode(envelope)));
    }

    @Provide
    Arbitrary<HarmonicEnvelope> envelopes() {
        return PatchDataGenerator.harmonicEnvelopes();
    }
}
