package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.Bits;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.SysexCodec;

import java.util.BitSet;
import java.util.stream.IntStream;

/**
 * Which of the 128 patch slots a block single dump carries. Packed seven
 * flags per byte, least significant bit first, in 19 bytes.
 */
public final class ToneMap {

    public static final int TONE_COUNT = 128;
    public static final int DATA_SIZE = 19;
    public static final SysexCodec<ToneMap> CODEC =
            SysexCodec.of("K5000 tone map", DATA_SIZE, ToneMap::read, ToneMap::write);

    private static final int BITS_PER_BYTE = 7;

    private final BitSet tones;

    private ToneMap(BitSet tones) {
        this.tones = tones;
    }

    public static ToneMap empty() {
        return new ToneMap(new BitSet(TONE_COUNT));
    }

    /**
     * All 128 slots, as implied by a block dump without a tone map.
     */
    public static ToneMap full() {
        BitSet tones = new BitSet(TONE_COUNT);
        tones.set(0, TONE_COUNT);
        return new ToneMap(tones);
    }

    public static ToneMap of(int... included) {
        BitSet tones = new BitSet(TONE_COUNT);
        for (int tone : included) {
            checkTone(tone);
            tones.set(tone);
        }
        return new ToneMap(tones);
    }

    public boolean includes(int tone) {
        checkTone(tone);
        return tones.get(tone);
    }

    public ToneMap with(int tone) {
        checkTone(tone);
        BitSet copy = (BitSet) tones.clone();
        copy.set(tone);
        return new ToneMap(copy);
    }

    public int count() {
        return tones.cardinality();
    }

    /**
     * Included slots in ascending order.
     */
    public IntStream stream() {
        return tones.stream();
    }

    public static ToneMap read(ByteReader in) {
        BitSet tones = new BitSet(TONE_COUNT);
        for (int i = 0; i < DATA_SIZE; i++) {
            int b = in.readByte();
            for (int bit = 0; bit < BITS_PER_BYTE; bit++) {
                int tone = i * BITS_PER_BYTE + bit;
                if (tone < TONE_COUNT && Bits.flag(b, bit)) {
                    tones.set(tone);
                }
            }
        }
        return new ToneMap(tones);
    }

    public void write(ByteWriter out) {
        for (int i = 0; i < DATA_SIZE; i++) {
            int b = 0;
            for (int bit = 0; bit < BITS_PER_BYTE; bit++) {
                int tone = i * BITS_PER_BYTE + bit;
                if (tone < TONE_COUNT) {
                    b = Bits.withFlag(b, bit, tones.get(tone));
                }
            }
            out.writeByte(b);
        }
    }

    private static void checkTone(int tone) {
        if (tone < 0 || tone >= TONE_COUNT) {
            throw new IllegalArgumentException("Tone " + tone + " outside [0, " + (TONE_COUNT - 1) + "]");
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ToneMap other && tones.equals(other.tones);
    }

    @Override
    public int hashCode() {
        return tones.hashCode();
    }

    @Override
    public String toString() {
        return tones.toString();
    }
}
