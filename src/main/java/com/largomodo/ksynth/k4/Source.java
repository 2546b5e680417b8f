package com.largomodo.ksynth.k4;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.Bits;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.SysexCodec;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.COARSE;
import static com.largomodo.ksynth.core.Category.CURVE;
import static com.largomodo.ksynth.core.Category.DEPTH;
import static com.largomodo.ksynth.core.Category.KEY;
import static com.largomodo.ksynth.core.Category.LEVEL;
import static com.largomodo.ksynth.core.Category.WAVE_NUMBER;

/**
 * DCO settings of one source (7 bytes).
 * <p>
 * Layout: delay; wave high bit (bit 0) with key scaling curve (bits 4-6); wave
 * low bits; coarse (bits 0-5) with key track (bit 6); fixed key; fine;
 * pressure-to-frequency (bit 0), vibrato/auto bend (bit 1) and velocity curve
 * (bits 2-4). The fixed key is kept even while key tracking is on, so a dump
 * re-encodes byte for byte.
 */
public record Source(BoundedValue delay, BoundedValue wave, BoundedValue keyScalingCurve, BoundedValue coarse,
                     boolean keyTrack, BoundedValue fixedKey, BoundedValue fine, boolean pressureFrequency,
                     boolean vibrato, BoundedValue velocityCurve) {

    public static final int DATA_SIZE = 7;
    public static final SysexCodec<Source> CODEC = SysexCodec.of("K4 source", DATA_SIZE, Source::read, Source::write);

    public Source {
        require(delay, LEVEL, "delay");
        require(wave, WAVE_NUMBER, "wave");
        require(keyScalingCurve, CURVE, "keyScalingCurve");
        require(coarse, COARSE, "coarse");
        require(fixedKey, KEY, "fixedKey");
        require(fine, DEPTH, "fine");
        require(velocityCurve, CURVE, "velocityCurve");
    }

    public static Source defaults() {
        return new Source(BoundedValue.zero(LEVEL), BoundedValue.zero(WAVE_NUMBER), BoundedValue.zero(CURVE),
                BoundedValue.zero(COARSE), true, BoundedValue.of(KEY, 60), BoundedValue.zero(DEPTH),
                false, true, BoundedValue.zero(CURVE));
    }

    /**
     * Copy of this source playing another wave.
     */
    public Source withWave(int waveNumber) {
        return new Source(delay, BoundedValue.of(WAVE_NUMBER, waveNumber), keyScalingCurve, coarse, keyTrack,
                fixedKey, fine, pressureFrequency, vibrato, velocityCurve);
    }

    public String waveName() {
        return Wave.name(wave);
    }

    public static Source read(ByteReader in) {
        BoundedValue delay = in.readValue(LEVEL);
        int s1 = in.readByte();
        int s2 = in.readByte();
        BoundedValue wave = Wave.fromWire(Bits.field(s1, 0, 1), s2);
        BoundedValue ksCurve = BoundedValue.fromWireByte(CURVE, Bits.field(s1, 4, 3));
        int s3 = in.readByte();
        BoundedValue coarse = BoundedValue.fromWireByte(COARSE, Bits.field(s3, 0, 6));
        boolean keyTrack = Bits.flag(s3, 6);
        BoundedValue fixedKey = in.readValue(KEY);
        BoundedValue fine = in.readValue(DEPTH);
        int s6 = in.readByte();
        return new Source(delay, wave, ksCurve, coarse, keyTrack, fixedKey, fine,
                Bits.flag(s6, 0), Bits.flag(s6, 1),
                BoundedValue.fromWireByte(CURVE, Bits.field(s6, 2, 3)));
    }

    public void write(ByteWriter out) {
        out.writeValue(delay);
        out.writeByte(Bits.withField(Wave.highBit(wave), 4, 3, keyScalingCurve.toWireByte()));
        out.writeByte(Wave.lowBits(wave));
        out.writeByte(Bits.withFlag(coarse.toWireByte(), 6, keyTrack));
        out.writeValue(fixedKey);
        out.writeValue(fine);
        int s6 = Bits.withFlag(0, 0, pressureFrequency);
        s6 = Bits.withFlag(s6, 1, vibrato);
        out.writeByte(Bits.withField(s6, 2, 3, velocityCurve.toWireByte()));
    }
}
