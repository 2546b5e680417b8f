package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.Discriminants;
import com.largomodo.ksynth.core.SysexCodec;

import java.util.Objects;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.UNSIGNED_LEVEL;

/**
 * LFO of one source (11 bytes): waveform, speed, delay onset, fade in time,
 * fade in to speed, then the vibrato, growl and tremolo controls.
 */
public record Lfo(LfoWaveform waveform, BoundedValue speed, BoundedValue delayOnset, BoundedValue fadeInTime,
                  BoundedValue fadeInToSpeed, LfoControl vibrato, LfoControl growl, LfoControl tremolo) {

    public static final int DATA_SIZE = 5 + 3 * LfoControl.DATA_SIZE;
    public static final SysexCodec<Lfo> CODEC = SysexCodec.of("K5000 LFO", DATA_SIZE, Lfo::read, Lfo::write);

    public Lfo {
        Objects.requireNonNull(waveform, "waveform must not be null");
        require(speed, UNSIGNED_LEVEL, "speed");
        require(delayOnset, UNSIGNED_LEVEL, "delayOnset");
        require(fadeInTime, UNSIGNED_LEVEL, "fadeInTime");
        require(fadeInToSpeed, UNSIGNED_LEVEL, "fadeInToSpeed");
        Objects.requireNonNull(vibrato, "vibrato must not be null");
        Objects.requireNonNull(growl, "growl must not be null");
        Objects.requireNonNull(tremolo, "tremolo must not be null");
    }

    public static Lfo defaults() {
        BoundedValue zero = BoundedValue.zero(UNSIGNED_LEVEL);
        return new Lfo(LfoWaveform.TRIANGLE, zero, zero, zero, zero, LfoControl.defaults(), LfoControl.defaults(),
                LfoControl.defaults());
    }

    public static Lfo read(ByteReader in) {
        LfoWaveform waveform = Discriminants.byOrdinal(LfoWaveform.values(), in.readByte(), "LFO waveform");
        BoundedValue speed = in.readValue(UNSIGNED_LEVEL);
        BoundedValue delayOnset = in.readValue(UNSIGNED_LEVEL);
        BoundedValue fadeInTime = in.readValue(UNSIGNED_LEVEL);
        BoundedValue fadeInToSpeed = in.readValue(UNSIGNED_LEVEL);
        return new Lfo(waveform, speed, delayOnset, fadeInTime, fadeInToSpeed, in.read(LfoControl.CODEC),
                in.read(LfoControl.CODEC), in.read(LfoControl.CODEC));
    }

    public void write(ByteWriter out) {
        out.writeByte(waveform.ordinal());
        out.writeValue(speed);
        out.writeValue(delayOnset);
        out.writeValue(fadeInTime);
        out.writeValue(fadeInToSpeed);
        out.write(LfoControl.CODEC, vibrato);
        out.write(LfoControl.CODEC, growl);
        out.write(LfoControl.CODEC, tremolo);
    }
}
