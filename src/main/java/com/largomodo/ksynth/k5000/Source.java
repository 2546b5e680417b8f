package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.SysexCodec;

import java.util.Objects;

/**
 * One source of a single patch (86 bytes), in wire order control, oscillator,
 * filter, amplifier, LFO.
 */
public record Source(SourceControl control, Oscillator oscillator, Filter filter, Amplifier amplifier, Lfo lfo) {

    public static final int DATA_SIZE = SourceControl.DATA_SIZE + Oscillator.DATA_SIZE + Filter.DATA_SIZE
            + Amplifier.DATA_SIZE + Lfo.DATA_SIZE;
    public static final SysexCodec<Source> CODEC = SysexCodec.of("K5000 source", DATA_SIZE, Source::read, Source::write);

    public Source {
        Objects.requireNonNull(control, "control must not be null");
        Objects.requireNonNull(oscillator, "oscillator must not be null");
        Objects.requireNonNull(filter, "filter must not be null");
        Objects.requireNonNull(amplifier, "amplifier must not be null");
        Objects.requireNonNull(lfo, "lfo must not be null");
    }

    /**
     * PCM source playing the given wave.
     */
    public static Source pcm(int wave) {
        return new Source(SourceControl.defaults(), Oscillator.pcm(wave), Filter.defaults(), Amplifier.defaults(),
                Lfo.defaults());
    }

    public static Source additive() {
        return new Source(SourceControl.defaults(), Oscillator.additive(), Filter.defaults(), Amplifier.defaults(),
                Lfo.defaults());
    }

    public boolean isAdditive() {
        return oscillator.isAdditive();
    }

    public static Source read(ByteReader in) {
        return new Source(in.read(SourceControl.CODEC), in.read(Oscillator.CODEC), in.read(Filter.CODEC),
                in.read(Amplifier.CODEC), in.read(Lfo.CODEC));
    }

    public void write(ByteWriter out) {
        out.write(SourceControl.CODEC, control);
        out.write(Oscillator.CODEC, oscillator);
        out.write(Filter.CODEC, filter);
        out.write(Amplifier.CODEC, amplifier);
        out.write(Lfo.CODEC, lfo);
    }
}
