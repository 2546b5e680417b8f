package com.largomodo.ksynth.k4;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.SysexCodec;

import java.util.Objects;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.LEVEL;

/**
 * DCA settings of one source.
 *
 * @param level           output level 0-100
 * @param envelope        ADSR envelope
 * @param levelModulation velocity/pressure/key scaling to level
 * @param timeModulation  velocity/key scaling to envelope times
 */
public record Amplifier(BoundedValue level, Envelope envelope, LevelModulation levelModulation,
                        TimeModulation timeModulation) {

    public static final int DATA_SIZE = 11;
    public static final SysexCodec<Amplifier> CODEC =
            SysexCodec.of("K4 amplifier", DATA_SIZE, Amplifier::read, Amplifier::write);

    public Amplifier {
        require(level, LEVEL, "level");
        Objects.requireNonNull(envelope, "envelope must not be null");
        Objects.requireNonNull(levelModulation, "levelModulation must not be null");
        Objects.requireNonNull(timeModulation, "timeModulation must not be null");
    }

    public static Amplifier defaults() {
        return new Amplifier(BoundedValue.of(LEVEL, 75), Envelope.defaults(), LevelModulation.defaults(),
                TimeModulation.defaults());
    }

    public static Amplifier read(ByteReader in) {
        BoundedValue level = in.readValue(LEVEL);
        return new Amplifier(level, in.read(Envelope.CODEC), in.read(LevelModulation.CODEC),
                in.read(TimeModulation.CODEC));
    }

    public void write(ByteWriter out) {
        out.writeValue(level);
        out.write(Envelope.CODEC, envelope);
        out.write(LevelModulation.CODEC, levelModulation);
        out.write(TimeModulation.CODEC, timeModulation);
    }
}
