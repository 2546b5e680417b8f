package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.Discriminants;
import com.largomodo.ksynth.core.SysexCodec;
import com.largomodo.ksynth.core.SysexParseException;

import java.util.Objects;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.COARSE;
import static com.largomodo.ksynth.core.Category.KEY;
import static com.largomodo.ksynth.core.Category.SIGNED_LEVEL;
import static com.largomodo.ksynth.core.Category.WAVE_KIT;

/**
 * Oscillator of one source (12 bytes).
 * <p>
 * The 10-bit wave number is split into a 3-bit MSB and a 7-bit LSB. Wave
 * {@value #ADDITIVE_WAVE} selects the additive engine instead of a PCM wave,
 * and such a source carries an {@link AdditiveKit} after the source block.
 */
public record Oscillator(BoundedValue wave, BoundedValue coarse, BoundedValue fine, BoundedValue fixedKey,
                         KeyScalingToPitch keyScalingToPitch, PitchEnvelope pitchEnvelope) {

    public static final int DATA_SIZE = 12;
    public static final int ADDITIVE_WAVE = 512;
    public static final SysexCodec<Oscillator> CODEC =
            SysexCodec.of("K5000 oscillator", DATA_SIZE, Oscillator::read, Oscillator::write);

    public Oscillator {
        require(wave, WAVE_KIT, "wave");
        require(coarse, COARSE, "coarse");
        require(fine, SIGNED_LEVEL, "fine");
        require(fixedKey, KEY, "fixedKey");
        Objects.requireNonNull(keyScalingToPitch, "keyScalingToPitch must not be null");
        Objects.requireNonNull(pitchEnvelope, "pitchEnvelope must not be null");
    }

    public static Oscillator pcm(int wave) {
        return new Oscillator(BoundedValue.of(WAVE_KIT, wave), BoundedValue.zero(COARSE),
                BoundedValue.zero(SIGNED_LEVEL), BoundedValue.zero(KEY), KeyScalingToPitch.ZERO_CENT,
                PitchEnvelope.defaults());
    }

    public static Oscillator additive() {
        return pcm(ADDITIVE_WAVE);
    }

    public boolean isAdditive() {
        return wave.value() == ADDITIVE_WAVE;
    }

    public static Oscillator read(ByteReader in) {
        int msb = in.readByte();
        int lsb = in.readByte();
        if (msb > 0x07 || lsb > 0x7F) {
            throw SysexParseException.rangeError(WAVE_KIT, (msb << 7) + lsb);
        }
        BoundedValue wave = BoundedValue.of(WAVE_KIT, (msb << 7) | lsb);
        BoundedValue coarse = in.readValue(COARSE);
        BoundedValue fine = in.readValue(SIGNED_LEVEL);
        BoundedValue fixedKey = in.readValue(KEY);
        KeyScalingToPitch keyScaling =
                Discriminants.byOrdinal(KeyScalingToPitch.values(), in.readByte(), "key scaling to pitch");
        return new Oscillator(wave, coarse, fine, fixedKey, keyScaling, in.read(PitchEnvelope.CODEC));
    }

    public void write(ByteWriter out) {
        out.writeByte(wave.value() >> 7);
        out.writeByte(wave.value() & 0x7F);
        out.writeValue(coarse);
        out.writeValue(fine);
        out.writeValue(fixedKey);
        out.writeByte(keyScalingToPitch.ordinal());
        out.write(PitchEnvelope.CODEC, pitchEnvelope);
    }
}
