package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.SysexCodec;

import java.util.Objects;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.VELOCITY_CURVE;

/**
 * DCA of one source (15 bytes): velocity curve, envelope, key scaling and
 * velocity control of the envelope.
 */
public record Amplifier(BoundedValue velocityCurve, AmplifierEnvelope envelope, EnvelopeControl keyScaling,
                        EnvelopeControl velocity) {

    public static final int DATA_SIZE = 1 + AmplifierEnvelope.DATA_SIZE + 2 * EnvelopeControl.DATA_SIZE;
    public static final SysexCodec<Amplifier> CODEC =
            SysexCodec.of("K5000 amplifier", DATA_SIZE, Amplifier::read, Amplifier::write);

    public Amplifier {
        require(velocityCurve, VELOCITY_CURVE, "velocityCurve");
        Objects.requireNonNull(envelope, "envelope must not be null");
        Objects.requireNonNull(keyScaling, "keyScaling must not be null");
        Objects.requireNonNull(velocity, "velocity must not be null");
    }

    public static Amplifier defaults() {
        return new Amplifier(BoundedValue.of(VELOCITY_CURVE, 1), AmplifierEnvelope.defaults(),
                EnvelopeControl.defaults(), EnvelopeControl.defaults());
    }

    public static Amplifier read(ByteReader in) {
        BoundedValue velocityCurve = in.readValue(VELOCITY_CURVE);
        return new Amplifier(velocityCurve, in.read(AmplifierEnvelope.CODEC), in.read(EnvelopeControl.CODEC),
                in.read(EnvelopeControl.CODEC));
    }

    public void write(ByteWriter out) {
        out.writeValue(velocityCurve);
        out.write(AmplifierEnvelope.CODEC, envelope);
        out.write(EnvelopeControl.CODEC, keyScaling);
        out.write(EnvelopeControl.CODEC, velocity);
    }
}
