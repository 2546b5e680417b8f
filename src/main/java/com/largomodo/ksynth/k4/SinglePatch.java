package com.largomodo.ksynth.k4;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.Bits;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.Discriminants;
import com.largomodo.ksynth.core.SysexCodec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.BENDER_RANGE;
import static com.largomodo.ksynth.core.Category.DEPTH;
import static com.largomodo.ksynth.core.Category.EFFECT_NUMBER;
import static com.largomodo.ksynth.core.Category.LEVEL;

/**
 * A K4 single patch (131 bytes including the trailing checksum).
 * <p>
 * The 30 common bytes are followed by the four sources, the four amplifiers and
 * the two filters. Each of these groups is stored byte-interleaved: byte
 * {@code i} of source {@code k} sits at {@code 30 + 4 * i + k}.
 *
 * @param sourceMuted four flags, {@code true} when the source is muted. On the
 *                    wire a set bit means the source plays.
 */
public record SinglePatch(String name, BoundedValue volume, BoundedValue effect, Submix submix,
                          SourceMode sourceMode, PolyphonyMode polyphonyMode, boolean am12, boolean am34,
                          List<Boolean> sourceMuted, BoundedValue benderRange, WheelAssign wheelAssign,
                          BoundedValue wheelDepth, AutoBend autoBend, Vibrato vibrato, Lfo lfo,
                          BoundedValue pressureFrequency, List<Source> sources, List<Amplifier> amplifiers,
                          Filter filter1, Filter filter2) {

    public static final int NAME_LENGTH = 10;
    public static final int SOURCE_COUNT = 4;
    public static final int DATA_SIZE = 131;
    public static final SysexCodec<SinglePatch> CODEC =
            SysexCodec.of("K4 single", DATA_SIZE, SinglePatch::read, SinglePatch::write);

    public SinglePatch {
        name = checkName(name);
        require(volume, LEVEL, "volume");
        require(effect, EFFECT_NUMBER, "effect");
        Objects.requireNonNull(submix, "submix must not be null");
        Objects.requireNonNull(sourceMode, "sourceMode must not be null");
        Objects.requireNonNull(polyphonyMode, "polyphonyMode must not be null");
        sourceMuted = checkCount(sourceMuted, "sourceMuted");
        require(benderRange, BENDER_RANGE, "benderRange");
        Objects.requireNonNull(wheelAssign, "wheelAssign must not be null");
        require(wheelDepth, DEPTH, "wheelDepth");
        Objects.requireNonNull(autoBend, "autoBend must not be null");
        Objects.requireNonNull(vibrato, "vibrato must not be null");
        Objects.requireNonNull(lfo, "lfo must not be null");
        require(pressureFrequency, DEPTH, "pressureFrequency");
        sources = checkCount(sources, "sources");
        amplifiers = checkCount(amplifiers, "amplifiers");
        Objects.requireNonNull(filter1, "filter1 must not be null");
        Objects.requireNonNull(filter2, "filter2 must not be null");
    }

    public static SinglePatch defaults() {
        return new SinglePatch("NewSound", BoundedValue.of(LEVEL, 100), BoundedValue.of(EFFECT_NUMBER, 1),
                Submix.A, SourceMode.NORMAL, PolyphonyMode.POLY1, false, false,
                Collections.nCopies(SOURCE_COUNT, false), BoundedValue.zero(BENDER_RANGE), WheelAssign.DCF,
                BoundedValue.zero(DEPTH), AutoBend.defaults(), Vibrato.defaults(), Lfo.defaults(),
                BoundedValue.zero(DEPTH), Collections.nCopies(SOURCE_COUNT, Source.defaults()),
                Collections.nCopies(SOURCE_COUNT, Amplifier.defaults()), Filter.defaults(), Filter.defaults());
    }

    /**
     * Copy of this patch under another name.
     */
    public SinglePatch withName(String newName) {
        return new SinglePatch(newName, volume, effect, submix, sourceMode, polyphonyMode, am12, am34,
                sourceMuted, benderRange, wheelAssign, wheelDepth, autoBend, vibrato, lfo, pressureFrequency,
                sources, amplifiers, filter1, filter2);
    }

    public SinglePatch withVolume(int newVolume) {
        return new SinglePatch(name, BoundedValue.of(LEVEL, newVolume), effect, submix, sourceMode, polyphonyMode,
                am12, am34, sourceMuted, benderRange, wheelAssign, wheelDepth, autoBend, vibrato, lfo,
                pressureFrequency, sources, amplifiers, filter1, filter2);
    }

    /**
     * Source mute state as shown on the panel, e.g. {@code 1-3-} when sources 2 and 4 are muted.
     */
    public String sourceMuteString() {
        StringBuilder s = new StringBuilder(SOURCE_COUNT);
        for (int i = 0; i < SOURCE_COUNT; i++) {
            s.append(sourceMuted.get(i) ? '-' : (char) ('1' + i));
        }
        return s.toString();
    }

    public static SinglePatch read(ByteReader in) {
        int bodyStart = in.position();
        String name = in.readName("single name", NAME_LENGTH);
        BoundedValue volume = in.readValue(LEVEL);
        BoundedValue effect = BoundedValue.fromWireByte(EFFECT_NUMBER, Bits.field(in.readByte(), 0, 5));
        Submix submix = Discriminants.byOrdinal(Submix.values(), Bits.field(in.readByte(), 0, 3), "submix");

        int s13 = in.readByte();
        SourceMode sourceMode = Discriminants.byOrdinal(SourceMode.values(), Bits.field(s13, 0, 2), "source mode");
        PolyphonyMode polyphonyMode =
                Discriminants.byOrdinal(PolyphonyMode.values(), Bits.field(s13, 2, 2), "polyphony mode");
        boolean am12 = Bits.flag(s13, 4);
        boolean am34 = Bits.flag(s13, 5);

        int s14 = in.readByte();
        List<Boolean> muted = new ArrayList<>(SOURCE_COUNT);
        for (int i = 0; i < SOURCE_COUNT; i++) {
            muted.add(!Bits.flag(s14, i));
        }
        LfoShape vibratoShape = Discriminants.byOrdinal(LfoShape.values(), Bits.field(s14, 4, 2), "vibrato shape");

        int s15 = in.readByte();
        BoundedValue benderRange = BoundedValue.fromWireByte(BENDER_RANGE, Bits.field(s15, 0, 4));
        WheelAssign wheelAssign = Discriminants.byOrdinal(WheelAssign.values(), Bits.field(s15, 4, 2), "wheel assign");

        BoundedValue vibratoSpeed = in.readValue(LEVEL);
        BoundedValue wheelDepth = in.readValue(DEPTH);
        AutoBend autoBend = in.read(AutoBend.CODEC);
        BoundedValue vibratoPressure = in.readValue(DEPTH);
        BoundedValue vibratoDepth = in.readValue(DEPTH);
        Lfo lfo = in.read(Lfo.CODEC);
        BoundedValue pressureFrequency = in.readValue(DEPTH);

        List<Source> sources = in.readInterleaved(Source.CODEC, SOURCE_COUNT);
        List<Amplifier> amplifiers = in.readInterleaved(Amplifier.CODEC, SOURCE_COUNT);
        List<Filter> filters = in.readInterleaved(Filter.CODEC, 2);

        in.readChecksum("K4 single", bodyStart);
        in.context().blockDecoded("K4 single " + name.trim(), bodyStart);

        return new SinglePatch(name, volume, effect, submix, sourceMode, polyphonyMode, am12, am34, muted,
                benderRange, wheelAssign, wheelDepth, autoBend,
                new Vibrato(vibratoShape, vibratoSpeed, vibratoPressure, vibratoDepth), lfo, pressureFrequency,
                sources, amplifiers, filters.get(0), filters.get(1));
    }

    public void write(ByteWriter out) {
        int bodyStart = out.position();
        out.writeName(name, NAME_LENGTH);
        out.writeValue(volume);
        out.writeValue(effect);
        out.writeByte(submix.ordinal());

        int s13 = Bits.withField(sourceMode.ordinal(), 2, 2, polyphonyMode.ordinal());
        s13 = Bits.withFlag(s13, 4, am12);
        out.writeByte(Bits.withFlag(s13, 5, am34));

        int s14 = Bits.withField(0, 4, 2, vibrato.shape().ordinal());
        for (int i = 0; i < SOURCE_COUNT; i++) {
            s14 = Bits.withFlag(s14, i, !sourceMuted.get(i));
        }
        out.writeByte(s14);

        out.writeByte(Bits.withField(benderRange.toWireByte(), 4, 2, wheelAssign.ordinal()));
        out.writeValue(vibrato.speed());
        out.writeValue(wheelDepth);
        out.write(AutoBend.CODEC, autoBend);
        out.writeValue(vibrato.pressure());
        out.writeValue(vibrato.depth());
        out.write(Lfo.CODEC, lfo);
        out.writeValue(pressureFrequency);

        out.writeInterleaved(Source.CODEC, sources);
        out.writeInterleaved(Amplifier.CODEC, amplifiers);
        out.writeInterleaved(Filter.CODEC, List.of(filter1, filter2));

        out.writeChecksum(bodyStart);
    }

    @Override
    public String toString() {
        return String.format("%s volume=%s effect=%s submix=%s source mode=%s polyphony mode=%s "
                        + "AM1>2=%s AM3>4=%s sources=%s",
                name, volume, effect, submix, sourceMode, polyphonyMode,
                am12 ? "ON" : "OFF", am34 ? "ON" : "OFF", sourceMuteString());
    }

    /**
     * Validates a patch name and pads it with spaces to its wire width.
     */
    static String checkName(String name) {
        Objects.requireNonNull(name, "name must not be null");
        if (name.length() > NAME_LENGTH) {
            throw new IllegalArgumentException("Name longer than " + NAME_LENGTH + " characters: " + name);
        }
        if (!name.chars().allMatch(c -> c >= 0x20 && c <= 0x7E)) {
            throw new IllegalArgumentException("Name must be printable ASCII: " + name);
        }
        return String.format("%-" + NAME_LENGTH + "s", name);
    }

    private static <T> List<T> checkCount(List<T> values, String field) {
        Objects.requireNonNull(values, field + " must not be null");
        if (values.size() != SOURCE_COUNT) {
            throw new IllegalArgumentException(field + " must have " + SOURCE_COUNT + " entries, got "
                    + values.size());
        }
        return List.copyOf(values);
    }
}
