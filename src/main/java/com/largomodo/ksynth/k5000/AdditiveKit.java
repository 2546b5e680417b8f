package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.SysexCodec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.UNSIGNED_LEVEL;

/**
 * Harmonic data of one ADD source (806 bytes).
 * <p>
 * Layout: checksum; harmonic common; MORF harmonic; formant filter; 64 soft
 * and 64 loud harmonic levels; 128 formant filter bands; 64 harmonic
 * envelopes; loud sense select. The checksum covers every byte after it.
 */
public record AdditiveKit(HarmonicCommon common, MorfHarmonic morf, FormantFilter formantFilter,
                          List<BoundedValue> softLevels, List<BoundedValue> loudLevels, List<BoundedValue> bands,
                          List<HarmonicEnvelope> envelopes, BoundedValue loudSenseSelect) {

    public static final int HARMONIC_COUNT = 64;
    public static final int BAND_COUNT = 128;
    public static final int DATA_SIZE = 1 + HarmonicCommon.DATA_SIZE + MorfHarmonic.DATA_SIZE
            + FormantFilter.DATA_SIZE + 2 * HARMONIC_COUNT + BAND_COUNT
            + HARMONIC_COUNT * HarmonicEnvelope.DATA_SIZE + 1;
    public static final SysexCodec<AdditiveKit> CODEC =
            SysexCodec.of("K5000 additive kit", DATA_SIZE, AdditiveKit::read, AdditiveKit::write);

    public AdditiveKit {
        Objects.requireNonNull(common, "common must not be null");
        Objects.requireNonNull(morf, "morf must not be null");
        Objects.requireNonNull(formantFilter, "formantFilter must not be null");
        softLevels = checkLevels(softLevels, HARMONIC_COUNT, "softLevels");
        loudLevels = checkLevels(loudLevels, HARMONIC_COUNT, "loudLevels");
        bands = checkLevels(bands, BAND_COUNT, "bands");
        Objects.requireNonNull(envelopes, "envelopes must not be null");
        if (envelopes.size() != HARMONIC_COUNT) {
            throw new IllegalArgumentException("envelopes must have " + HARMONIC_COUNT + " entries, got "
                    + envelopes.size());
        }
        envelopes = List.copyOf(envelopes);
        require(loudSenseSelect, UNSIGNED_LEVEL, "loudSenseSelect");
    }

    public static AdditiveKit defaults() {
        List<BoundedValue> soft = new ArrayList<>(Collections.nCopies(HARMONIC_COUNT, BoundedValue.zero(UNSIGNED_LEVEL)));
        soft.set(0, BoundedValue.of(UNSIGNED_LEVEL, 127));
        return new AdditiveKit(HarmonicCommon.defaults(), MorfHarmonic.defaults(), FormantFilter.defaults(), soft,
                soft, Collections.nCopies(BAND_COUNT, BoundedValue.of(UNSIGNED_LEVEL, 127)),
                Collections.nCopies(HARMONIC_COUNT, HarmonicEnvelope.defaults()), BoundedValue.zero(UNSIGNED_LEVEL));
    }

    public static AdditiveKit read(ByteReader in) {
        int checksumOffset = in.position();
        in.skip(1);
        int bodyStart = in.position();
        HarmonicCommon common = in.read(HarmonicCommon.CODEC);
        MorfHarmonic morf = in.read(MorfHarmonic.CODEC);
        FormantFilter formantFilter = in.read(FormantFilter.CODEC);
        List<BoundedValue> soft = readLevels(in, HARMONIC_COUNT);
        List<BoundedValue> loud = readLevels(in, HARMONIC_COUNT);
        List<BoundedValue> bands = readLevels(in, BAND_COUNT);
        List<HarmonicEnvelope> envelopes = new ArrayList<>(HARMONIC_COUNT);
        for (int i = 0; i < HARMONIC_COUNT; i++) {
            envelopes.add(in.read(HarmonicEnvelope.CODEC));
        }
        BoundedValue loudSenseSelect = in.readValue(UNSIGNED_LEVEL);
        in.verifyLeadingChecksum("K5000 additive kit", checksumOffset, bodyStart, in.position());
        in.context().blockDecoded("K5000 additive kit", checksumOffset);
        return new AdditiveKit(common, morf, formantFilter, soft, loud, bands, envelopes, loudSenseSelect);
    }

    public void write(ByteWriter out) {
        int checksumOffset = out.position();
        out.writeByte(0);
        int bodyStart = out.position();
        out.write(HarmonicCommon.CODEC, common);
        out.write(MorfHarmonic.CODEC, morf);
        out.write(FormantFilter.CODEC, formantFilter);
        softLevels.forEach(out::writeValue);
        loudLevels.forEach(out::writeValue);
        bands.forEach(out::writeValue);
        envelopes.forEach(envelope -> out.write(HarmonicEnvelope.CODEC, envelope));
        out.writeValue(loudSenseSelect);
        out.writeLeadingChecksum(checksumOffset, bodyStart, out.position());
    }

    private static List<BoundedValue> readLevels(ByteReader in, int count) {
        List<BoundedValue> levels = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            levels.add(in.readValue(UNSIGNED_LEVEL));
        }
        return levels;
    }

    private static List<BoundedValue> checkLevels(List<BoundedValue> levels, int count, String field) {
        Objects.requireNonNull(levels, field + " must not be null");
        if (levels.size() != count) {
            throw new IllegalArgumentException(field + " must have " + count + " entries, got " + levels.size());
        }
        levels.forEach(level -> require(level, UNSIGNED_LEVEL, field));
        return List.copyOf(levels);
    }
}
