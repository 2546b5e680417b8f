package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.Category;
import com.largomodo.ksynth.core.SysexCodec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Seven-band graphic EQ, each band ±6 stored around 64.
 */
public record Geq(List<BoundedValue> bands) {

    public static final int BAND_COUNT = 7;
    public static final SysexCodec<Geq> CODEC = SysexCodec.of("K5000 GEQ", BAND_COUNT, Geq::read, Geq::write);

    public Geq {
        Objects.requireNonNull(bands, "bands must not be null");
        if (bands.size() != BAND_COUNT) {
            throw new IllegalArgumentException("GEQ has " + BAND_COUNT + " bands, got " + bands.size());
        }
        for (BoundedValue band : bands) {
            BoundedValue.require(band, Category.GEQ_LEVEL, "band");
        }
        bands = List.copyOf(bands);
    }

    public static Geq flat() {
        return new Geq(Collections.nCopies(BAND_COUNT, BoundedValue.zero(Category.GEQ_LEVEL)));
    }

    public static Geq read(ByteReader in) {
        List<BoundedValue> bands = new ArrayList<>(BAND_COUNT);
        for (int i = 0; i < BAND_COUNT; i++) {
            bands.add(in.readValue(Category.GEQ_LEVEL));
        }
        return new Geq(bands);
    }

    public void write(ByteWriter out) {
        bands.forEach(out::writeValue);
    }
}
