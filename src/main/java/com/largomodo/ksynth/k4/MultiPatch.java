package com.largomodo.ksynth.k4;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.Bits;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.SysexCodec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.EFFECT_NUMBER;
import static com.largomodo.ksynth.core.Category.LEVEL;

/**
 * A K4 multi patch: name, volume, effect and eight sections (77 bytes
 * including the checksum).
 */
public record MultiPatch(String name, BoundedValue volume, BoundedValue effect, List<MultiSection> sections) {

    public static final int SECTION_COUNT = 8;
    public static final int DATA_SIZE = 77;
    public static final SysexCodec<MultiPatch> CODEC =
            SysexCodec.of("K4 multi", DATA_SIZE, MultiPatch::read, MultiPatch::write);

    public MultiPatch {
        name = SinglePatch.checkName(name);
        require(volume, LEVEL, "volume");
        require(effect, EFFECT_NUMBER, "effect");
        Objects.requireNonNull(sections, "sections must not be null");
        if (sections.size() != SECTION_COUNT) {
            throw new IllegalArgumentException("A multi has " + SECTION_COUNT + " sections, got " + sections.size());
        }
        sections = List.copyOf(sections);
    }

    public static MultiPatch defaults() {
        return new MultiPatch("NewMulti", BoundedValue.of(LEVEL, 100), BoundedValue.of(EFFECT_NUMBER, 1),
                Collections.nCopies(SECTION_COUNT, MultiSection.defaults()));
    }

    public static MultiPatch read(ByteReader in) {
        int bodyStart = in.position();
        String name = in.readName("multi name", SinglePatch.NAME_LENGTH);
        BoundedValue volume = in.readValue(LEVEL);
        BoundedValue effect = BoundedValue.fromWireByte(EFFECT_NUMBER, Bits.field(in.readByte(), 0, 5));
        List<MultiSection> sections = new ArrayList<>(SECTION_COUNT);
        for (int i = 0; i < SECTION_COUNT; i++) {
            sections.add(in.read(MultiSection.CODEC));
        }
        in.readChecksum("K4 multi", bodyStart);
        in.context().blockDecoded("K4 multi " + name.trim(), bodyStart);
        return new MultiPatch(name, volume, effect, sections);
    }

    public void write(ByteWriter out) {
        int bodyStart = out.position();
        out.writeName(name, SinglePatch.NAME_LENGTH);
        out.writeValue(volume);
        out.writeValue(effect);
        for (MultiSection section : sections) {
            out.write(MultiSection.CODEC, section);
        }
        out.writeChecksum(bodyStart);
    }
}
