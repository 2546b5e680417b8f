package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.Bits;
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
 * K5000 multi (combi) patch, 99 bytes.
 * <p>
 * Layout: checksum; effects; GEQ; name; volume; section mute bits (bit set =
 * section muted); effect control; four sections. The checksum covers every
 * byte after it.
 */
public record MultiPatch(EffectSettings effects, Geq geq, String name, BoundedValue volume,
                         List<Boolean> sectionMuted, EffectControl effectControl, List<MultiSection> sections) {

    public static final int SECTION_COUNT = 4;
    /** Multis in a block multi dump. */
    public static final int BLOCK_COUNT = 64;
    public static final int DATA_SIZE = 1 + EffectSettings.DATA_SIZE + Geq.BAND_COUNT + Common.NAME_LENGTH + 2
            + EffectControl.DATA_SIZE + SECTION_COUNT * MultiSection.DATA_SIZE;
    public static final SysexCodec<MultiPatch> CODEC =
            SysexCodec.of("K5000 multi", DATA_SIZE, MultiPatch::read, MultiPatch::write);

    public MultiPatch {
        Objects.requireNonNull(effects, "effects must not be null");
        Objects.requireNonNull(geq, "geq must not be null");
        name = Common.checkName(name);
        require(volume, UNSIGNED_LEVEL, "volume");
        Objects.requireNonNull(sectionMuted, "sectionMuted must not be null");
        Objects.requireNonNull(sections, "sections must not be null");
        if (sectionMuted.size() != SECTION_COUNT || sections.size() != SECTION_COUNT) {
            throw new IllegalArgumentException("Multi needs " + SECTION_COUNT + " sections");
        }
        sectionMuted = List.copyOf(sectionMuted);
        Objects.requireNonNull(effectControl, "effectControl must not be null");
        sections = List.copyOf(sections);
    }

    public static MultiPatch defaults() {
        return new MultiPatch(EffectSettings.defaults(), Geq.flat(), "NewMulti", BoundedValue.of(UNSIGNED_LEVEL, 127),
                Collections.nCopies(SECTION_COUNT, false), EffectControl.defaults(),
                Collections.nCopies(SECTION_COUNT, MultiSection.defaults()));
    }

    public static MultiPatch read(ByteReader in) {
        int checksumOffset = in.position();
        in.skip(1);
        int bodyStart = in.position();
        EffectSettings effects = in.read(EffectSettings.CODEC);
        Geq geq = in.read(Geq.CODEC);
        String name = in.readName("K5000 multi name", Common.NAME_LENGTH);
        BoundedValue volume = in.readValue(UNSIGNED_LEVEL);
        int mutes = in.readByte();
        List<Boolean> sectionMuted = new ArrayList<>(SECTION_COUNT);
        for (int i = 0; i < SECTION_COUNT; i++) {
            sectionMuted.add(Bits.flag(mutes, i));
        }
        EffectControl effectControl = in.read(EffectControl.CODEC);
        List<MultiSection> sections = new ArrayList<>(SECTION_COUNT);
        for (int i = 0; i < SECTION_COUNT; i++) {
            sections.add(in.read(MultiSection.CODEC));
        }
        in.verifyLeadingChecksum("K5000 multi", checksumOffset, bodyStart, in.position());
        in.context().blockDecoded("K5000 multi " + name.trim(), checksumOffset);
        return new MultiPatch(effects, geq, name, volume, sectionMuted, effectControl, sections);
    }

    public void write(ByteWriter out) {
        int checksumOffset = out.position();
        out.writeByte(0);
        int bodyStart = out.position();
        out.write(EffectSettings.CODEC, effects);
        out.write(Geq.CODEC, geq);
        out.writeName(name, Common.NAME_LENGTH);
        out.writeValue(volume);
        int mutes = 0;
        for (int i = 0; i < SECTION_COUNT; i++) {
            mutes = Bits.withFlag(mutes, i, sectionMuted.get(i));
        }
        out.writeByte(mutes);
        out.write(EffectControl.CODEC, effectControl);
        sections.forEach(section -> out.write(MultiSection.CODEC, section));
        out.writeLeadingChecksum(checksumOffset, bodyStart, out.position());
    }
}
