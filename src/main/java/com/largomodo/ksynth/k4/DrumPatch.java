package com.largomodo.ksynth.k4;

import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.SysexCodec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The drum patch: a common block followed by 61 notes. The patch has no
 * checksum of its own; each part carries one.
 */
public record DrumPatch(DrumCommon common, List<DrumNote> notes) {

    public static final int NOTE_COUNT = 61;
    public static final int DATA_SIZE = DrumCommon.DATA_SIZE + NOTE_COUNT * DrumNote.DATA_SIZE;
    public static final SysexCodec<DrumPatch> CODEC =
            SysexCodec.of("K4 drum", DATA_SIZE, DrumPatch::read, DrumPatch::write);

    public DrumPatch {
        Objects.requireNonNull(common, "common must not be null");
        Objects.requireNonNull(notes, "notes must not be null");
        if (notes.size() != NOTE_COUNT) {
            throw new IllegalArgumentException("A drum patch has " + NOTE_COUNT + " notes, got " + notes.size());
        }
        notes = List.copyOf(notes);
    }

    public static DrumPatch defaults() {
        return new DrumPatch(DrumCommon.defaults(), Collections.nCopies(NOTE_COUNT, DrumNote.defaults()));
    }

    public static DrumPatch read(ByteReader in) {
        int start = in.position();
        DrumCommon common = in.read(DrumCommon.CODEC);
        List<DrumNote> notes = new ArrayList<>(NOTE_COUNT);
        for (int i = 0; i < NOTE_COUNT; i++) {
            notes.add(in.read(DrumNote.CODEC));
        }
        in.context().blockDecoded("K4 drum", start);
        return new DrumPatch(common, notes);
    }

    public void write(ByteWriter out) {
        out.write(DrumCommon.CODEC, common);
        for (DrumNote note : notes) {
            out.write(DrumNote.CODEC, note);
        }
    }
}
