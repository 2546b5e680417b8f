package com.largomodo.ksynth.k5000.sysex;

import com.largomodo.ksynth.core.Coded;

public enum PatchKind implements Coded {
    SINGLE(0x00, "Single"),
    MULTI(0x20, "Multi/Combi"),
    DRUM_KIT(0x10, "Drum Kit"),
    DRUM_INSTRUMENT(0x11, "Drum Instrument");

    private final int code;
    private final String displayName;

    PatchKind(int code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    @Override
    public int code() {
        return code;
    }

    public String displayName() {
        return displayName;
    }
}
