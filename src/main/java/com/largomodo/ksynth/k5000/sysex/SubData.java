package com.largomodo.ksynth.k5000.sysex;

import com.largomodo.ksynth.k5000.ToneMap;

/**
 * What follows the fixed part of a dump header.
 */
public enum SubData {
    NONE(0),
    PATCH_NUMBER(1),
    TONE_MAP(ToneMap.DATA_SIZE);

    private final int size;

    SubData(int size) {
        this.size = size;
    }

    public int size() {
        return size;
    }
}
