package com.largomodo.ksynth.k5000.sysex;

import com.largomodo.ksynth.core.Coded;

/**
 * Single patch banks. There is no bank C; bank B holds PCM-only patches.
 */
public enum BankIdentifier implements Coded {
    A(0x00),
    B(0x01),
    D(0x02),
    E(0x03),
    F(0x04);

    private final int code;

    BankIdentifier(int code) {
        this.code = code;
    }

    @Override
    public int code() {
        return code;
    }

    /**
     * Block dumps of every bank but B carry a tone map.
     */
    public boolean hasToneMap() {
        return this != B;
    }
}
