package com.largomodo.ksynth.k5000.sysex;

import com.largomodo.ksynth.core.Coded;

/**
 * Whether a dump carries one patch or a block of patches. The codes are the
 * dump function codes.
 */
public enum Cardinality implements Coded {
    ONE(Function.ONE_BLOCK_DUMP),
    BLOCK(Function.ALL_BLOCK_DUMP);

    private final Function function;

    Cardinality(Function function) {
        this.function = function;
    }

    @Override
    public int code() {
        return function.code();
    }

    public Function function() {
        return function;
    }
}
