package com.largomodo.ksynth.core;

/**
 * Validated mapping from raw bytes to enum constants.
 * <p>
 * Raw bytes come from untrusted dumps; a byte that names no constant is
 * reported as {@link ParseError#INVALID_DISCRIMINANT} rather than indexing
 * past the enum.
 */
public class Discriminants {

    private Discriminants() {
        // Static utility class - prevent instantiation
    }

    /**
     * Maps a raw byte to the constant with that ordinal.
     */
    public static <E extends Enum<E>> E byOrdinal(E[] values, int raw, String field) {
        if (raw < 0 || raw >= values.length) {
            throw SysexParseException.invalidDiscriminant(field, raw);
        }
        return values[raw];
    }

    /**
     * Maps a raw byte to the constant carrying that wire code.
     */
    public static <E extends Enum<E> & Coded> E byCode(E[] values, int raw, String field) {
        for (E value : values) {
            if (value.code() == raw) {
                return value;
            }
        }
        throw SysexParseException.invalidDiscriminant(field, raw);
    }
}
