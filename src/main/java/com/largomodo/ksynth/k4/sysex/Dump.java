package com.largomodo.ksynth.k4.sysex;

import com.largomodo.ksynth.core.Locality;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Classification of a K4 message.
 *
 * @param kind          what the payload holds
 * @param locality      internal memory or card
 * @param number        0-based patch number within its collection, for one-patch dumps
 * @param payloadOffset offset of the patch data from the start of the header
 */
public record Dump(DumpKind kind, Locality locality, OptionalInt number, int payloadOffset) {

    public Dump {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(locality, "locality must not be null");
        Objects.requireNonNull(number, "number must not be null");
    }

    static Dump of(DumpKind kind, Locality locality) {
        return new Dump(kind, locality, OptionalInt.empty(), Header.DATA_SIZE);
    }

    static Dump of(DumpKind kind, Locality locality, int number) {
        return new Dump(kind, locality, OptionalInt.of(number), Header.DATA_SIZE);
    }

    @Override
    public String toString() {
        return number.isPresent()
                ? String.format("%s %s #%d", locality.label(), kind, number.getAsInt())
                : String.format("%s %s", locality.label(), kind);
    }
}
