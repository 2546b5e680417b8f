package com.largomodo.ksynth.k5000.sysex;

import java.util.Objects;
import java.util.Optional;

/**
 * Classification of a K5000 dump header.
 *
 * @param cardinality one patch or a block
 * @param kind        what the payload holds
 * @param bank        bank of a single patch dump, empty otherwise
 * @param subData     what follows the kind (and bank) bytes
 */
public record Dump(Cardinality cardinality, PatchKind kind, Optional<BankIdentifier> bank, SubData subData) {

    static final int FIXED_SIZE = 5;

    public Dump {
        Objects.requireNonNull(cardinality, "cardinality must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(bank, "bank must not be null");
        Objects.requireNonNull(subData, "subData must not be null");
        if (bank.isPresent() != (kind == PatchKind.SINGLE)) {
            throw new IllegalArgumentException("Only single dumps carry a bank: " + kind + " " + bank);
        }
    }

    static Dump single(Cardinality cardinality, BankIdentifier bank, SubData subData) {
        return new Dump(cardinality, PatchKind.SINGLE, Optional.of(bank), subData);
    }

    static Dump of(Cardinality cardinality, PatchKind kind, SubData subData) {
        return new Dump(cardinality, kind, Optional.empty(), subData);
    }

    /**
     * Header size in bytes, from the channel byte up to the patch data.
     */
    public int headerSize() {
        return FIXED_SIZE + (bank.isPresent() ? 1 : 0) + subData.size();
    }

    @Override
    public String toString() {
        return String.format("%s %s%s", cardinality, kind.displayName(),
                bank.map(b -> " bank " + b).orElse(""));
    }
}
