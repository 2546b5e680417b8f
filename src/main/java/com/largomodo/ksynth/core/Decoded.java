package com.largomodo.ksynth.core;

import java.util.List;
import java.util.Objects;

/**
 * Result of a decode call: the model plus any checksum mismatches that the
 * policy let through.
 */
public record Decoded<T>(T value, List<ChecksumMismatch> checksumMismatches) {

    public Decoded {
        Objects.requireNonNull(value, "value must not be null");
        checksumMismatches = List.copyOf(checksumMismatches);
    }

    public boolean isClean() {
        return checksumMismatches.isEmpty();
    }
}
