package com.largomodo.ksynth.core;

import java.util.Objects;

/**
 * A block whose stored checksum is not the one computed from its body.
 *
 * @param block    human-readable block description, e.g. "single A-1"
 * @param offset   offset of the checksum byte in the decoded buffer
 * @param expected checksum computed from the body
 * @param actual   checksum stored in the buffer
 */
public record ChecksumMismatch(String block, int offset, int expected, int actual) {

    public ChecksumMismatch {
        Objects.requireNonNull(block, "block must not be null");
    }

    @Override
    public String toString() {
        return String.format("Checksum mismatch in %s at offset %d: computed %02XH, stored %02XH",
                block, offset, expected, actual);
    }
}
