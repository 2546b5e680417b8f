package com.largomodo.ksynth.core;

/**
 * Observer interface for decode events.
 * <p>
 * All methods have default no-op implementations, allowing consumers to
 * override only the events they care about. A bank importer can, for example,
 * count mismatched blocks while still receiving the rest of the bank.
 *
 * @see SysexDecoder
 */
public interface DecodeObserver {

    DecodeObserver NONE = new DecodeObserver() {
    };

    /**
     * Called after a composite block has been decoded.
     *
     * @param block  description of the block
     * @param offset offset of the block in the decoded buffer
     */
    default void onBlockDecoded(String block, int offset) {}

    /**
     * Called when a stored checksum differs from the computed one, before the
     * checksum policy is applied.
     *
     * @param mismatch details of the failing block
     */
    default void onChecksumMismatch(ChecksumMismatch mismatch) {}
}
