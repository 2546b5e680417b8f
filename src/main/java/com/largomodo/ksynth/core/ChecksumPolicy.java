package com.largomodo.ksynth.core;

/**
 * What a decoder does when a stored checksum disagrees with the computed one.
 */
public enum ChecksumPolicy {
    /** Fail the decode with {@link ParseError#CHECKSUM_MISMATCH}. */
    STRICT,
    /** Report the mismatch, log it at WARN and keep decoding. */
    WARN,
    /** Report the mismatch without logging and keep decoding. */
    IGNORE
}
