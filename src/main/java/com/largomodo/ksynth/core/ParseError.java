package com.largomodo.ksynth.core;

/**
 * Kinds of failure a decode can report.
 * <p>
 * Carried by {@link SysexParseException} so callers can branch on the kind
 * without parsing messages.
 */
public enum ParseError {
    /** A numeric value lies outside its category's bounds. */
    RANGE,
    /** A raw byte matches no variant of an enumerated field. */
    INVALID_DISCRIMINANT,
    /** Fewer bytes remain than the entity being decoded declares. */
    TOO_SHORT,
    /** A name field holds bytes that are not printable ASCII. */
    INVALID_TEXT,
    /** A stored checksum differs from the one computed over the block body. */
    CHECKSUM_MISMATCH,
    /** A dump header matches no dispatch rule. */
    UNIDENTIFIED,
    /** A collection inside a bank does not have the size its layout demands. */
    OFFSET_MISMATCH
}
