package com.largomodo.ksynth.core;

/**
 * Thrown when a System Exclusive buffer cannot be turned into a model.
 * <p>
 * RuntimeException keeps decoder signatures free of checked exceptions; composite
 * decoders let it propagate so the first failing sub-block aborts the whole decode.
 * The {@link ParseError} kind and, where meaningful, the expected and actual
 * values are exposed for callers that react to specific failures.
 */
public class SysexParseException extends RuntimeException {

    /** Marker for {@link #expected()} and {@link #actual()} when the kind has no such values. */
    public static final int NOT_APPLICABLE = -1;

    private final ParseError kind;
    private final int expected;
    private final int actual;

    public SysexParseException(ParseError kind, String message) {
        this(kind, message, NOT_APPLICABLE, NOT_APPLICABLE);
    }

    public SysexParseException(ParseError kind, String message, int expected, int actual) {
        super(message);
        this.kind = kind;
        this.expected = expected;
        this.actual = actual;
    }

    /**
     * Constructs exception with message and underlying cause.
     */
    public SysexParseException(ParseError kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.expected = NOT_APPLICABLE;
        this.actual = NOT_APPLICABLE;
    }

    public static SysexParseException rangeError(Category category, int value) {
        return new SysexParseException(ParseError.RANGE,
                String.format("%s value %d outside [%d, %d]", category, value, category.min(), category.max()),
                NOT_APPLICABLE, value);
    }

    public static SysexParseException invalidDiscriminant(String field, int rawByte) {
        return new SysexParseException(ParseError.INVALID_DISCRIMINANT,
                String.format("Invalid %s byte 0x%02X", field, rawByte),
                NOT_APPLICABLE, rawByte);
    }

    public static SysexParseException tooShort(int expected, int actual) {
        return new SysexParseException(ParseError.TOO_SHORT,
                "Got " + actual + " bytes of data, expected " + expected + " bytes",
                expected, actual);
    }

    public static SysexParseException invalidText(String field, int offset, int rawByte) {
        return new SysexParseException(ParseError.INVALID_TEXT,
                String.format("Invalid character 0x%02X in %s at offset %d", rawByte, field, offset),
                NOT_APPLICABLE, rawByte);
    }

    public static SysexParseException checksumMismatch(ChecksumMismatch mismatch) {
        return new SysexParseException(ParseError.CHECKSUM_MISMATCH,
                mismatch.toString(), mismatch.expected(), mismatch.actual());
    }

    public static SysexParseException unidentified(String detail) {
        return new SysexParseException(ParseError.UNIDENTIFIED,
                "Unable to identify dump: " + detail);
    }

    public static SysexParseException offsetMismatch(String collection, int expected, int actual) {
        return new SysexParseException(ParseError.OFFSET_MISMATCH,
                collection + " ends at offset " + actual + ", expected " + expected,
                expected, actual);
    }

    public ParseError kind() {
        return kind;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }
}
