package com.largomodo.ksynth.core;

/**
 * Bit-field access for bytes shared by several parameters.
 * <p>
 * Fields are addressed by their lowest bit and width. Setting a field clears
 * only that field's bits, so unrelated fields packed in the same byte are left
 * untouched.
 */
public class Bits {

    private Bits() {
        // Static utility class - prevent instantiation
    }

    public static int field(int b, int shift, int width) {
        return (b >> shift) & mask(width);
    }

    /**
     * Returns {@code b} with {@code value} stored in the field at {@code shift}.
     *
     * @throws IllegalArgumentException if {@code value} does not fit the field
     */
    public static int withField(int b, int shift, int width, int value) {
        int mask = mask(width);
        if (value < 0 || value > mask) {
            throw new IllegalArgumentException("Value " + value + " does not fit in " + width + " bits");
        }
        return (b & ~(mask << shift)) | (value << shift);
    }

    public static boolean flag(int b, int bit) {
        return ((b >> bit) & 1) == 1;
    }

    public static int withFlag(int b, int bit, boolean set) {
        return set ? b | (1 << bit) : b & ~(1 << bit);
    }

    private static int mask(int width) {
        return (1 << width) - 1;
    }
}
