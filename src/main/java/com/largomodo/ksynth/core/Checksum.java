package com.largomodo.ksynth.core;

/**
 * Additive block checksum shared by both dialects.
 * <p>
 * checksum = (sum of unsigned body bytes + 0xA5) mod 128. Dialect B kits sum
 * several sub-block sums before the final reduction, so the sum and the
 * reduction are exposed separately.
 */
public class Checksum {

    public static final int SALT = 0xA5;

    private Checksum() {
        // Static utility class - prevent instantiation
    }

    /**
     * Computes the checksum over {@code data[from..to)}.
     */
    public static int of(byte[] data, int from, int to) {
        return reduce(sum(data, from, to));
    }

    public static int of(byte[] data) {
        return of(data, 0, data.length);
    }

    /**
     * Sum of the unsigned bytes in {@code data[from..to)}.
     */
    public static int sum(byte[] data, int from, int to) {
        if (from < 0 || to > data.length || from > to) {
            throw new IndexOutOfBoundsException("Range [" + from + ", " + to + ") outside buffer of " + data.length);
        }
        int total = 0;
        for (int i = from; i < to; i++) {
            total += data[i] & 0xFF;
        }
        return total;
    }

    /**
     * Adds the salt to a precomputed sum and keeps the low seven bits.
     */
    public static int reduce(int sum) {
        return (sum + SALT) & 0x7F;
    }
}
