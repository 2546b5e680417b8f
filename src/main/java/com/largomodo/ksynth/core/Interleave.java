package com.largomodo.ksynth.core;

/**
 * Stride gather/scatter for byte-multiplexed parallel blocks.
 * <p>
 * Some composites store N parallel sub-blocks byte by byte instead of one after
 * the other: byte {@code i} of sub-block {@code k} sits at
 * {@code offset + i * N + k}. Decoders gather each sub-block with
 * {@link #gather}; encoders put them back with {@link #scatter} using the same
 * stride, so both directions share one index formula.
 * <p>
 * Pure functions with no state. Safe for concurrent use.
 */
public class Interleave {

    private Interleave() {
        // Static utility class - prevent instantiation
    }

    /**
     * Collects every {@code stride}-th byte starting at {@code offset + start}.
     *
     * @param src    buffer holding the interleaved region
     * @param offset first byte of the interleaved region
     * @param stride number of interleaved sub-blocks
     * @param start  index of the sub-block to collect (0-based, less than stride)
     * @param count  number of bytes in one sub-block
     * @return the de-interleaved sub-block
     */
    public static byte[] gather(byte[] src, int offset, int stride, int start, int count) {
        checkGeometry(src.length, offset, stride, start, count);
        byte[] dest = new byte[count];
        for (int i = 0; i < count; i++) {
            dest[i] = src[offset + i * stride + start];
        }
        return dest;
    }

    /**
     * Inverse of {@link #gather}: writes {@code block} to every {@code stride}-th
     * byte of {@code dest} starting at {@code offset + start}.
     */
    public static void scatter(byte[] block, byte[] dest, int offset, int stride, int start) {
        checkGeometry(dest.length, offset, stride, start, block.length);
        for (int i = 0; i < block.length; i++) {
            dest[offset + i * stride + start] = block[i];
        }
    }

    /**
     * Splits an interleaved region of {@code ways * blockSize} bytes into its sub-blocks.
     */
    public static byte[][] split(byte[] src, int offset, int ways, int blockSize) {
        byte[][] blocks = new byte[ways][];
        for (int k = 0; k < ways; k++) {
            blocks[k] = gather(src, offset, ways, k, blockSize);
        }
        return blocks;
    }

    /**
     * Joins equally sized sub-blocks into one interleaved region.
     */
    public static byte[] join(byte[][] blocks) {
        int ways = blocks.length;
        int blockSize = ways == 0 ? 0 : blocks[0].length;
        byte[] dest = new byte[ways * blockSize];
        for (int k = 0; k < ways; k++) {
            if (blocks[k].length != blockSize) {
                throw new IllegalArgumentException("Sub-block " + k + " has " + blocks[k].length
                        + " bytes, expected " + blockSize);
            }
            scatter(blocks[k], dest, 0, ways, k);
        }
        return dest;
    }

    private static void checkGeometry(int length, int offset, int stride, int start, int count) {
        if (stride <= 0 || start < 0 || start >= stride) {
            throw new IllegalArgumentException("Invalid stride " + stride + " with start " + start);
        }
        int last = offset + (count - 1) * stride + start;
        if (offset < 0 || (count > 0 && last >= length)) {
            throw new IndexOutOfBoundsException("Interleaved region ending at " + last
                    + " exceeds buffer of " + length + " bytes");
        }
    }
}
