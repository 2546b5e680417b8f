package com.largomodo.ksynth.core;

import java.util.Arrays;
import java.util.List;

/**
 * Growable byte sink used by encoders.
 * <p>
 * Mirrors {@link ByteReader}: values are written through their category bias,
 * names are padded to their declared width, and {@link #write(SysexCodec, Object)}
 * checks that an entity produced exactly its declared size.
 */
public class ByteWriter {

    private byte[] buffer;
    private int position;

    public ByteWriter() {
        this(64);
    }

    public ByteWriter(int initialCapacity) {
        this.buffer = new byte[Math.max(initialCapacity, 1)];
    }

    public int position() {
        return position;
    }

    public void writeByte(int value) {
        if (value < 0 || value > 0xFF) {
            throw new IllegalArgumentException("Byte value out of range: " + value);
        }
        ensureCapacity(1);
        buffer[position++] = (byte) value;
    }

    public void writeBytes(byte[] bytes) {
        ensureCapacity(bytes.length);
        System.arraycopy(bytes, 0, buffer, position, bytes.length);
        position += bytes.length;
    }

    public void writeZeros(int count) {
        ensureCapacity(count);
        Arrays.fill(buffer, position, position + count, (byte) 0);
        position += count;
    }

    public void writeValue(BoundedValue value) {
        writeByte(value.toWireByte());
    }

    public void writeFlag(boolean flag) {
        writeByte(flag ? 1 : 0);
    }

    /**
     * Writes {@code name} as ASCII, truncated or padded with spaces to {@code width}.
     */
    public void writeName(String name, int width) {
        for (int i = 0; i < width; i++) {
            char c = i < name.length() ? name.charAt(i) : ' ';
            if (c < 0x20 || c > 0x7E) {
                throw new IllegalArgumentException("Name contains non-ASCII character: " + name);
            }
            writeByte(c);
        }
    }

    /**
     * Encodes one entity and checks that it wrote exactly its declared size.
     */
    public <T> void write(SysexCodec<T> codec, T value) {
        int start = position;
        codec.write(value, this);
        int written = position - start;
        if (written != codec.declaredSize()) {
            throw new IllegalStateException(codec + " wrote " + written
                    + " bytes, declared " + codec.declaredSize());
        }
    }

    /**
     * Encodes each value separately and writes them byte-interleaved, the
     * inverse of {@link ByteReader#readInterleaved(SysexCodec, int)}.
     */
    public <T> void writeInterleaved(SysexCodec<T> codec, List<T> values) {
        byte[][] blocks = new byte[values.size()][];
        for (int k = 0; k < blocks.length; k++) {
            ByteWriter block = new ByteWriter(codec.declaredSize());
            block.write(codec, values.get(k));
            blocks[k] = block.toByteArray();
        }
        writeBytes(Interleave.join(blocks));
    }

    /**
     * Appends the checksum of {@code [bodyStart, position)}.
     */
    public void writeChecksum(int bodyStart) {
        writeByte(Checksum.of(buffer, bodyStart, position));
    }

    /**
     * Fills a leading checksum placeholder at {@code offset} with the checksum of {@code [from, to)}.
     */
    public void writeLeadingChecksum(int offset, int from, int to) {
        setByte(offset, Checksum.of(buffer, from, to));
    }

    /**
     * Overwrites an already written byte, e.g. a leading checksum placeholder.
     */
    public void setByte(int offset, int value) {
        if (offset < 0 || offset >= position) {
            throw new IndexOutOfBoundsException("Offset " + offset + " not yet written");
        }
        buffer[offset] = (byte) value;
    }

    public byte[] toByteArray() {
        return Arrays.copyOf(buffer, position);
    }

    private void ensureCapacity(int extra) {
        if (position + extra > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(buffer.length * 2, position + extra));
        }
    }
}
