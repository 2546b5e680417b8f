package com.largomodo.ksynth.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Forward-only cursor over a region of a dump buffer.
 * <p>
 * Every read is bounds-checked and fails with {@link ParseError#TOO_SHORT}
 * instead of running off the region. {@link #read(SysexCodec)} hands each
 * entity a slice of exactly its declared size, so no entity can read into its
 * neighbour, and checks afterwards that the slice was fully consumed.
 * <p>
 * Offsets reported by {@link #position()} are absolute offsets into the
 * underlying buffer.
 */
public class ByteReader {

    private final byte[] data;
    private final int end;
    private final DecodeContext context;
    private int position;

    public ByteReader(byte[] data) {
        this(data, DecodeContext.defaults());
    }

    public ByteReader(byte[] data, DecodeContext context) {
        this(data, 0, data.length, context);
    }

    private ByteReader(byte[] data, int start, int end, DecodeContext context) {
        this.data = Objects.requireNonNull(data, "data must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.position = start;
        this.end = end;
    }

    public int position() {
        return position;
    }

    public int remaining() {
        return end - position;
    }

    public DecodeContext context() {
        return context;
    }

    /**
     * @throws SysexParseException with kind TOO_SHORT if fewer than {@code count} bytes remain
     */
    public void require(int count) {
        if (remaining() < count) {
            throw SysexParseException.tooShort(count, remaining());
        }
    }

    /**
     * Reads one unsigned byte.
     */
    public int readByte() {
        require(1);
        return data[position++] & 0xFF;
    }

    /**
     * Reads the next byte without consuming it.
     */
    public int peekByte() {
        require(1);
        return data[position] & 0xFF;
    }

    public byte[] readBytes(int count) {
        require(count);
        byte[] result = Arrays.copyOfRange(data, position, position + count);
        position += count;
        return result;
    }

    public void skip(int count) {
        require(count);
        position += count;
    }

    /**
     * Reads one byte and removes the category bias.
     */
    public BoundedValue readValue(Category category) {
        return BoundedValue.fromWireByte(category, readByte());
    }

    public boolean readFlag() {
        return readByte() != 0;
    }

    /**
     * Reads a fixed-width ASCII name. NUL bytes are read as spaces.
     *
     * @throws SysexParseException with kind INVALID_TEXT on a non-printable byte
     */
    public String readName(String field, int width) {
        int start = position;
        byte[] raw = readBytes(width);
        StringBuilder name = new StringBuilder(width);
        for (int i = 0; i < raw.length; i++) {
            int c = raw[i] & 0xFF;
            if (c == 0) {
                c = ' ';
            }
            if (c < 0x20 || c > 0x7E) {
                throw SysexParseException.invalidText(field, start + i, c);
            }
            name.append((char) c);
        }
        return name.toString();
    }

    /**
     * Splits off the next {@code count} bytes as an independent reader sharing
     * this reader's context, and advances past them.
     */
    public ByteReader slice(int count) {
        require(count);
        ByteReader slice = new ByteReader(data, position, position + count, context);
        position += count;
        return slice;
    }

    /**
     * Decodes one entity from exactly {@code codec.declaredSize()} bytes.
     *
     * @throws SysexParseException with kind TOO_SHORT if fewer bytes remain
     */
    public <T> T read(SysexCodec<T> codec) {
        int size = codec.declaredSize();
        ByteReader slice = slice(size);
        T value = codec.read(slice);
        if (slice.remaining() != 0) {
            throw new IllegalStateException(codec + " left " + slice.remaining()
                    + " of " + size + " declared bytes unread");
        }
        return value;
    }

    /**
     * Decodes {@code ways} entities stored byte-interleaved with stride {@code ways}.
     */
    public <T> List<T> readInterleaved(SysexCodec<T> codec, int ways) {
        int size = codec.declaredSize();
        byte[][] blocks = Interleave.split(readBytes(ways * size), 0, ways, size);
        List<T> values = new ArrayList<>(ways);
        for (byte[] block : blocks) {
            values.add(new ByteReader(block, context).read(codec));
        }
        return List.copyOf(values);
    }

    /**
     * Reads a trailing checksum byte and compares it with the checksum of
     * {@code [bodyStart, position)}.
     */
    public void readChecksum(String block, int bodyStart) {
        int expected = Checksum.of(data, bodyStart, position);
        int offset = position;
        int actual = readByte();
        context.verifyChecksum(block, offset, expected, actual);
    }

    /**
     * Verifies a checksum stored ahead of its body, at absolute offset
     * {@code checksumOffset}, against the bytes in {@code [from, to)}.
     */
    public void verifyLeadingChecksum(String block, int checksumOffset, int from, int to) {
        int expected = Checksum.of(data, from, to);
        context.verifyChecksum(block, checksumOffset, expected, data[checksumOffset] & 0xFF);
    }
}
