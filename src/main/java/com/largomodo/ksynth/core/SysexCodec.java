package com.largomodo.ksynth.core;

import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Decode/encode contract of a fixed-size dump entity.
 * <p>
 * {@link #read} consumes exactly {@link #declaredSize()} bytes and
 * {@link #write} produces exactly that many; {@link ByteReader#read} and
 * {@link ByteWriter#write} enforce both directions. Encoding an already
 * constructed model never fails, because all validation happens when the model
 * is built.
 *
 * @param <T> the model type
 */
public interface SysexCodec<T> {

    int declaredSize();

    T read(ByteReader in);

    void write(T value, ByteWriter out);

    /**
     * Decodes from the front of {@code data} with the default context.
     *
     * @throws SysexParseException if the data is too short or malformed
     */
    default T decode(byte[] data) {
        return new ByteReader(data).read(this);
    }

    default byte[] encode(T value) {
        ByteWriter out = new ByteWriter(declaredSize());
        out.write(this, value);
        return out.toByteArray();
    }

    /**
     * Builds a codec from a model's static reader and instance writer.
     */
    static <T> SysexCodec<T> of(String name, int size, Function<ByteReader, T> reader,
                                BiConsumer<T, ByteWriter> writer) {
        Objects.requireNonNull(reader, "reader must not be null");
        Objects.requireNonNull(writer, "writer must not be null");
        return new SysexCodec<>() {
            @Override
            public int declaredSize() {
                return size;
            }

            @Override
            public T read(ByteReader in) {
                return reader.apply(in);
            }

            @Override
            public void write(T value, ByteWriter out) {
                writer.accept(value, out);
            }

            @Override
            public String toString() {
                return name + " codec (" + size + " bytes)";
            }
        };
    }
}
