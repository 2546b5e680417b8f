package com.largomodo.ksynth.core;

import java.util.Objects;
import java.util.function.Function;

/**
 * Entry point for decoding with an explicit checksum policy.
 * <p>
 * Each call creates a fresh {@link DecodeContext}; instances hold no mutable
 * state and may be shared between threads.
 */
public class SysexDecoder {

    private final ChecksumPolicy policy;
    private final DecodeObserver observer;

    public SysexDecoder(ChecksumPolicy policy) {
        this(policy, DecodeObserver.NONE);
    }

    public SysexDecoder(ChecksumPolicy policy, DecodeObserver observer) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.observer = Objects.requireNonNull(observer, "observer must not be null");
    }

    public ChecksumPolicy policy() {
        return policy;
    }

    /**
     * Decodes one fixed-size entity from the front of {@code data}.
     */
    public <T> Decoded<T> decode(SysexCodec<T> codec, byte[] data) {
        return decode(in -> in.read(codec), data);
    }

    /**
     * Decodes with an arbitrary reader function, for entities whose size
     * depends on their content.
     */
    public <T> Decoded<T> decode(Function<ByteReader, T> reader, byte[] data) {
        DecodeContext context = new DecodeContext(policy, observer);
        T value = reader.apply(new ByteReader(data, context));
        return new Decoded<>(value, context.mismatches());
    }
}
