package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.SysexParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.PrimitiveIterator;

/**
 * Payload of a block single dump: one single per slot included in the tone
 * map, in slot order. Singles differ in size, so each is read to its own end
 * before the next begins.
 */
public record SingleBlock(ToneMap toneMap, List<SinglePatch> patches) {

    public SingleBlock {
        Objects.requireNonNull(toneMap, "toneMap must not be null");
        Objects.requireNonNull(patches, "patches must not be null");
        if (patches.size() != toneMap.count()) {
            throw new IllegalArgumentException("Tone map includes " + toneMap.count() + " patches, got "
                    + patches.size());
        }
        patches = List.copyOf(patches);
    }

    /**
     * Single stored in slot {@code tone}, if the block includes it.
     */
    public Optional<SinglePatch> patch(int tone) {
        if (!toneMap.includes(tone)) {
            return Optional.empty();
        }
        return Optional.of(patches.get((int) toneMap.stream().filter(t -> t < tone).count()));
    }

    public static SingleBlock read(ByteReader in, ToneMap toneMap) {
        List<SinglePatch> patches = new ArrayList<>(toneMap.count());
        PrimitiveIterator.OfInt tones = toneMap.stream().iterator();
        while (tones.hasNext()) {
            int tone = tones.nextInt();
            try {
                patches.add(SinglePatch.read(in));
            } catch (SysexParseException e) {
                throw new SysexParseException(e.kind(), "Single in slot " + (tone + 1) + ": " + e.getMessage(), e);
            }
        }
        return new SingleBlock(toneMap, patches);
    }

    public void write(ByteWriter out) {
        patches.forEach(patch -> patch.write(out));
    }
}
