package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * K5000 single patch.
 * <p>
 * The size depends on the content: a checksum byte, the common block, one
 * source block per source and one {@link AdditiveKit} per ADD source, in source
 * order. The checksum covers the common and source blocks only; each kit
 * carries its own. Because the size is not fixed this type has no
 * {@code SysexCodec}; decode it with
 * {@code SysexDecoder.decode(SinglePatch::read, data)}.
 */
public record SinglePatch(Common common, List<Source> sources, List<AdditiveKit> additiveKits) {

    public SinglePatch {
        Objects.requireNonNull(common, "common must not be null");
        Objects.requireNonNull(sources, "sources must not be null");
        Objects.requireNonNull(additiveKits, "additiveKits must not be null");
        if (sources.size() != common.sourceCount().value()) {
            throw new IllegalArgumentException("Common declares " + common.sourceCount() + " sources, got "
                    + sources.size());
        }
        long additive = sources.stream().filter(Source::isAdditive).count();
        if (additiveKits.size() != additive) {
            throw new IllegalArgumentException(additive + " ADD sources need as many additive kits, got "
                    + additiveKits.size());
        }
        sources = List.copyOf(sources);
        additiveKits = List.copyOf(additiveKits);
    }

    /**
     * New patch with {@code pcmCount} PCM sources followed by
     * {@code additiveCount} ADD sources, each with a default kit.
     */
    public static SinglePatch of(String name, int pcmCount, int additiveCount) {
        List<Source> sources = new ArrayList<>();
        List<AdditiveKit> kits = new ArrayList<>();
        for (int i = 0; i < pcmCount; i++) {
            sources.add(Source.pcm(0));
        }
        for (int i = 0; i < additiveCount; i++) {
            sources.add(Source.additive());
            kits.add(AdditiveKit.defaults());
        }
        return new SinglePatch(Common.defaults(name, sources.size()), sources, kits);
    }

    public String name() {
        return common.name();
    }

    /**
     * Additive kit of the source at {@code sourceIndex}, empty for PCM sources.
     */
    public Optional<AdditiveKit> kitFor(int sourceIndex) {
        if (!sources.get(sourceIndex).isAdditive()) {
            return Optional.empty();
        }
        int kit = 0;
        for (int i = 0; i < sourceIndex; i++) {
            if (sources.get(i).isAdditive()) {
                kit++;
            }
        }
        return Optional.of(additiveKits.get(kit));
    }

    /**
     * Encoded size in bytes.
     */
    public int dataSize() {
        return 1 + Common.DATA_SIZE + sources.size() * Source.DATA_SIZE
                + additiveKits.size() * AdditiveKit.DATA_SIZE;
    }

    public static SinglePatch read(ByteReader in) {
        int checksumOffset = in.position();
        in.skip(1);
        int bodyStart = in.position();
        Common common = in.read(Common.CODEC);
        int count = common.sourceCount().value();
        List<Source> sources = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            sources.add(in.read(Source.CODEC));
        }
        in.verifyLeadingChecksum("K5000 single", checksumOffset, bodyStart, in.position());

        List<AdditiveKit> kits = new ArrayList<>();
        for (Source source : sources) {
            if (source.isAdditive()) {
                kits.add(in.read(AdditiveKit.CODEC));
            }
        }
        in.context().blockDecoded("K5000 single " + common.name().trim(), checksumOffset);
        return new SinglePatch(common, sources, kits);
    }

    public void write(ByteWriter out) {
        int checksumOffset = out.position();
        out.writeByte(0);
        int bodyStart = out.position();
        out.write(Common.CODEC, common);
        for (Source source : sources) {
            out.write(Source.CODEC, source);
        }
        out.writeLeadingChecksum(checksumOffset, bodyStart, out.position());
        for (AdditiveKit kit : additiveKits) {
            out.write(AdditiveKit.CODEC, kit);
        }
    }

    public byte[] toBytes() {
        ByteWriter out = new ByteWriter(dataSize());
        write(out);
        return out.toByteArray();
    }

    public String sourceString() {
        StringBuilder s = new StringBuilder();
        for (int i = 0; i < sources.size(); i++) {
            if (common.sourceMuted().get(i)) {
                s.append('-');
            } else {
                s.append(sources.get(i).isAdditive() ? 'A' : 'P');
            }
        }
        return s.toString();
    }

    @Override
    public String toString() {
        return String.format("%s volume=%s polyphony=%s sources=%s", common.name(), common.volume(),
                common.polyphony().displayName(), sourceString());
    }
}
