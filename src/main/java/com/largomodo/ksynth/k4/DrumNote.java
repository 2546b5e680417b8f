package com.largomodo.ksynth.k4;

import com.largomodo.ksynth.core.Bits;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.Discriminants;
import com.largomodo.ksynth.core.Interleave;
import com.largomodo.ksynth.core.SysexCodec;

import java.util.Objects;

/**
 * Drum settings for one key (11 bytes): two interleaved drum sources and a checksum.
 * <p>
 * The note's submix is packed into bits 4-6 of the first source's first byte
 * and masked off before that source is decoded.
 */
public record DrumNote(Submix submix, DrumSource source1, DrumSource source2) {

    public static final int DATA_SIZE = 11;
    public static final SysexCodec<DrumNote> CODEC =
            SysexCodec.of("K4 drum note", DATA_SIZE, DrumNote::read, DrumNote::write);

    private static final int SUBMIX_SHIFT = 4;
    private static final int SUBMIX_WIDTH = 3;

    public DrumNote {
        Objects.requireNonNull(submix, "submix must not be null");
        Objects.requireNonNull(source1, "source1 must not be null");
        Objects.requireNonNull(source2, "source2 must not be null");
    }

    public static DrumNote defaults() {
        return new DrumNote(Submix.A, DrumSource.defaults(), DrumSource.defaults());
    }

    public static DrumNote read(ByteReader in) {
        int bodyStart = in.position();
        byte[][] blocks = Interleave.split(in.readBytes(2 * DrumSource.DATA_SIZE), 0, 2, DrumSource.DATA_SIZE);
        int first = blocks[0][0] & 0xFF;
        Submix submix = Discriminants.byOrdinal(Submix.values(),
                Bits.field(first, SUBMIX_SHIFT, SUBMIX_WIDTH), "drum note submix");
        blocks[0][0] = (byte) (first & 0x0F);
        DrumSource source1 = new ByteReader(blocks[0], in.context()).read(DrumSource.CODEC);
        DrumSource source2 = new ByteReader(blocks[1], in.context()).read(DrumSource.CODEC);
        in.readChecksum("K4 drum note", bodyStart);
        return new DrumNote(submix, source1, source2);
    }

    public void write(ByteWriter out) {
        int bodyStart = out.position();
        byte[][] blocks = {encode(source1), encode(source2)};
        blocks[0][0] = (byte) Bits.withField(blocks[0][0] & 0xFF, SUBMIX_SHIFT, SUBMIX_WIDTH, submix.ordinal());
        out.writeBytes(Interleave.join(blocks));
        out.writeChecksum(bodyStart);
    }

    private static byte[] encode(DrumSource source) {
        ByteWriter block = new ByteWriter(DrumSource.DATA_SIZE);
        block.write(DrumSource.CODEC, source);
        return block.toByteArray();
    }
}
