package com.largomodo.ksynth.k4;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.Category;
import com.largomodo.ksynth.core.Checksum;
import com.largomodo.ksynth.core.ChecksumPolicy;
import com.largomodo.ksynth.core.Decoded;
import com.largomodo.ksynth.core.ParseError;
import com.largomodo.ksynth.core.SysexDecoder;
import com.largomodo.ksynth.core.SysexParseException;
import com.largomodo.ksynth.generators.K4PatchDataGenerator;
import com.largomodo.ksynth.generators.PatchDataGenerator;
import net.jqwik.api.*;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SinglePatchTest {

    private static final SinglePatch MELO_VOX = SinglePatch.defaults().withName("Melo Vox 1").withVolume(100);

    @Test
    void encodesNameVolumeAndChecksum() {
        byte[] data = SinglePatch.CODEC.encode(MELO_VOX);

        assertEquals(SinglePatch.DATA_SIZE, data.length);
        assertEquals("Melo Vox 1", new String(data, 0, 10, StandardCharsets.US_ASCII));
        assertEquals(100, data[10]);
        assertEquals(Checksum.of(data, 0, 130), data[130]);
    }

    @Test
    void decodeRestoresEncodedPatch() {
        SinglePatch patch = new SinglePatch("Strings", BoundedValue.of(Category.LEVEL, 87),
                BoundedValue.of(Category.EFFECT_NUMBER, 32), Submix.H, SourceMode.TWIN, PolyphonyMode.SOLO2,
                true, false, List.of(false, true, false, true), BoundedValue.of(Category.BENDER_RANGE, 12),
                WheelAssign.LFO, BoundedValue.of(Category.DEPTH, -50), AutoBend.defaults(), Vibrato.defaults(),
                Lfo.defaults(), BoundedValue.of(Category.DEPTH, 50),
                List.of(Source.defaults().withWave(1), Source.defaults().withWave(97),
                        Source.defaults().withWave(128), Source.defaults().withWave(256)),
                MELO_VOX.amplifiers(), Filter.defaults(), Filter.defaults());

        SinglePatch decoded = SinglePatch.CODEC.decode(SinglePatch.CODEC.encode(patch));

        assertEquals(patch, decoded);
        assertEquals("Strings   ", decoded.name());
        assertEquals("1-3-", decoded.sourceMuteString());
    }

    @Test
    void sourceMuteBitSetMeansSourcePlays() {
        SinglePatch patch = new SinglePatch("Mutes", MELO_VOX.volume(), MELO_VOX.effect(), Submix.A,
                SourceMode.NORMAL, PolyphonyMode.POLY1, false, false, List.of(false, true, false, true),
                MELO_VOX.benderRange(), MELO_VOX.wheelAssign(), MELO_VOX.wheelDepth(), MELO_VOX.autoBend(),
                MELO_VOX.vibrato(), MELO_VOX.lfo(), MELO_VOX.pressureFrequency(), MELO_VOX.sources(),
                MELO_VOX.amplifiers(), MELO_VOX.filter1(), MELO_VOX.filter2());

        byte[] data = SinglePatch.CODEC.encode(patch);

        assertEquals(0b0101, data[14] & 0x0F);
        assertEquals("1-3-", patch.sourceMuteString());
    }

    @Test
    void effectNumberIsStoredZeroBased() {
        byte[] data = SinglePatch.CODEC.encode(MELO_VOX);

        assertEquals(0, data[11]);
        assertEquals(1, SinglePatch.CODEC.decode(data).effect().value());
    }

    @Test
    void corruptedChecksumIsReported() {
        byte[] data = SinglePatch.CODEC.encode(MELO_VOX);
        data[130] = (byte) ((data[130] + 1) & 0x7F);

        Decoded<SinglePatch> decoded = new SysexDecoder(ChecksumPolicy.IGNORE).decode(SinglePatch.CODEC, data);
        assertEquals(1, decoded.checksumMismatches().size());
        assertEquals(130, decoded.checksumMismatches().get(0).offset());

        SysexParseException e = assertThrows(SysexParseException.class,
                () -> new SysexDecoder(ChecksumPolicy.STRICT).decode(SinglePatch.CODEC, data));
        assertEquals(ParseError.CHECKSUM_MISMATCH, e.kind());
    }

    @Test
    void truncatedSingleIsTooShort() {
        byte[] data = Arrays.copyOf(SinglePatch.CODEC.encode(MELO_VOX), SinglePatch.DATA_SIZE - 1);

        SysexParseException e = assertThrows(SysexParseException.class, () -> SinglePatch.CODEC.decode(data));
        assertEquals(ParseError.TOO_SHORT, e.kind());
    }

    @Test
    void nonAsciiNameIsInvalidText() {
        byte[] data = SinglePatch.CODEC.encode(MELO_VOX);
        data[3] = 0x7F;

        SysexParseException e = assertThrows(SysexParseException.class, () -> SinglePatch.CODEC.decode(data));
        assertEquals(ParseError.INVALID_TEXT, e.kind());
    }

    @Test
    void nameLongerThanTenCharactersIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> MELO_VOX.withName("Melo Vox 12"));
    }

    @Test
    void shortNameIsPaddedToWireWidth() {
        SinglePatch patch = MELO_VOX.withName("Pad");

        assertEquals("Pad       ", patch.name());
        assertEquals(patch, SinglePatch.CODEC.decode(SinglePatch.CODEC.encode(patch)));
    }

    @Test
    void sourcesAreInterleavedWithStrideFour() {
        SinglePatch patch = new SinglePatch("Waves", MELO_VOX.volume(), MELO_VOX.effect(), Submix.A,
                SourceMode.NORMAL, PolyphonyMode.POLY1, false, false, MELO_VOX.sourceMuted(),
                MELO_VOX.benderRange(), MELO_VOX.wheelAssign(), MELO_VOX.wheelDepth(), MELO_VOX.autoBend(),
                MELO_VOX.vibrato(), MELO_VOX.lfo(), MELO_VOX.pressureFrequency(),
                List.of(Source.defaults().withWave(1), Source.defaults().withWave(2),
                        Source.defaults().withWave(3), Source.defaults().withWave(4)),
                MELO_VOX.amplifiers(), MELO_VOX.filter1(), MELO_VOX.filter2());

        byte[] data = SinglePatch.CODEC.encode(patch);

        // byte 2 (wave low bits) of source k sits at 30 + 4 * 2 + k
        assertEquals(0, data[38]);
        assertEquals(1, data[39]);
        assertEquals(2, data[40]);
        assertEquals(3, data[41]);
    }

    @Property
    void decodeInvertsEncode(@ForAll("singles") SinglePatch patch) {
        assertEquals(patch, SinglePatch.CODEC.decode(SinglePatch.CODEC.encode(patch)));
    }

    @Property
    void sourceModeByteFieldsAreIndependent(@ForAll("singles") SinglePatch patch, @ForAll SourceMode sourceMode,
                                            @ForAll PolyphonyMode polyphony, @ForAll boolean am12,
                                            @ForAll boolean am34) {
        assertModeByteDecodes(withModes(patch, sourceMode, patch.polyphonyMode(), patch.am12(), patch.am34()));
        assertModeByteDecodes(withModes(patch, patch.sourceMode(), polyphony, patch.am12(), patch.am34()));
        assertModeByteDecodes(withModes(patch, patch.sourceMode(), patch.polyphonyMode(), am12, patch.am34()));
        assertModeByteDecodes(withModes(patch, patch.sourceMode(), patch.polyphonyMode(), patch.am12(), am34));
    }

    @Property
    void vibratoShapeAndSourceMutesAreIndependent(@ForAll("singles") SinglePatch patch, @ForAll LfoShape shape,
                                                  @ForAll("mutes") List<Boolean> muted) {
        Vibrato vibrato = patch.vibrato();
        SinglePatch reshaped = withMutesAndVibrato(patch, patch.sourceMuted(),
                new Vibrato(shape, vibrato.speed(), vibrato.pressure(), vibrato.depth()));
        SinglePatch remuted = withMutesAndVibrato(patch, muted, vibrato);

        for (SinglePatch expected : List.of(reshaped, remuted)) {
            byte[] data = SinglePatch.CODEC.encode(expected);
            SinglePatch decoded = SinglePatch.CODEC.decode(data);
            assertEquals(expected.vibrato(), decoded.vibrato());
            assertEquals(expected.sourceMuted(), decoded.sourceMuted());
            for (int i = 0; i < SinglePatch.SOURCE_COUNT; i++) {
                assertEquals(!expected.sourceMuted().get(i), (data[14] & (1 << i)) != 0, "mute bit " + i);
            }
        }
    }

    @Property
    void benderRangeAndWheelAssignAreIndependent(@ForAll("singles") SinglePatch patch,
                                                 @ForAll("benderRanges") BoundedValue benderRange,
                                                 @ForAll WheelAssign wheelAssign) {
        for (SinglePatch expected : List.of(withBender(patch, benderRange, patch.wheelAssign()),
                withBender(patch, patch.benderRange(), wheelAssign))) {
            SinglePatch decoded = SinglePatch.CODEC.decode(SinglePatch.CODEC.encode(expected));
            assertEquals(expected.benderRange(), decoded.benderRange());
            assertEquals(expected.wheelAssign(), decoded.wheelAssign());
        }
    }

    @Provide
    Arbitrary<SinglePatch> singles() {
        return K4PatchDataGenerator.singlePatches();
    }

    @Provide
    Arbitrary<List<Boolean>> mutes() {
        return K4PatchDataGenerator.sourceMutes();
    }

    @Provide
    Arbitrary<BoundedValue> benderRanges() {
        return PatchDataGenerator.boundedValues(Category.BENDER_RANGE);
    }

    private static void assertModeByteDecodes(SinglePatch expected) {
        SinglePatch decoded = SinglePatch.CODEC.decode(SinglePatch.CODEC.encode(expected));

        assertEquals(expected.sourceMode(), decoded.sourceMode());
        assertEquals(expected.polyphonyMode(), decoded.polyphonyMode());
        assertEquals(expected.am12(), decoded.am12());
        assertEquals(expected.am34(), decoded.am34());
    }

    private static SinglePatch withModes(SinglePatch p, SourceMode sourceMode, PolyphonyMode polyphony,
                                         boolean am12, boolean am34) {
        return new SinglePatch(p.name(), p.volume(), p.effect(), p.submix(), sourceMode, polyphony, am12, am34,
                p.sourceMuted(), p.benderRange(), p.wheelAssign(), p.wheelDepth(), p.autoBend(), p.vibrato(),
                p.lfo(), p.pressureFrequency(), p.sources(), p.amplifiers(), p.filter1(), p.filter2());
    }

    private static SinglePatch withMutesAndVibrato(SinglePatch p, List<Boolean> muted, Vibrato vibrato) {
        return new SinglePatch(p.name(), p.volume(), p.effect(), p.submix(), p.sourceMode(), p.polyphonyMode(),
                p.am12(), p.am34(), muted, p.benderRange(), p.wheelAssign(), p.wheelDepth(), p.autoBend(),
                vibrato, p.lfo(), p.pressureFrequency(), p.sources(), p.amplifiers(), p.filter1(), p.filter2());
    }

    private static SinglePatch withBender(SinglePatch p, BoundedValue benderRange, WheelAssign wheelAssign) {
        return new SinglePatch(p.name(), p.volume(), p.effect(), p.submix(), p.sourceMode(), p.polyphonyMode(),
                p.am12(), p.am34(), p.sourceMuted(), benderRange, wheelAssign, p.wheelDepth(), p.autoBend(),
                p.vibrato(), p.lfo(), p.pressureFrequency(), p.sources(), p.amplifiers(), p.filter1(), p.filter2());
    }
}
