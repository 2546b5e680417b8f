package com.largomodo.ksynth.k4;

import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.SysexCodec;
import com.largomodo.ksynth.core.SysexParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The complete K4 memory image: 64 singles, 64 multis, the drum patch and 32
 * effects, stored one collection after the other (15114 bytes).
 * <p>
 * Singles and multis are addressed on the instrument as A-1 through D-16.
 */
public record Bank(List<SinglePatch> singles, List<MultiPatch> multis, DrumPatch drum, List<EffectPatch> effects) {

    private static final Logger log = LoggerFactory.getLogger(Bank.class);

    public static final int SINGLE_COUNT = 64;
    public static final int MULTI_COUNT = 64;
    public static final int EFFECT_COUNT = 32;
    public static final int PATCHES_PER_LETTER = 16;

    public static final int DATA_SIZE = SinglePatch.DATA_SIZE * SINGLE_COUNT
            + MultiPatch.DATA_SIZE * MULTI_COUNT
            + DrumPatch.DATA_SIZE
            + EffectPatch.DATA_SIZE * EFFECT_COUNT;

    public static final SysexCodec<Bank> CODEC = SysexCodec.of("K4 bank", DATA_SIZE, Bank::read, Bank::write);

    public Bank {
        singles = checkCount(singles, SINGLE_COUNT, "singles");
        multis = checkCount(multis, MULTI_COUNT, "multis");
        Objects.requireNonNull(drum, "drum must not be null");
        effects = checkCount(effects, EFFECT_COUNT, "effects");
    }

    public static Bank defaults() {
        return new Bank(Collections.nCopies(SINGLE_COUNT, SinglePatch.defaults()),
                Collections.nCopies(MULTI_COUNT, MultiPatch.defaults()), DrumPatch.defaults(),
                Collections.nCopies(EFFECT_COUNT, EffectPatch.defaults()));
    }

    /**
     * Single at a panel slot such as {@code "A-1"} or {@code "d-16"}.
     *
     * @throws IllegalArgumentException if the slot name is malformed
     */
    public SinglePatch single(String slot) {
        return singles.get(slotIndex(slot));
    }

    public MultiPatch multi(String slot) {
        return multis.get(slotIndex(slot));
    }

    /**
     * Panel name of a 0-based single or multi index, e.g. 0 → {@code "A-1"}, 63 → {@code "D-16"}.
     */
    public static String slotName(int index) {
        if (index < 0 || index >= SINGLE_COUNT) {
            throw new IllegalArgumentException("Slot index out of range: " + index);
        }
        char letter = (char) ('A' + index / PATCHES_PER_LETTER);
        return letter + "-" + (index % PATCHES_PER_LETTER + 1);
    }

    /**
     * Inverse of {@link #slotName(int)}.
     */
    public static int slotIndex(String slot) {
        Objects.requireNonNull(slot, "slot must not be null");
        String s = slot.trim().toUpperCase();
        int dash = s.indexOf('-');
        if (dash != 1 || s.charAt(0) < 'A' || s.charAt(0) > 'D') {
            throw new IllegalArgumentException("Not a slot name: " + slot);
        }
        int number;
        try {
            number = Integer.parseInt(s.substring(2));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a slot name: " + slot, e);
        }
        if (number < 1 || number > PATCHES_PER_LETTER) {
            throw new IllegalArgumentException("Not a slot name: " + slot);
        }
        return (s.charAt(0) - 'A') * PATCHES_PER_LETTER + number - 1;
    }

    public static Bank read(ByteReader in) {
        in.require(DATA_SIZE);
        int start = in.position();
        log.debug("Parsing single patches, offset = {}", in.position() - start);
        List<SinglePatch> singles = readCollection(in, SinglePatch.CODEC, SINGLE_COUNT, "singles");
        log.debug("Parsing multi patches, offset = {}", in.position() - start);
        List<MultiPatch> multis = readCollection(in, MultiPatch.CODEC, MULTI_COUNT, "multis");
        log.debug("Parsing drum patch, offset = {}", in.position() - start);
        DrumPatch drum = readCollection(in, DrumPatch.CODEC, 1, "drum").get(0);
        log.debug("Parsing effect patches, offset = {}", in.position() - start);
        List<EffectPatch> effects = readCollection(in, EffectPatch.CODEC, EFFECT_COUNT, "effects");
        in.context().blockDecoded("K4 bank", start);
        return new Bank(singles, multis, drum, effects);
    }

    public void write(ByteWriter out) {
        writeCollection(out, SinglePatch.CODEC, singles);
        writeCollection(out, MultiPatch.CODEC, multis);
        out.write(DrumPatch.CODEC, drum);
        writeCollection(out, EffectPatch.CODEC, effects);
    }

    /**
     * Reads one collection and checks that it occupied exactly {@code blockSize × count} bytes.
     *
     * @throws SysexParseException with kind OFFSET_MISMATCH if the collection drifted
     */
    public static <T> List<T> readCollection(ByteReader in, SysexCodec<T> codec, int count, String name) {
        int collectionStart = in.position();
        List<T> values = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            values.add(in.read(codec));
        }
        int expected = codec.declaredSize() * count;
        int actual = in.position() - collectionStart;
        if (actual != expected) {
            throw SysexParseException.offsetMismatch(name, expected, actual);
        }
        return values;
    }

    private static <T> void writeCollection(ByteWriter out, SysexCodec<T> codec, List<T> values) {
        for (T value : values) {
            out.write(codec, value);
        }
    }

    private static <T> List<T> checkCount(List<T> values, int count, String field) {
        Objects.requireNonNull(values, field + " must not be null");
        if (values.size() != count) {
            throw new IllegalArgumentException("A bank has " + count + " " + field + ", got " + values.size());
        }
        return List.copyOf(values);
    }
}
