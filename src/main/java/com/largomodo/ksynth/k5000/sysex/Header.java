package com.largomodo.ksynth.k5000.sysex;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.SysexParseException;
import com.largomodo.ksynth.k5000.ToneMap;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.CHANNEL;
import static com.largomodo.ksynth.core.Category.PATCH_NUMBER;

/**
 * Dump header of a K5000 message, from the channel byte up to the patch data.
 * Its size depends on the dump: see {@link Dump#headerSize()}.
 */
public record Header(BoundedValue channel, Dump dump, OptionalInt patchNumber, Optional<ToneMap> toneMap) {

    public Header {
        require(channel, CHANNEL, "channel");
        Objects.requireNonNull(dump, "dump must not be null");
        Objects.requireNonNull(patchNumber, "patchNumber must not be null");
        Objects.requireNonNull(toneMap, "toneMap must not be null");
        if (patchNumber.isPresent() != (dump.subData() == SubData.PATCH_NUMBER)) {
            throw new IllegalArgumentException(dump + " header " + (patchNumber.isPresent() ? "takes no" : "needs a")
                    + " patch number");
        }
        if (toneMap.isPresent() != (dump.subData() == SubData.TONE_MAP)) {
            throw new IllegalArgumentException(dump + " header " + (toneMap.isPresent() ? "takes no" : "needs a")
                    + " tone map");
        }
        patchNumber.ifPresent(n -> {
            if (n < 0 || n > 0x7F) {
                throw new IllegalArgumentException("Patch number must be a 7-bit value, got " + n);
            }
        });
    }

    public static Header oneSingle(int channel, BankIdentifier bank, int number) {
        return new Header(BoundedValue.of(CHANNEL, channel), Dump.single(Cardinality.ONE, bank, SubData.PATCH_NUMBER),
                OptionalInt.of(number), Optional.empty());
    }

    /**
     * Block single header for a bank that carries a tone map.
     *
     * @throws IllegalArgumentException for bank B, see {@link #blockPcmSingles(int)}
     */
    public static Header blockSingle(int channel, BankIdentifier bank, ToneMap toneMap) {
        if (!bank.hasToneMap()) {
            throw new IllegalArgumentException("Bank " + bank + " block dumps have no tone map");
        }
        return new Header(BoundedValue.of(CHANNEL, channel), Dump.single(Cardinality.BLOCK, bank, SubData.TONE_MAP),
                OptionalInt.empty(), Optional.of(toneMap));
    }

    /**
     * Block single header for bank B, whose PCM-only patches are dumped without a tone map.
     */
    public static Header blockPcmSingles(int channel) {
        return new Header(BoundedValue.of(CHANNEL, channel),
                Dump.single(Cardinality.BLOCK, BankIdentifier.B, SubData.NONE), OptionalInt.empty(), Optional.empty());
    }

    public static Header oneMulti(int channel, int number) {
        return new Header(BoundedValue.of(CHANNEL, channel), Dump.of(Cardinality.ONE, PatchKind.MULTI,
                SubData.PATCH_NUMBER), OptionalInt.of(number), Optional.empty());
    }

    public int size() {
        return dump.headerSize();
    }

    /**
     * Classifies and reads the header at the start of {@code message}.
     * A patch number byte above 0x7F fails with kind RANGE.
     *
     * @throws SysexParseException with kind UNIDENTIFIED for an unknown header,
     *                             or TOO_SHORT if its sub-bytes are cut off
     */
    public static Header parse(byte[] message) {
        Dump dump = DumpClassifier.classify(message);
        ByteReader in = new ByteReader(message);
        in.require(dump.headerSize());
        BoundedValue channel = BoundedValue.fromWireByte(CHANNEL, in.readByte() & 0x0F);
        in.skip(dump.headerSize() - dump.subData().size() - 1);
        OptionalInt patchNumber = OptionalInt.empty();
        Optional<ToneMap> toneMap = Optional.empty();
        if (dump.subData() == SubData.PATCH_NUMBER) {
            patchNumber = OptionalInt.of(in.readValue(PATCH_NUMBER).value());
        } else if (dump.subData() == SubData.TONE_MAP) {
            toneMap = Optional.of(in.read(ToneMap.CODEC));
        }
        return new Header(channel, dump, patchNumber, toneMap);
    }

    public void write(ByteWriter out) {
        out.writeValue(channel);
        out.writeByte(dump.cardinality().code());
        out.writeByte(DumpClassifier.GROUP);
        out.writeByte(DumpClassifier.MACHINE_ID);
        out.writeByte(dump.kind().code());
        dump.bank().ifPresent(bank -> out.writeByte(bank.code()));
        patchNumber.ifPresent(out::writeByte);
        toneMap.ifPresent(map -> out.write(ToneMap.CODEC, map));
    }

    @Override
    public String toString() {
        String sub = patchNumber.isPresent() ? " #" + patchNumber.getAsInt()
                : toneMap.map(map -> " tones=" + map.count()).orElse("");
        return String.format("Ch: %s  %s%s", channel, dump, sub);
    }
}
