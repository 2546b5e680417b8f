package com.largomodo.ksynth.k5000.sysex;

import com.largomodo.ksynth.core.DispatchRule;
import com.largomodo.ksynth.core.DispatchTable;
import com.largomodo.ksynth.core.SysexParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.largomodo.ksynth.k5000.sysex.Cardinality.BLOCK;
import static com.largomodo.ksynth.k5000.sysex.Cardinality.ONE;
import static com.largomodo.ksynth.k5000.sysex.PatchKind.DRUM_INSTRUMENT;
import static com.largomodo.ksynth.k5000.sysex.PatchKind.DRUM_KIT;
import static com.largomodo.ksynth.k5000.sysex.PatchKind.MULTI;
import static com.largomodo.ksynth.k5000.sysex.SubData.NONE;
import static com.largomodo.ksynth.k5000.sysex.SubData.PATCH_NUMBER;
import static com.largomodo.ksynth.k5000.sysex.SubData.TONE_MAP;

/**
 * Classifies K5000 dump headers by their byte prefix after the channel byte:
 * cardinality, 0x00, 0x0A, kind and, for singles, the bank.
 */
public class DumpClassifier {

    public static final int GROUP = 0x00;
    public static final int MACHINE_ID = 0x0A;

    private static final DispatchTable<Dump> TABLE = new DispatchTable<>("K5000", rules());

    private DumpClassifier() {
        // Static utility class - prevent instantiation
    }

    /**
     * @param message message bytes starting at the channel byte (after F0 40)
     * @throws SysexParseException with kind TOO_SHORT if the fixed header is incomplete,
     *                             or UNIDENTIFIED if no rule matches
     */
    public static Dump classify(byte[] message) {
        if (message.length < Dump.FIXED_SIZE) {
            throw SysexParseException.tooShort(Dump.FIXED_SIZE, message.length);
        }
        return TABLE.classify(message);
    }

    static DispatchTable<Dump> table() {
        return TABLE;
    }

    private static List<DispatchRule<Dump>> rules() {
        List<DispatchRule<Dump>> rules = new ArrayList<>();
        for (BankIdentifier bank : BankIdentifier.values()) {
            rules.add(prefix(Dump.single(ONE, bank, PATCH_NUMBER)));
            rules.add(prefix(Dump.single(BLOCK, bank, bank.hasToneMap() ? TONE_MAP : NONE)));
        }
        rules.add(prefix(Dump.of(ONE, MULTI, PATCH_NUMBER)));
        rules.add(prefix(Dump.of(BLOCK, MULTI, NONE)));
        rules.add(prefix(Dump.of(ONE, DRUM_KIT, NONE)));
        rules.add(prefix(Dump.of(ONE, DRUM_INSTRUMENT, PATCH_NUMBER)));
        rules.add(prefix(Dump.of(BLOCK, DRUM_INSTRUMENT, NONE)));
        return rules;
    }

    /**
     * Rule matching the bytes that identify {@code dump}.
     */
    private static DispatchRule<Dump> prefix(Dump dump) {
        List<Integer> expected = new ArrayList<>(List.of(dump.cardinality().code(), GROUP, MACHINE_ID,
                dump.kind().code()));
        dump.bank().ifPresent(bank -> expected.add(bank.code()));
        return header -> {
            if (header.length < expected.size() + 1) {
                return Optional.empty();
            }
            for (int i = 0; i < expected.size(); i++) {
                if ((header[i + 1] & 0xFF) != expected.get(i)) {
                    return Optional.empty();
                }
            }
            return Optional.of(dump);
        };
    }
}
