package com.largomodo.ksynth.k4.sysex;

import com.largomodo.ksynth.core.DispatchRule;
import com.largomodo.ksynth.core.DispatchTable;
import com.largomodo.ksynth.core.Locality;
import com.largomodo.ksynth.core.SysexParseException;

import java.util.List;
import java.util.Optional;

import static com.largomodo.ksynth.core.Locality.EXTERNAL;
import static com.largomodo.ksynth.core.Locality.INTERNAL;
import static com.largomodo.ksynth.k4.sysex.DumpKind.ALL;
import static com.largomodo.ksynth.k4.sysex.DumpKind.BLOCK_EFFECT;
import static com.largomodo.ksynth.k4.sysex.DumpKind.BLOCK_MULTI;
import static com.largomodo.ksynth.k4.sysex.DumpKind.BLOCK_SINGLE;
import static com.largomodo.ksynth.k4.sysex.DumpKind.DRUM;
import static com.largomodo.ksynth.k4.sysex.DumpKind.ONE_EFFECT;
import static com.largomodo.ksynth.k4.sysex.DumpKind.ONE_MULTI;
import static com.largomodo.ksynth.k4.sysex.DumpKind.ONE_SINGLE;
import static com.largomodo.ksynth.k4.sysex.Function.ALL_PATCH_DATA_DUMP;
import static com.largomodo.ksynth.k4.sysex.Function.BLOCK_PATCH_DATA_DUMP;
import static com.largomodo.ksynth.k4.sysex.Function.ONE_PATCH_DATA_DUMP;

/**
 * Classifies K4 messages by (function, sub-status 1, sub-status 2).
 * <p>
 * One-patch dumps use sub-status 2 as the patch number: 0-63 are singles and
 * 64-127 multis in the single/multi areas (sub-status 1 = 0x00/0x02), 0-31
 * effects and 32 the drum in the effect/drum areas (0x01/0x03).
 */
public class DumpClassifier {

    private static final int FUNCTION = 1;
    private static final int GROUP = 2;
    private static final int MACHINE = 3;
    private static final int SUB1 = 4;
    private static final int SUB2 = 5;

    private static final DispatchTable<Dump> TABLE = new DispatchTable<>("K4", List.of(
            onePatch(0x00, 0, 63, ONE_SINGLE, INTERNAL, 0),
            onePatch(0x00, 64, 127, ONE_MULTI, INTERNAL, 64),
            onePatch(0x02, 0, 63, ONE_SINGLE, EXTERNAL, 0),
            onePatch(0x02, 64, 127, ONE_MULTI, EXTERNAL, 64),
            onePatch(0x01, 0, 31, ONE_EFFECT, INTERNAL, 0),
            onePatch(0x03, 0, 31, ONE_EFFECT, EXTERNAL, 0),
            exact(ONE_PATCH_DATA_DUMP, 0x01, 32, DRUM, INTERNAL),
            exact(ONE_PATCH_DATA_DUMP, 0x03, 32, DRUM, EXTERNAL),
            exact(BLOCK_PATCH_DATA_DUMP, 0x00, 0x00, BLOCK_SINGLE, INTERNAL),
            exact(BLOCK_PATCH_DATA_DUMP, 0x02, 0x00, BLOCK_SINGLE, EXTERNAL),
            exact(BLOCK_PATCH_DATA_DUMP, 0x00, 0x40, BLOCK_MULTI, INTERNAL),
            exact(BLOCK_PATCH_DATA_DUMP, 0x02, 0x40, BLOCK_MULTI, EXTERNAL),
            exact(BLOCK_PATCH_DATA_DUMP, 0x01, 0x00, BLOCK_EFFECT, INTERNAL),
            exact(BLOCK_PATCH_DATA_DUMP, 0x03, 0x00, BLOCK_EFFECT, EXTERNAL),
            exact(ALL_PATCH_DATA_DUMP, 0x00, 0x00, ALL, INTERNAL),
            exact(ALL_PATCH_DATA_DUMP, 0x02, 0x00, ALL, EXTERNAL)));

    private DumpClassifier() {
        // Static utility class - prevent instantiation
    }

    /**
     * @param message message bytes starting at the channel byte (after F0 40)
     * @throws SysexParseException with kind TOO_SHORT if the header is incomplete,
     *                             or UNIDENTIFIED if no rule matches
     */
    public static Dump classify(byte[] message) {
        if (message.length < Header.DATA_SIZE) {
            throw SysexParseException.tooShort(Header.DATA_SIZE, message.length);
        }
        return TABLE.classify(message);
    }

    static DispatchTable<Dump> table() {
        return TABLE;
    }

    private static DispatchRule<Dump> onePatch(int sub1, int low, int high, DumpKind kind, Locality locality,
                                               int base) {
        return header -> {
            int sub2 = header[SUB2] & 0xFF;
            if (isK4(header) && (header[FUNCTION] & 0xFF) == ONE_PATCH_DATA_DUMP.code()
                    && (header[SUB1] & 0xFF) == sub1 && sub2 >= low && sub2 <= high) {
                return Optional.of(Dump.of(kind, locality, sub2 - base));
            }
            return Optional.empty();
        };
    }

    private static DispatchRule<Dump> exact(Function function, int sub1, int sub2, DumpKind kind,
                                            Locality locality) {
        return header -> {
            if (isK4(header) && (header[FUNCTION] & 0xFF) == function.code()
                    && (header[SUB1] & 0xFF) == sub1 && (header[SUB2] & 0xFF) == sub2) {
                return Optional.of(Dump.of(kind, locality));
            }
            return Optional.empty();
        };
    }

    private static boolean isK4(byte[] header) {
        return header[GROUP] == Header.GROUP && header[MACHINE] == Header.MACHINE_ID;
    }
}
