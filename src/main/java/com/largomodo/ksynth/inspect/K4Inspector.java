package com.largomodo.ksynth.inspect;

import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.Decoded;
import com.largomodo.ksynth.core.SysexDecoder;
import com.largomodo.ksynth.k4.Bank;
import com.largomodo.ksynth.k4.DrumPatch;
import com.largomodo.ksynth.k4.EffectPatch;
import com.largomodo.ksynth.k4.MultiPatch;
import com.largomodo.ksynth.k4.SinglePatch;
import com.largomodo.ksynth.k4.sysex.Dump;
import com.largomodo.ksynth.k4.sysex.DumpClassifier;
import com.largomodo.ksynth.k4.sysex.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Inspects K4 one-patch, block and all-patch dumps.
 */
public class K4Inspector implements DumpInspector {

    private static final Logger log = LoggerFactory.getLogger(K4Inspector.class);

    @Override
    public Inspection inspect(byte[] message, SysexDecoder decoder) {
        Dump dump = DumpClassifier.classify(message);
        Header header = new ByteReader(message).read(Header.CODEC);
        log.debug("Classified {} ({})", dump, header);
        String title = String.format("K4 %s, channel %s", dump, header.channel());
        byte[] payload = Arrays.copyOfRange(message, dump.payloadOffset(), message.length);
        int number = dump.number().orElse(0);

        return switch (dump.kind()) {
            case ONE_SINGLE -> report(title, decoder.decode(SinglePatch.CODEC, payload),
                    single -> List.of(Bank.slotName(number) + "  " + describe(single)));
            case ONE_MULTI -> report(title, decoder.decode(MultiPatch.CODEC, payload),
                    multi -> List.of(Bank.slotName(number) + "  " + describe(multi)));
            case ONE_EFFECT -> report(title, decoder.decode(EffectPatch.CODEC, payload),
                    effect -> List.of(effectLabel(number) + "  " + effect));
            case DRUM -> report(title, decoder.decode(DrumPatch.CODEC, payload), drum -> List.of(describe(drum)));
            case BLOCK_SINGLE -> report(title, decoder.decode(in -> Bank.readCollection(in, SinglePatch.CODEC,
                    Bank.SINGLE_COUNT, "singles"), payload), singles -> list(singles, (i, single) ->
                    Bank.slotName(i) + "  " + describe(single)));
            case BLOCK_MULTI -> report(title, decoder.decode(in -> Bank.readCollection(in, MultiPatch.CODEC,
                    Bank.MULTI_COUNT, "multis"), payload), multis -> list(multis, (i, multi) ->
                    Bank.slotName(i) + "  " + describe(multi)));
            case BLOCK_EFFECT -> report(title, decoder.decode(in -> Bank.readCollection(in, EffectPatch.CODEC,
                    Bank.EFFECT_COUNT, "effects"), payload), effects -> list(effects, (i, effect) ->
                    effectLabel(i) + "  " + effect));
            case ALL -> report(title, decoder.decode(Bank.CODEC, payload), K4Inspector::describe);
        };
    }

    private static List<String> describe(Bank bank) {
        List<String> lines = new ArrayList<>();
        lines.addAll(list(bank.singles(), (i, single) -> "Single " + Bank.slotName(i) + "  " + describe(single)));
        lines.addAll(list(bank.multis(), (i, multi) -> "Multi " + Bank.slotName(i) + "  " + describe(multi)));
        lines.add("Drum  " + describe(bank.drum()));
        lines.addAll(list(bank.effects(), (i, effect) -> "Effect " + effectLabel(i) + "  " + effect));
        return lines;
    }

    private static String describe(SinglePatch single) {
        return String.format("%s volume=%s effect=%s", single.name(), single.volume(), single.effect());
    }

    private static String describe(MultiPatch multi) {
        return String.format("%s volume=%s effect=%s", multi.name(), multi.volume(), multi.effect());
    }

    private static String describe(DrumPatch drum) {
        return String.format("channel=%s volume=%s velocity depth=%s", drum.common().channel(),
                drum.common().volume(), drum.common().velocityDepth());
    }

    private static String effectLabel(int index) {
        return String.format("%2d", index + 1);
    }

    private static <T> List<String> list(List<T> values, BiFunction<Integer, T, String> line) {
        List<String> lines = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            lines.add(line.apply(i, values.get(i)));
        }
        return lines;
    }

    private static <T> Inspection report(String title, Decoded<T> decoded, Function<T, List<String>> lines) {
        return new Inspection(title, lines.apply(decoded.value()), decoded.checksumMismatches());
    }
}
