package com.largomodo.ksynth.inspect;

import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.Decoded;
import com.largomodo.ksynth.core.SysexDecoder;
import com.largomodo.ksynth.k5000.MultiPatch;
import com.largomodo.ksynth.k5000.SingleBlock;
import com.largomodo.ksynth.k5000.SinglePatch;
import com.largomodo.ksynth.k5000.ToneMap;
import com.largomodo.ksynth.k5000.sysex.BankIdentifier;
import com.largomodo.ksynth.k5000.sysex.Cardinality;
import com.largomodo.ksynth.k5000.sysex.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.PrimitiveIterator;

/**
 * Inspects K5000 single and multi dumps. Drum kit and drum instrument dumps
 * are classified but their data is not decoded.
 */
public class K5000Inspector implements DumpInspector {

    private static final Logger log = LoggerFactory.getLogger(K5000Inspector.class);

    @Override
    public Inspection inspect(byte[] message, SysexDecoder decoder) {
        Header header = Header.parse(message);
        log.debug("Classified {}", header);
        String title = String.format("K5000 %s, channel %s", header.dump(), header.channel());
        byte[] payload = Arrays.copyOfRange(message, header.size(), message.length);
        boolean one = header.dump().cardinality() == Cardinality.ONE;

        return switch (header.dump().kind()) {
            case SINGLE -> one ? oneSingle(title, header, payload, decoder) : blockSingle(title, header, payload,
                    decoder);
            case MULTI -> one ? oneMulti(title, header, payload, decoder) : blockMulti(title, payload, decoder);
            case DRUM_KIT, DRUM_INSTRUMENT -> {
                log.info("{} data is not decoded", header.dump().kind().displayName());
                yield new Inspection(title, List.of(payload.length + " bytes of drum data (not decoded)"),
                        List.of());
            }
        };
    }

    private static Inspection oneSingle(String title, Header header, byte[] payload, SysexDecoder decoder) {
        Decoded<SinglePatch> decoded = decoder.decode(SinglePatch::read, payload);
        String slot = slotName(header.dump().bank().orElseThrow(), header.patchNumber().orElseThrow());
        return new Inspection(title, List.of(slot + "  " + decoded.value()), decoded.checksumMismatches());
    }

    private static Inspection blockSingle(String title, Header header, byte[] payload, SysexDecoder decoder) {
        ToneMap toneMap = header.toneMap().orElseGet(ToneMap::full);
        BankIdentifier bank = header.dump().bank().orElseThrow();
        Decoded<SingleBlock> decoded = decoder.decode(in -> SingleBlock.read(in, toneMap), payload);
        List<String> entries = new ArrayList<>(toneMap.count());
        PrimitiveIterator.OfInt tones = toneMap.stream().iterator();
        for (SinglePatch patch : decoded.value().patches()) {
            entries.add(slotName(bank, tones.nextInt()) + "  " + patch);
        }
        return new Inspection(title, entries, decoded.checksumMismatches());
    }

    private static Inspection oneMulti(String title, Header header, byte[] payload, SysexDecoder decoder) {
        Decoded<MultiPatch> decoded = decoder.decode(MultiPatch.CODEC, payload);
        String slot = String.format("M%02d", header.patchNumber().orElseThrow() + 1);
        return new Inspection(title, List.of(slot + "  " + describe(decoded.value())), decoded.checksumMismatches());
    }

    private static Inspection blockMulti(String title, byte[] payload, SysexDecoder decoder) {
        Decoded<List<MultiPatch>> decoded = decoder.decode(K5000Inspector::readMultis, payload);
        List<String> entries = new ArrayList<>(MultiPatch.BLOCK_COUNT);
        List<MultiPatch> multis = decoded.value();
        for (int i = 0; i < multis.size(); i++) {
            entries.add(String.format("M%02d  %s", i + 1, describe(multis.get(i))));
        }
        return new Inspection(title, entries, decoded.checksumMismatches());
    }

    private static List<MultiPatch> readMultis(ByteReader in) {
        List<MultiPatch> multis = new ArrayList<>(MultiPatch.BLOCK_COUNT);
        for (int i = 0; i < MultiPatch.BLOCK_COUNT; i++) {
            multis.add(in.read(MultiPatch.CODEC));
        }
        return multis;
    }

    private static String describe(MultiPatch multi) {
        return String.format("%s volume=%s", multi.name(), multi.volume());
    }

    static String slotName(BankIdentifier bank, int tone) {
        return String.format("%s%03d", bank, tone + 1);
    }
}
