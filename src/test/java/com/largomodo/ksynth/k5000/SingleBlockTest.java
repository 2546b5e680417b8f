package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.ParseError;
import com.largomodo.ksynth.core.SysexParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SingleBlockTest {

    private SinglePatch pcm;
    private SinglePatch additive;
    private byte[] data;

    @BeforeEach
    void setUp() {
        pcm = SinglePatch.of("Piano", 2, 0);
        additive = SinglePatch.of("Organ", 1, 2);
        ByteWriter out = new ByteWriter();
        new SingleBlock(ToneMap.of(2, 5), List.of(pcm, additive)).write(out);
        data = out.toByteArray();
    }

    @Test
    void singlesOfDifferentSizeFollowEachOther() {
        assertEquals(pcm.dataSize() + additive.dataSize(), data.length);

        SingleBlock block = SingleBlock.read(new ByteReader(data), ToneMap.of(2, 5));

        assertEquals(List.of(pcm, additive), block.patches());
        assertEquals(additive, block.patch(5).orElseThrow());
        assertEquals(pcm, block.patch(2).orElseThrow());
        assertTrue(block.patch(3).isEmpty());
    }

    @Test
    void failureNamesTheSlotAndKeepsTheKind() {
        byte[] truncated = Arrays.copyOf(data, data.length - 10);

        SysexParseException e = assertThrows(SysexParseException.class,
                () -> SingleBlock.read(new ByteReader(truncated), ToneMap.of(2, 5)));
        assertEquals(ParseError.TOO_SHORT, e.kind());
        assertTrue(e.getMessage().startsWith("Single in slot 6: "), e.getMessage());
        assertInstanceOf(SysexParseException.class, e.getCause());
    }

    @Test
    void patchCountMustMatchToneMap() {
        assertThrows(IllegalArgumentException.class, () -> new SingleBlock(ToneMap.of(1, 2, 3), List.of(pcm)));
    }
}
