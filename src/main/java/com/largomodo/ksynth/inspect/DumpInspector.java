package com.largomodo.ksynth.inspect;

import com.largomodo.ksynth.core.SysexDecoder;

/**
 * Classifies and decodes the messages of one instrument family.
 */
public interface DumpInspector {

    /**
     * @param message bytes after the manufacturer ID, without the end marker
     * @param decoder decoder carrying the checksum policy to apply
     * @throws com.largomodo.ksynth.core.SysexParseException if the message cannot be classified or decoded
     */
    Inspection inspect(byte[] message, SysexDecoder decoder);
}
