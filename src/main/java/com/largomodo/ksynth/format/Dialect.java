package com.largomodo.ksynth.format;

import java.util.Optional;

/**
 * Instrument families whose dumps this tool reads, told apart by the group and
 * machine ID bytes that follow the channel and function bytes.
 */
public enum Dialect {
    K4(0x04),
    K5000(0x0A);

    private static final int GROUP = 0x00;
    private static final int GROUP_OFFSET = 2;
    private static final int MACHINE_OFFSET = 3;

    private final int machineId;

    Dialect(int machineId) {
        this.machineId = machineId;
    }

    public int machineId() {
        return machineId;
    }

    /**
     * @param message message bytes starting at the channel byte (after F0 40)
     */
    public static Optional<Dialect> detect(byte[] message) {
        if (message.length <= MACHINE_OFFSET || message[GROUP_OFFSET] != GROUP) {
            return Optional.empty();
        }
        for (Dialect dialect : values()) {
            if ((message[MACHINE_OFFSET] & 0xFF) == dialect.machineId) {
                return Optional.of(dialect);
            }
        }
        return Optional.empty();
    }
}
