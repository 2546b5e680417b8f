package com.largomodo.ksynth.k5000.sysex;

import com.largomodo.ksynth.core.Coded;

/**
 * Function codes of K5000 exclusive messages.
 */
public enum Function implements Coded {
    ONE_BLOCK_DUMP_REQUEST(0x00, "One Block Dump Request"),
    ALL_BLOCK_DUMP_REQUEST(0x01, "All Block Dump Request"),
    PARAMETER_SEND(0x10, "Parameter Send"),
    TRACK_CONTROL(0x11, "Track Control"),
    ONE_BLOCK_DUMP(0x20, "One Block Dump"),
    ALL_BLOCK_DUMP(0x21, "All Block Dump"),
    MODE_CHANGE(0x31, "Mode Change"),
    REMOTE(0x32, "Remote"),
    WRITE_COMPLETE(0x40, "Write Complete"),
    WRITE_ERROR(0x41, "Write Error"),
    WRITE_ERROR_BY_PROTECT(0x42, "Write Error (Protect)"),
    WRITE_ERROR_BY_MEMORY_FULL(0x44, "Write Error (Memory Full)"),
    WRITE_ERROR_BY_NO_EXPANDED_MEMORY(0x45, "Write Error (No Expanded Memory)");

    private final int code;
    private final String displayName;

    Function(int code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    @Override
    public int code() {
        return code;
    }

    public String displayName() {
        return displayName;
    }
}
