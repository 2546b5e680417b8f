package com.largomodo.ksynth.k4.sysex;

import com.largomodo.ksynth.core.Coded;

/**
 * Function codes of K4 exclusive messages.
 */
public enum Function implements Coded {
    ONE_PATCH_DUMP_REQUEST(0x00, "One Patch Dump Request"),
    BLOCK_PATCH_DUMP_REQUEST(0x01, "Block Patch Dump Request"),
    ALL_PATCH_DUMP_REQUEST(0x02, "All Patch Dump Request"),
    PARAMETER_SEND(0x10, "Parameter Send"),
    ONE_PATCH_DATA_DUMP(0x20, "One Patch Data Dump"),
    BLOCK_PATCH_DATA_DUMP(0x21, "Block Patch Data Dump"),
    ALL_PATCH_DATA_DUMP(0x22, "All Patch Data Dump"),
    EDIT_BUFFER_DUMP(0x23, "Edit Buffer Dump"),
    PROGRAM_CHANGE(0x30, "Program Change"),
    WRITE_COMPLETE(0x40, "Write Complete"),
    WRITE_ERROR(0x41, "Write Error"),
    WRITE_ERROR_PROTECT(0x42, "Write Error (Protect)"),
    WRITE_ERROR_NO_CARD(0x43, "Write Error (No Card)");

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
