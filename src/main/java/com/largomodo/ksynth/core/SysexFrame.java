package com.largomodo.ksynth.core;

import java.util.Arrays;

/**
 * Strips and adds the System Exclusive frame around a Kawai message:
 * {@code F0 40 ... F7}.
 */
public class SysexFrame {

    public static final int START = 0xF0;
    public static final int END = 0xF7;
    public static final int KAWAI = 0x40;

    private static final int FRAME_OVERHEAD = 3;

    private SysexFrame() {
        // Static utility class - prevent instantiation
    }

    /**
     * Returns the bytes between the manufacturer ID and the end marker.
     * Input without an end marker is accepted, as some librarians drop it.
     *
     * @throws SysexParseException with kind TOO_SHORT for fewer than two bytes,
     *                             or UNIDENTIFIED if the frame is not a Kawai exclusive message
     */
    public static byte[] unwrap(byte[] message) {
        if (message.length < 2) {
            throw SysexParseException.tooShort(2, message.length);
        }
        if ((message[0] & 0xFF) != START) {
            throw SysexParseException.unidentified(String.format("status byte %02XH, expected F0H", message[0] & 0xFF));
        }
        if ((message[1] & 0xFF) != KAWAI) {
            throw SysexParseException.unidentified(String.format("manufacturer %02XH, expected 40H (Kawai)",
                    message[1] & 0xFF));
        }
        int end = (message[message.length - 1] & 0xFF) == END ? message.length - 1 : message.length;
        return Arrays.copyOfRange(message, 2, end);
    }

    public static byte[] wrap(byte[] body) {
        byte[] message = new byte[body.length + FRAME_OVERHEAD];
        message[0] = (byte) START;
        message[1] = KAWAI;
        System.arraycopy(body, 0, message, 2, body.length);
        message[message.length - 1] = (byte) END;
        return message;
    }
}
