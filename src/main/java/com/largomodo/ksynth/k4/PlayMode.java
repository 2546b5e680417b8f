package com.largomodo.ksynth.k4;

/**
 * Whether a multi section is played from the keyboard, from MIDI, or both.
 */
public enum PlayMode {
    KEYBOARD, MIDI, MIX
}
