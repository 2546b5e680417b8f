package com.largomodo.ksynth.k4;

/**
 * Waveform shared by the vibrato and the LFO.
 */
public enum LfoShape {
    TRIANGLE, SAW, SQUARE, RANDOM
}
