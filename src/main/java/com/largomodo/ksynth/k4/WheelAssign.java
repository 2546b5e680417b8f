package com.largomodo.ksynth.k4;

/**
 * Destination of the modulation wheel.
 */
public enum WheelAssign {
    VIBRATO, LFO, DCF
}
