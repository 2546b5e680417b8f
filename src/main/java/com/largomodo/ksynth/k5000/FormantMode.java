package com.largomodo.ksynth.k5000;

/**
 * Whether the formant filter bias follows its envelope or its LFO.
 */
public enum FormantMode {
    ENVELOPE, LFO
}
