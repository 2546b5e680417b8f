package com.largomodo.ksynth.k5000;

/**
 * Envelope loop setting of the harmonic and formant envelopes.
 */
public enum LoopType {
    OFF, LOOP1, LOOP2
}
