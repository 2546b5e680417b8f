package com.largomodo.ksynth.k5000;

/**
 * Harmonic group the total gain applies to.
 */
public enum HarmonicGroup {
    LOW, HIGH
}
