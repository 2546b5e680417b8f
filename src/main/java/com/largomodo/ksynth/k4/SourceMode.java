package com.largomodo.ksynth.k4;

/**
 * How the four sources of a single are paired.
 */
public enum SourceMode {
    NORMAL, TWIN, DOUBLE
}
