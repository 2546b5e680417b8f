package com.largomodo.ksynth.k4;

/**
 * Output submix channel A-H.
 */
public enum Submix {
    A, B, C, D, E, F, G, H
}
