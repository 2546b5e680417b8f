package com.largomodo.ksynth.k4.sysex;

/**
 * What a K4 data dump carries.
 */
public enum DumpKind {
    ONE_SINGLE,
    ONE_MULTI,
    DRUM,
    ONE_EFFECT,
    BLOCK_SINGLE,
    BLOCK_MULTI,
    BLOCK_EFFECT,
    ALL
}
