package com.largomodo.ksynth.core;

/**
 * Enum constant with an explicit wire code that is not its ordinal.
 */
public interface Coded {

    int code();
}
