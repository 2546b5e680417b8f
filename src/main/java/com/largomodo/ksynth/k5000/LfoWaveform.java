package com.largomodo.ksynth.k5000;

public enum LfoWaveform {
    TRIANGLE("Triangle"),
    SQUARE("Square"),
    SAWTOOTH("Sawtooth"),
    SINE("Sine"),
    RANDOM("Random");

    private final String displayName;

    LfoWaveform(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
