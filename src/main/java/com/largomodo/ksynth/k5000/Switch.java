package com.largomodo.ksynth.k5000;

/**
 * Functions assignable to the panel switches and foot switches.
 */
public enum Switch {
    OFF("Off"),
    HARM_MAX("Max harmonics"),
    HARM_BRIGHT("Bright harmonics"),
    HARM_DARK("Dark harmonics"),
    HARM_SAW("Saw harmonics"),
    SELECT_LOUD("Select loud"),
    ADD_LOUD("Add loud"),
    ADD_FIFTH("Add fifth"),
    ADD_ODD("Add odd"),
    ADD_EVEN("Add even"),
    HE1("Harmonic Env 1"),
    HE2("Harmonic Env 2"),
    HARMONIC_ENVELOPE_LOOP("Harmonic envelope loop"),
    FF_MAX("Formant filter max"),
    FF_COMB("Formant filter comb"),
    FF_HI_CUT("Formant filter high cut"),
    FF_COMB2("Formant filter comb 2");

    private final String displayName;

    Switch(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
