package com.largomodo.ksynth.k5000;

/**
 * Pitch key scaling of an oscillator in cents per key.
 */
public enum KeyScalingToPitch {
    ZERO_CENT("0 cent"),
    TWENTY_FIVE_CENT("25 cent"),
    THIRTY_THREE_CENT("33 cent"),
    FIFTY_CENT("50 cent");

    private final String displayName;

    KeyScalingToPitch(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
