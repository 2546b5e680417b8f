package com.largomodo.ksynth.k5000;

/**
 * Velocity switch type of a source, bits 5-6 of the switch byte.
 */
public enum VelocitySwitch {
    OFF("Off"),
    LOUD("Loud"),
    SOFT("Soft");

    private final String displayName;

    VelocitySwitch(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
