package com.largomodo.ksynth.k5000;

/**
 * Ring-style amplitude modulation between adjacent sources.
 */
public enum AmplitudeModulation {
    OFF("OFF"),
    SOURCE2("1->2"),
    SOURCE3("2->3"),
    SOURCE4("3->4"),
    SOURCE5("4->5"),
    SOURCE6("5->6");

    private final String displayName;

    AmplitudeModulation(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
