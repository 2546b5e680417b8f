package com.largomodo.ksynth.k5000;

public enum PanKind {
    NORMAL("Normal"),
    RANDOM("Random"),
    KEY_SCALE("Key scale"),
    NEGATIVE_KEY_SCALE("Negative key scale");

    private final String displayName;

    PanKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
