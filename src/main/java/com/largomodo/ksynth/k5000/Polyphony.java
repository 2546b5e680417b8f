package com.largomodo.ksynth.k5000;

public enum Polyphony {
    POLY("POLY"),
    SOLO1("SOLO1"),
    SOLO2("SOLO2");

    private final String displayName;

    Polyphony(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
