package com.largomodo.ksynth.k5000;

public enum EffectDestination {
    EFFECT1_DRY_WET("Effect 1 dry/wet"),
    EFFECT1_PARAMETER("Effect 1 parameter"),
    EFFECT2_DRY_WET("Effect 2 dry/wet"),
    EFFECT2_PARAMETER("Effect 2 parameter"),
    EFFECT3_DRY_WET("Effect 3 dry/wet"),
    EFFECT3_PARAMETER("Effect 3 parameter"),
    EFFECT4_DRY_WET("Effect 4 dry/wet"),
    EFFECT4_PARAMETER("Effect 4 parameter");

    private final String displayName;

    EffectDestination(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
