package com.largomodo.ksynth.core;

/**
 * Memory a dump refers to: the instrument's internal memory or an external card.
 */
public enum Locality {
    INTERNAL("INT"),
    EXTERNAL("EXT");

    private final String label;

    Locality(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
