package com.largomodo.ksynth.k4;

public enum PolyphonyMode {
    POLY1, POLY2, SOLO1, SOLO2
}
