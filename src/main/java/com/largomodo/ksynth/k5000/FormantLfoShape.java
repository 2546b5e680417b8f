package com.largomodo.ksynth.k5000;

public enum FormantLfoShape {
    TRIANGLE, SAWTOOTH, RANDOM
}
