package com.largomodo.ksynth.k5000;

public enum FilterMode {
    LOW_PASS, HIGH_PASS
}
