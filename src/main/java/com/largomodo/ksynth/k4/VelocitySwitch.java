package com.largomodo.ksynth.k4;

/**
 * Velocity range a multi section responds to.
 */
public enum VelocitySwitch {
    ALL, SOFT, LOUD
}
