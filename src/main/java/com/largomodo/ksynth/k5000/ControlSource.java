package com.largomodo.ksynth.k5000;

/**
 * Performance controllers that can drive an assignable or effect control.
 */
public enum ControlSource {
    BENDER("Bender"),
    CHANNEL_PRESSURE("Channel pressure"),
    WHEEL("Wheel"),
    EXPRESSION("Expression"),
    MIDI_VOLUME("MIDI volume"),
    PAN_POT("Pan pot"),
    GENERAL_CONTROLLER_1("General controller 1"),
    GENERAL_CONTROLLER_2("General controller 2"),
    GENERAL_CONTROLLER_3("General controller 3"),
    GENERAL_CONTROLLER_4("General controller 4"),
    GENERAL_CONTROLLER_5("General controller 5"),
    GENERAL_CONTROLLER_6("General controller 6"),
    GENERAL_CONTROLLER_7("General controller 7"),
    GENERAL_CONTROLLER_8("General controller 8");

    private final String displayName;

    ControlSource(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
