package com.largomodo.ksynth.k4;

import java.util.List;

/**
 * The sixteen K4 effect algorithms, stored on the wire as 0-15.
 * <p>
 * Each algorithm names its three parameters.
 */
public enum EffectType {
    REVERB_1("Reverb 1", "Pre.delay", "Rev.Time", "Tone"),
    REVERB_2("Reverb 2", "Pre.delay", "Rev.Time", "Tone"),
    REVERB_3("Reverb 3", "Pre.delay", "Rev.Time", "Tone"),
    REVERB_4("Reverb 4", "Pre.delay", "Rev.Time", "Tone"),
    GATE_REVERB("Gate Reverb", "Pre.delay", "Gate Time", "Tone"),
    REVERSE_GATE("Reverse Gate", "Pre.delay", "Gate Time", "Tone"),
    NORMAL_DELAY("Normal Delay", "Feedback", "Tone", "Delay"),
    STEREO_PANPOT_DELAY("Stereo Panpot Delay", "Feedback", "L/R Delay", "Delay"),
    CHORUS("Chorus", "Width", "Feedback", "Rate"),
    OVERDRIVE_FLANGER("Overdrive + Flanger", "Drive", "Fl.Type", "1-2 Bal"),
    OVERDRIVE_NORMAL_DELAY("Overdrive + Normal Delay", "Drive", "Delay Time", "1-2 Bal"),
    OVERDRIVE_REVERB("Overdrive + Reverb", "Drive", "Rev.Type", "1-2 Bal"),
    NORMAL_DELAY_NORMAL_DELAY("Normal Delay + Normal Delay", "Delay1", "Delay2", "1-2 Bal"),
    NORMAL_DELAY_STEREO_PANPOT_DELAY("Normal Delay + Stereo Panpot Delay", "Delay1", "Delay2", "1-2 Bal"),
    CHORUS_NORMAL_DELAY("Chorus + Normal Delay", "Chorus", "Delay", "1-2 Bal"),
    CHORUS_STEREO_PANPOT_DELAY("Chorus + Stereo Panpot Delay", "Chorus", "Delay", "1-2 Bal");

    private final String displayName;
    private final List<String> parameterNames;

    EffectType(String displayName, String... parameterNames) {
        this.displayName = displayName;
        this.parameterNames = List.of(parameterNames);
    }

    public String displayName() {
        return displayName;
    }

    public List<String> parameterNames() {
        return parameterNames;
    }

    /**
     * One-based number shown on the instrument's display.
     */
    public int number() {
        return ordinal() + 1;
    }
}
