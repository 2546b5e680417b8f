package com.largomodo.ksynth.k5000;

import java.util.List;

/**
 * The 48 K5000 effect types, stored on the wire as their ordinal.
 * <p>
 * Types 0-10 are reverbs and may only occupy the reverb slot; types 11-47 are
 * the effects available to effect slots 1-4. Every type names its four
 * parameters, with {@code "?"} for unused ones.
 */
public enum Effect {
    HALL1("Hall 1", "Dry/Wet 2", "Reverb Time", "Predelay Time", "High Frequency Damping"),
    HALL2("Hall 2", "Dry/Wet 2", "Reverb Time", "Predelay Time", "High Frequency Damping"),
    HALL3("Hall 3", "Dry/Wet 2", "Reverb Time", "Predelay Time", "High Frequency Damping"),
    ROOM1("Room 1", "Dry/Wet 2", "Reverb Time", "Predelay Time", "High Frequency Damping"),
    ROOM2("Room 2", "Dry/Wet 2", "Reverb Time", "Predelay Time", "High Frequency Damping"),
    ROOM3("Room 3", "Dry/Wet 2", "Reverb Time", "Predelay Time", "High Frequency Damping"),
    PLATE1("Plate 1", "Dry/Wet 2", "Reverb Time", "Predelay Time", "High Frequency Damping"),
    PLATE2("Plate 2", "Dry/Wet 2", "Reverb Time", "Predelay Time", "High Frequency Damping"),
    PLATE3("Plate 3", "Dry/Wet 2", "Reverb Time", "Predelay Time", "High Frequency Damping"),
    REVERSE("Reverse", "Dry/Wet 2", "Feedback", "Predelay Time", "High Frequency Damping"),
    LONG_DELAY("Long Delay", "Dry/Wet 2", "Feedback", "Delay Time", "High Frequency Damping"),
    EARLY_REFLECTION1("Early Reflection 1", "Slope", "Predelay Time", "Feedback", "?"),
    EARLY_REFLECTION2("Early Reflection 2", "Slope", "Predelay Time", "Feedback", "?"),
    TAP_DELAY1("Tap Delay 1", "Delay Time 1", "Tap Level", "Delay Time 2", "?"),
    TAP_DELAY2("Tap Delay 2", "Delay Time 1", "Tap Level", "Delay Time 2", "?"),
    SINGLE_DELAY("Single Delay", "Delay Time Fine", "Delay Time Coarse", "Feedback", "?"),
    DUAL_DELAY("Dual Delay", "Delay Time Left", "Feedback Left", "Delay Time Right", "Feedback Right"),
    STEREO_DELAY("Stereo Delay", "Delay Time", "Feedback", "?", "?"),
    CROSS_DELAY("Cross Delay", "Delay Time", "Feedback", "?", "?"),
    AUTO_PAN("Auto Pan", "Speed", "Depth", "Predelay Time", "Wave"),
    AUTO_PAN_AND_DELAY("Auto Pan & Delay", "Speed", "Depth", "Delay Time", "Wave"),
    CHORUS1("Chorus 1", "Speed", "Depth", "Predelay Time", "Wave"),
    CHORUS2("Chorus 2", "Speed", "Depth", "Predelay Time", "Wave"),
    CHORUS1_AND_DELAY("Chorus 1 & Delay", "Speed", "Depth", "Delay Time", "Wave"),
    CHORUS2_AND_DELAY("Chorus 2 & Delay", "Speed", "Depth", "Delay Time", "Wave"),
    FLANGER1("Flanger 1", "Speed", "Depth", "Predelay Time", "Feedback"),
    FLANGER2("Flanger 2", "Speed", "Depth", "Predelay Time", "Feedback"),
    FLANGER1_AND_DELAY("Flanger 1 & Delay", "Speed", "Depth", "Delay Time", "Feedback"),
    FLANGER2_AND_DELAY("Flanger 2 & Delay", "Speed", "Depth", "Delay Time", "Feedback"),
    ENSEMBLE("Ensemble", "Depth", "Predelay Time", "?", "?"),
    ENSEMBLE_AND_DELAY("Ensemble & Delay", "Depth", "Delay Time", "?", "?"),
    CELESTE("Celeste", "Speed", "Depth", "Predelay Time", "?"),
    CELESTE_AND_DELAY("Celeste & Delay", "Speed", "Depth", "Delay Time", "?"),
    TREMOLO("Tremolo", "Speed", "Depth", "Predelay Time", "Wave"),
    TREMOLO_AND_DELAY("Tremolo & Delay", "Speed", "Depth", "Delay Time", "Wave"),
    PHASER1("Phaser 1", "Speed", "Depth", "Predelay Time", "Feedback"),
    PHASER2("Phaser 2", "Speed", "Depth", "Predelay Time", "Feedback"),
    PHASER1_AND_DELAY("Phaser 1 & Delay", "Speed", "Depth", "Delay Time", "Feedback"),
    PHASER2_AND_DELAY("Phaser 2 & Delay", "Speed", "Depth", "Delay Time", "Feedback"),
    ROTARY("Rotary", "Slow Speed", "Fast Speed", "Acceleration", "Slow/Fast Switch"),
    AUTO_WAH("Auto Wah", "Sense", "Frequency Bottom", "Frequency Top", "Resonance"),
    BANDPASS("Bandpass", "Center Frequency", "Bandwidth", "?", "?"),
    EXCITER("Exciter", "EQ Low", "EQ High", "Intensity", "?"),
    ENHANCER("Enhancer", "EQ Low", "EQ High", "Intensity", "?"),
    OVERDRIVE("Overdrive", "EQ Low", "EQ High", "Output Level", "Drive"),
    DISTORTION("Distortion", "EQ Low", "EQ High", "Output Level", "Drive"),
    OVERDRIVE_AND_DELAY("Overdrive & Delay", "EQ Low", "EQ High", "Delay Time", "Drive"),
    DISTORTION_AND_DELAY("Distortion & Delay", "EQ Low", "EQ High", "Delay Time", "Drive");

    public static final int FIRST_NON_REVERB = 11;

    private final String displayName;
    private final List<String> parameterNames;

    Effect(String displayName, String... parameterNames) {
        this.displayName = displayName;
        this.parameterNames = List.of(parameterNames);
    }

    public String displayName() {
        return displayName;
    }

    public List<String> parameterNames() {
        return parameterNames;
    }

    public boolean isReverb() {
        return ordinal() < FIRST_NON_REVERB;
    }
}
