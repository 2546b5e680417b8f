package com.largomodo.ksynth.k5000;

/**
 * Parameters a macro or assignable controller can offset.
 */
public enum ControlDestination {
    PITCH_OFFSET("Pitch offset"),
    CUTOFF_OFFSET("Cutoff offset"),
    LEVEL("Level"),
    VIBRATO_DEPTH_OFFSET("Vibrato depth offset"),
    GROWL_DEPTH_OFFSET("Growl depth offset"),
    TREMOLO_DEPTH_OFFSET("Tremolo depth offset"),
    LFO_SPEED_OFFSET("LFO speed offset"),
    ATTACK_TIME_OFFSET("Attack time offset"),
    DECAY1_TIME_OFFSET("Decay 1 time offset"),
    RELEASE_TIME_OFFSET("Release time offset"),
    VELOCITY_OFFSET("Velocity offset"),
    RESONANCE_OFFSET("Resonance offset"),
    PAN_POT_OFFSET("Pan pot offset"),
    FORMANT_FILTER_BIAS_OFFSET("Formant filter bias offset"),
    FORMANT_FILTER_ENVELOPE_LFO_DEPTH_OFFSET("Formant filter envelope LFO depth offset"),
    FORMANT_FILTER_ENVELOPE_LFO_SPEED_OFFSET("Formant filter envelope LFO speed offset"),
    HARMONIC_LOW_OFFSET("Harmonic low offset"),
    HARMONIC_HIGH_OFFSET("Harmonic high offset"),
    HARMONIC_EVEN_OFFSET("Harmonic even offset"),
    HARMONIC_ODD_OFFSET("Harmonic odd offset");

    private final String displayName;

    ControlDestination(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
