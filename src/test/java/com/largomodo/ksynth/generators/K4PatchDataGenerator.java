package com.largomodo.ksynth.generators;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.k4.Amplifier;
import com.largomodo.ksynth.k4.AutoBend;
import com.largomodo.ksynth.k4.DrumNote;
import com.largomodo.ksynth.k4.DrumSource;
import com.largomodo.ksynth.k4.EffectPatch;
import com.largomodo.ksynth.k4.EffectType;
import com.largomodo.ksynth.k4.Envelope;
import com.largomodo.ksynth.k4.Filter;
import com.largomodo.ksynth.k4.FilterEnvelope;
import com.largomodo.ksynth.k4.LevelModulation;
import com.largomodo.ksynth.k4.Lfo;
import com.largomodo.ksynth.k4.LfoShape;
import com.largomodo.ksynth.k4.MultiPatch;
import com.largomodo.ksynth.k4.MultiSection;
import com.largomodo.ksynth.k4.PlayMode;
import com.largomodo.ksynth.k4.PolyphonyMode;
import com.largomodo.ksynth.k4.SinglePatch;
import com.largomodo.ksynth.k4.Source;
import com.largomodo.ksynth.k4.SourceMode;
import com.largomodo.ksynth.k4.Submix;
import com.largomodo.ksynth.k4.SubmixSettings;
import com.largomodo.ksynth.k4.TimeModulation;
import com.largomodo.ksynth.k4.VelocitySwitch;
import com.largomodo.ksynth.k4.Vibrato;
import com.largomodo.ksynth.k4.WheelAssign;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;

import java.util.List;

import static com.largomodo.ksynth.core.Category.*;
import static com.largomodo.ksynth.generators.PatchDataGenerator.boundedValues;
import static com.largomodo.ksynth.generators.PatchDataGenerator.names;
import static net.jqwik.api.Arbitraries.*;

/**
 * Arbitraries for K4 patches and their parts, covering every legal value of
 * every field.
 */
public class K4PatchDataGenerator {

    public static Arbitrary<Source> sources() {
        // bits 0-1 hold the two switches, bits 2-4 the velocity curve index
        return Combinators.combine(
                boundedValues(LEVEL),
                boundedValues(WAVE_NUMBER),
                boundedValues(CURVE),
                boundedValues(COARSE),
                of(true, false),
                boundedValues(KEY),
                boundedValues(DEPTH),
                integers().between(0, 31)
        ).as((delay, wave, ksCurve, coarse, keyTrack, fixedKey, fine, packed) ->
                new Source(delay, wave, ksCurve, coarse, keyTrack, fixedKey, fine, (packed & 1) != 0,
                        (packed & 2) != 0, BoundedValue.of(CURVE, 1 + (packed >> 2))));
    }

    public static Arbitrary<Envelope> envelopes() {
        return Combinators.combine(boundedValues(LEVEL), boundedValues(LEVEL), boundedValues(LEVEL),
                boundedValues(LEVEL)).as(Envelope::new);
    }

    public static Arbitrary<FilterEnvelope> filterEnvelopes() {
        return Combinators.combine(boundedValues(LEVEL), boundedValues(LEVEL), boundedValues(DEPTH),
                boundedValues(LEVEL)).as(FilterEnvelope::new);
    }

    public static Arbitrary<LevelModulation> levelModulations() {
        return Combinators.combine(boundedValues(DEPTH), boundedValues(DEPTH), boundedValues(DEPTH))
                .as(LevelModulation::new);
    }

    public static Arbitrary<TimeModulation> timeModulations() {
        return Combinators.combine(boundedValues(DEPTH), boundedValues(DEPTH), boundedValues(DEPTH))
                .as(TimeModulation::new);
    }

    public static Arbitrary<Amplifier> amplifiers() {
        return Combinators.combine(boundedValues(LEVEL), envelopes(), levelModulations(), timeModulations())
                .as(Amplifier::new);
    }

    public static Arbitrary<Filter> filters() {
        return Combinators.combine(
                boundedValues(LEVEL),
                boundedValues(RESONANCE),
                of(true, false),
                levelModulations(),
                boundedValues(DEPTH),
                boundedValues(DEPTH),
                filterEnvelopes(),
                timeModulations()
        ).as(Filter::new);
    }

    public static Arbitrary<AutoBend> autoBends() {
        return Combinators.combine(boundedValues(LEVEL), boundedValues(DEPTH), boundedValues(DEPTH),
                boundedValues(DEPTH)).as(AutoBend::new);
    }

    public static Arbitrary<Vibrato> vibratos() {
        return Combinators.combine(of(LfoShape.class), boundedValues(LEVEL), boundedValues(DEPTH),
                boundedValues(DEPTH)).as(Vibrato::new);
    }

    public static Arbitrary<Lfo> lfos() {
        return Combinators.combine(of(LfoShape.class), boundedValues(LEVEL), boundedValues(LEVEL),
                boundedValues(DEPTH), boundedValues(DEPTH)).as(Lfo::new);
    }

    public static Arbitrary<List<Boolean>> sourceMutes() {
        return of(true, false).list().ofSize(SinglePatch.SOURCE_COUNT);
    }

    /**
     * Singles built in three passes: the panel settings, then the controllers,
     * then the sources and filters.
     */
    public static Arbitrary<SinglePatch> singlePatches() {
        SinglePatch base = SinglePatch.defaults();
        Arbitrary<SinglePatch> panel = Combinators.combine(
                names(SinglePatch.NAME_LENGTH),
                boundedValues(LEVEL),
                boundedValues(EFFECT_NUMBER),
                of(Submix.class),
                of(SourceMode.class),
                of(PolyphonyMode.class),
                of(true, false),
                of(true, false)
        ).as((name, volume, effect, submix, sourceMode, polyphony, am12, am34) ->
                new SinglePatch(name, volume, effect, submix, sourceMode, polyphony, am12, am34,
                        base.sourceMuted(), base.benderRange(), base.wheelAssign(), base.wheelDepth(),
                        base.autoBend(), base.vibrato(), base.lfo(), base.pressureFrequency(), base.sources(),
                        base.amplifiers(), base.filter1(), base.filter2()));
        Arbitrary<SinglePatch> controlled = Combinators.combine(
                panel,
                sourceMutes(),
                boundedValues(BENDER_RANGE),
                of(WheelAssign.class),
                boundedValues(DEPTH),
                autoBends(),
                vibratos(),
                lfos()
        ).as((p, muted, benderRange, wheelAssign, wheelDepth, autoBend, vibrato, lfo) ->
                new SinglePatch(p.name(), p.volume(), p.effect(), p.submix(), p.sourceMode(), p.polyphonyMode(),
                        p.am12(), p.am34(), muted, benderRange, wheelAssign, wheelDepth, autoBend, vibrato, lfo,
                        p.pressureFrequency(), p.sources(), p.amplifiers(), p.filter1(), p.filter2()));
        return Combinators.combine(
                controlled,
                boundedValues(DEPTH),
                sources().list().ofSize(SinglePatch.SOURCE_COUNT),
                amplifiers().list().ofSize(SinglePatch.SOURCE_COUNT),
                filters(),
                filters()
        ).as((p, pressureFrequency, sources, amplifiers, filter1, filter2) ->
                new SinglePatch(p.name(), p.volume(), p.effect(), p.submix(), p.sourceMode(), p.polyphonyMode(),
                        p.am12(), p.am34(), p.sourceMuted(), p.benderRange(), p.wheelAssign(), p.wheelDepth(),
                        p.autoBend(), p.vibrato(), p.lfo(), pressureFrequency, sources, amplifiers, filter1,
                        filter2));
    }

    public static Arbitrary<MultiSection> multiSections() {
        Arbitrary<MultiSection> keys = Combinators.combine(
                boundedValues(SINGLE_NUMBER),
                boundedValues(KEY),
                boundedValues(KEY),
                boundedValues(CHANNEL),
                of(VelocitySwitch.class),
                of(true, false),
                of(Submix.class),
                of(PlayMode.class)
        ).as((single, low, high, channel, velocitySwitch, muted, submix, playMode) ->
                new MultiSection(single, low, high, channel, velocitySwitch, muted, submix, playMode,
                        BoundedValue.zero(LEVEL), BoundedValue.zero(COARSE), BoundedValue.zero(DEPTH)));
        return Combinators.combine(keys, boundedValues(LEVEL), boundedValues(COARSE), boundedValues(DEPTH))
                .as((s, level, transpose, tune) -> new MultiSection(s.singleNumber(), s.lowKey(), s.highKey(),
                        s.receiveChannel(), s.velocitySwitch(), s.muted(), s.submix(), s.playMode(), level,
                        transpose, tune));
    }

    public static Arbitrary<MultiPatch> multiPatches() {
        return Combinators.combine(
                names(SinglePatch.NAME_LENGTH),
                boundedValues(LEVEL),
                boundedValues(EFFECT_NUMBER),
                multiSections().list().ofSize(MultiPatch.SECTION_COUNT)
        ).as(MultiPatch::new);
    }

    public static Arbitrary<SubmixSettings> submixSettings() {
        return Combinators.combine(boundedValues(EFFECT_PARAMETER), boundedValues(LEVEL), boundedValues(LEVEL))
                .as(SubmixSettings::new);
    }

    public static Arbitrary<EffectPatch> effectPatches() {
        return Combinators.combine(
                of(EffectType.class),
                boundedValues(EFFECT_PARAMETER),
                boundedValues(EFFECT_PARAMETER),
                boundedValues(EFFECT_VALUE),
                submixSettings().list().ofSize(EffectPatch.SUBMIX_COUNT)
        ).as(EffectPatch::new);
    }

    public static Arbitrary<DrumSource> drumSources() {
        return Combinators.combine(boundedValues(WAVE_NUMBER), boundedValues(LEVEL), boundedValues(DEPTH),
                boundedValues(LEVEL)).as(DrumSource::new);
    }

    public static Arbitrary<DrumNote> drumNotes() {
        return Combinators.combine(of(Submix.class), drumSources(), drumSources()).as(DrumNote::new);
    }
}
