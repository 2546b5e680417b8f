package com.largomodo.ksynth.k5000;

import com.largomodo.ksynth.core.BoundedValue;
import com.largomodo.ksynth.core.ByteReader;
import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.SysexCodec;

import java.util.Objects;

import static com.largomodo.ksynth.core.BoundedValue.require;
import static com.largomodo.ksynth.core.Category.BENDER_CUTOFF;
import static com.largomodo.ksynth.core.Category.BENDER_PITCH;
import static com.largomodo.ksynth.core.Category.EFFECT_PATH;
import static com.largomodo.ksynth.core.Category.KEY;
import static com.largomodo.ksynth.core.Category.UNSIGNED_LEVEL;

/**
 * Keyboard zone, velocity switch, bender and modulation routing of one source
 * (28 bytes).
 */
public record SourceControl(BoundedValue zoneLow, BoundedValue zoneHigh, VelocitySwitchSettings velocitySwitch,
                            BoundedValue effectPath, BoundedValue volume, BoundedValue benderPitch,
                            BoundedValue benderCutoff, ModulationSettings modulation, BoundedValue keyOnDelay,
                            PanSettings pan) {

    public static final int DATA_SIZE = 28;
    public static final SysexCodec<SourceControl> CODEC =
            SysexCodec.of("K5000 source control", DATA_SIZE, SourceControl::read, SourceControl::write);

    public SourceControl {
        require(zoneLow, KEY, "zoneLow");
        require(zoneHigh, KEY, "zoneHigh");
        Objects.requireNonNull(velocitySwitch, "velocitySwitch must not be null");
        require(effectPath, EFFECT_PATH, "effectPath");
        require(volume, UNSIGNED_LEVEL, "volume");
        require(benderPitch, BENDER_PITCH, "benderPitch");
        require(benderCutoff, BENDER_CUTOFF, "benderCutoff");
        Objects.requireNonNull(modulation, "modulation must not be null");
        require(keyOnDelay, UNSIGNED_LEVEL, "keyOnDelay");
        Objects.requireNonNull(pan, "pan must not be null");
    }

    public static SourceControl defaults() {
        return new SourceControl(BoundedValue.zero(KEY), BoundedValue.of(KEY, 127),
                VelocitySwitchSettings.defaults(), BoundedValue.zero(EFFECT_PATH),
                BoundedValue.of(UNSIGNED_LEVEL, 120), BoundedValue.zero(BENDER_PITCH),
                BoundedValue.zero(BENDER_CUTOFF), ModulationSettings.defaults(), BoundedValue.zero(UNSIGNED_LEVEL),
                PanSettings.defaults());
    }

    public static SourceControl read(ByteReader in) {
        BoundedValue zoneLow = in.readValue(KEY);
        BoundedValue zoneHigh = in.readValue(KEY);
        VelocitySwitchSettings velocitySwitch = in.read(VelocitySwitchSettings.CODEC);
        BoundedValue effectPath = in.readValue(EFFECT_PATH);
        BoundedValue volume = in.readValue(UNSIGNED_LEVEL);
        BoundedValue benderPitch = in.readValue(BENDER_PITCH);
        BoundedValue benderCutoff = in.readValue(BENDER_CUTOFF);
        ModulationSettings modulation = in.read(ModulationSettings.CODEC);
        BoundedValue keyOnDelay = in.readValue(UNSIGNED_LEVEL);
        return new SourceControl(zoneLow, zoneHigh, velocitySwitch, effectPath, volume, benderPitch, benderCutoff,
                modulation, keyOnDelay, in.read(PanSettings.CODEC));
    }

    public void write(ByteWriter out) {
        out.writeValue(zoneLow);
        out.writeValue(zoneHigh);
        out.write(VelocitySwitchSettings.CODEC, velocitySwitch);
        out.writeValue(effectPath);
        out.writeValue(volume);
        out.writeValue(benderPitch);
        out.writeValue(benderCutoff);
        out.write(ModulationSettings.CODEC, modulation);
        out.writeValue(keyOnDelay);
        out.write(PanSettings.CODEC, pan);
    }
}
