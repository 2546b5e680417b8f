package com.largomodo.ksynth.inspect;

import com.largomodo.ksynth.format.Dialect;

/**
 * Factory for creating dialect-specific dump inspectors.
 * <p>
 * Inspectors are stateless, so one instance per dialect is shared.
 */
public class InspectorFactory {

    private final K4Inspector k4Inspector;
    private final K5000Inspector k5000Inspector;

    public InspectorFactory() {
        this.k4Inspector = new K4Inspector();
        this.k5000Inspector = new K5000Inspector();
    }

    public DumpInspector get(Dialect dialect) {
        return switch (dialect) {
            case K4 -> k4Inspector;
            case K5000 -> k5000Inspector;
        };
    }
}
