package aqtsim.util;

/**
 * Central flag to enable/disable per-round debug printing, set with {@code -Daqtsim.debug=true}.
 */
public final class DebugConfig {
    private DebugConfig() {}

    public static final boolean ENABLED = Boolean.getBoolean("aqtsim.debug");
}
