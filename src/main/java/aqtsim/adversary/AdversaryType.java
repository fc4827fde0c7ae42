package aqtsim.adversary;

import java.util.Arrays;
import java.util.Optional;

/**
 * The closed set of adversaries, with the names used in configuration files.
 */
public enum AdversaryType {
    PATH_RANDOM("path_random"),
    PRESET("preset");

    private final String configName;

    AdversaryType(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    public static Optional<AdversaryType> fromConfigName(String name) {
        return Arrays.stream(values())
                .filter(type -> type.configName.equals(name))
                .findFirst();
    }
}
