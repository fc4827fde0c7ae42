package aqtsim.simulation;

import java.util.Arrays;
import java.util.Optional;

public enum ThresholdType {
    TIMED("timed"),
    TOTAL_LOAD("total_load");

    private final String configName;

    ThresholdType(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    public static Optional<ThresholdType> fromConfigName(String name) {
        return Arrays.stream(values())
                .filter(type -> type.configName.equals(name))
                .findFirst();
    }
}
