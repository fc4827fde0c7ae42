package aqtsim.simulation;

import java.util.Arrays;
import java.util.Optional;

public enum RecorderType {
    DEBUG_PRINT("debug_print"),
    BUFFER_LOAD_CSV("buffer_load_csv"),
    ABSORPTION_CSV("absorption_csv");

    private final String configName;

    RecorderType(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    public static Optional<RecorderType> fromConfigName(String name) {
        return Arrays.stream(values())
                .filter(type -> type.configName.equals(name))
                .findFirst();
    }
}
