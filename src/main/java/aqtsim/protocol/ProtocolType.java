package aqtsim.protocol;

import java.util.Arrays;
import java.util.Optional;

/**
 * The closed set of forwarding protocols, with the names used in configuration files.
 */
public enum ProtocolType {
    GREEDY_FIFO("greedy_fifo"),
    GREEDY_LIS("greedy_lis"),
    OED_WITH_SWAP("oed_with_swap");

    private final String configName;

    ProtocolType(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    public static Optional<ProtocolType> fromConfigName(String name) {
        return Arrays.stream(values())
                .filter(type -> type.configName.equals(name))
                .findFirst();
    }
}
