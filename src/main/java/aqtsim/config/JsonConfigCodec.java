package aqtsim.config;

import aqtsim.adversary.*;
import aqtsim.network.BufferNetwork;
import aqtsim.network.topology.Topology;
import aqtsim.protocol.Protocol;
import aqtsim.protocol.ProtocolType;
import aqtsim.simulation.*;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes simulation configurations as JSON.
 *
 * A configuration file holds {@code {"parallel": bool, "simulations": [...]}}; each simulation is
 * an object with the keys {@code graph_adjacency}, {@code protocol}, {@code adversary},
 * {@code threshold}, {@code recorders} and {@code output_path} (plus an optional {@code name}).
 * Components are tagged records, e.g. {@code {"protocol_name": "greedy_fifo", "capacity": 2}}.
 */
public final class JsonConfigCodec {

    public static final String PARALLEL_KEY = "parallel";
    public static final String SIMULATIONS_KEY = "simulations";

    public static final String NAME_KEY = "name";
    public static final String ADJACENCY_KEY = "graph_adjacency";
    public static final String PROTOCOL_KEY = "protocol";
    public static final String ADVERSARY_KEY = "adversary";
    public static final String THRESHOLD_KEY = "threshold";
    public static final String RECORDERS_KEY = "recorders";
    public static final String OUTPUT_PATH_KEY = "output_path";

    public static final String PROTOCOL_NAME_KEY = "protocol_name";
    public static final String CAPACITY_KEY = "capacity";
    public static final String ADVERSARY_NAME_KEY = "adversary_name";
    public static final String SEED_KEY = "seed";
    public static final String INJECTIONS_KEY = "injections";
    public static final String PATH_KEY = "path";
    public static final String CURSOR_KEY = "cursor";
    public static final String THRESHOLD_NAME_KEY = "threshold_name";
    public static final String MAX_ROUNDS_KEY = "max_rds";
    public static final String MAX_LOAD_KEY = "max_load";
    public static final String RECORDER_NAME_KEY = "recorder_name";

    private static final ObjectMapper MAPPER = createConfiguredObjectMapper();

    private JsonConfigCodec() {}

    public static ObjectMapper createConfiguredObjectMapper() {
        return new ObjectMapper();
    }

    // === Batch ===

    public static BatchConfig readBatch(Path file) {
        try {
            return readBatch(Files.readString(file));
        } catch (IOException e) {
            throw new ConfigException("Failed to read configuration " + file, e);
        }
    }

    public static BatchConfig readBatch(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Configuration is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigException("Configuration must be a JSON object");
        }
        JsonNode parallel = root.get(PARALLEL_KEY);
        if (parallel == null || !parallel.isBoolean()) {
            throw new ConfigException("Must provide \"" + PARALLEL_KEY + "\" boolean field in config");
        }
        JsonNode simulations = root.get(SIMULATIONS_KEY);
        if (simulations == null || !simulations.isArray()) {
            throw new ConfigException("Must provide \"" + SIMULATIONS_KEY + "\" array field in config");
        }
        List<Simulation> result = new ArrayList<>();
        for (int i = 0; i < simulations.size(); i++) {
            result.add(readSimulation(simulations.get(i), "simulation-" + i));
        }
        return new BatchConfig(parallel.booleanValue(), result);
    }

    // === Simulation ===

    /**
     * Builds a simulation from one entry of the {@code simulations} array.
     */
    public static Simulation readSimulation(JsonNode node, String defaultName) {
        if (node == null || !node.isObject()) {
            throw new ConfigException("Simulation config must be a JSON object");
        }
        Topology topology = readTopology(required(node, ADJACENCY_KEY, "No graph adjacency found"));
        Simulation.Builder builder = Simulation.builder()
                .name(node.hasNonNull(NAME_KEY) ? node.get(NAME_KEY).asText() : defaultName)
                .network(buildNetwork(topology))
                .protocol(readProtocol(required(node, PROTOCOL_KEY, "No protocol configuration found")))
                .adversary(readAdversary(required(node, ADVERSARY_KEY, "No adversary config found")))
                .threshold(readThreshold(required(node, THRESHOLD_KEY, "No threshold config found")));

        JsonNode recorders = required(node, RECORDERS_KEY, "No recorder configs found");
        if (!recorders.isArray()) {
            throw new ConfigException("\"" + RECORDERS_KEY + "\" must be an array");
        }
        for (JsonNode recorder : recorders) {
            builder.recorder(readRecorder(recorder));
        }

        JsonNode outputPath = required(node, OUTPUT_PATH_KEY, "No output path string found");
        if (!outputPath.isTextual()) {
            throw new ConfigException("No output path string found");
        }
        builder.outputDirectory(Path.of(outputPath.asText()));

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid simulation config: " + e.getMessage(), e);
        }
    }

    public static ObjectNode toJson(Simulation simulation) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put(NAME_KEY, simulation.name());
        node.set(ADJACENCY_KEY, toJson(Topology.fromNetwork(simulation.network())));
        node.set(PROTOCOL_KEY, toJson(simulation.protocol()));
        node.set(ADVERSARY_KEY, toJson(simulation.adversary()));
        node.set(THRESHOLD_KEY, toJson(simulation.threshold()));
        ArrayNode recorders = node.putArray(RECORDERS_KEY);
        for (Recorder recorder : simulation.recorders()) {
            recorders.add(toJson(recorder));
        }
        simulation.outputDirectory().ifPresent(dir -> node.put(OUTPUT_PATH_KEY, dir.toString()));
        return node;
    }

    /**
     * Saves the configuration of a simulation so a run can be reproduced from its output directory.
     * A random adversary's seed is always written, also when it was drawn rather than configured.
     */
    public static void writeSimulationConfig(Simulation simulation, Path file) {
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            Files.writeString(file, MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(simulation)));
        } catch (IOException e) {
            throw new ConfigException("Failed to save simulation config to " + file, e);
        }
    }

    // === Topology ===

    public static Topology readTopology(JsonNode node) {
        if (!node.isArray()) {
            throw new ConfigException("\"" + ADJACENCY_KEY + "\" must be an array of successor arrays");
        }
        List<List<Integer>> adjacency = new ArrayList<>();
        for (JsonNode successors : node) {
            adjacency.add(readIntList(successors, ADJACENCY_KEY));
        }
        return Topology.of(adjacency);
    }

    private static BufferNetwork buildNetwork(Topology topology) {
        try {
            return topology.toNetwork();
        } catch (IndexOutOfBoundsException | IllegalArgumentException e) {
            throw new ConfigException("Invalid graph adjacency: " + e.getMessage(), e);
        }
    }

    public static ArrayNode toJson(Topology topology) {
        ArrayNode node = MAPPER.createArrayNode();
        for (List<Integer> successors : topology.adjacency()) {
            ArrayNode entry = node.addArray();
            successors.forEach(entry::add);
        }
        return node;
    }

    // === Protocol ===

    public static Protocol readProtocol(JsonNode node) {
        String name = requiredText(node, PROTOCOL_NAME_KEY, "No protocol name found");
        ProtocolType type = ProtocolType.fromConfigName(name)
                .orElseThrow(() -> new ConfigException("Unknown protocol: " + name));
        int capacity = node.hasNonNull(CAPACITY_KEY) ? requiredInt(node, CAPACITY_KEY) : 1;
        try {
            return Protocol.create(type, capacity);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid protocol config: " + e.getMessage(), e);
        }
    }

    public static ObjectNode toJson(Protocol protocol) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put(PROTOCOL_NAME_KEY, protocol.type().configName());
        node.put(CAPACITY_KEY, protocol.capacity());
        return node;
    }

    // === Adversary ===

    public static Adversary readAdversary(JsonNode node) {
        String name = requiredText(node, ADVERSARY_NAME_KEY, "No adversary name found");
        AdversaryType type = AdversaryType.fromConfigName(name)
                .orElseThrow(() -> new ConfigException("Unknown adversary: " + name));
        return switch (type) {
            case PATH_RANDOM -> node.hasNonNull(SEED_KEY)
                    ? PathRandomAdversary.seeded(requiredLong(node, SEED_KEY))
                    : PathRandomAdversary.withRandomSeed();
            case PRESET -> new PresetAdversary(readInjections(required(node, INJECTIONS_KEY, "No injections found")));
        };
    }

    private static List<List<Injection>> readInjections(JsonNode node) {
        if (!node.isArray()) {
            throw new ConfigException("\"" + INJECTIONS_KEY + "\" must be an array of rounds");
        }
        List<List<Injection>> rounds = new ArrayList<>();
        for (JsonNode round : node) {
            if (!round.isArray()) {
                throw new ConfigException("Every injection round must be an array");
            }
            List<Injection> injections = new ArrayList<>();
            for (JsonNode injection : round) {
                List<Integer> path = readIntList(required(injection, PATH_KEY, "No injection path found"), PATH_KEY);
                int cursor = injection.hasNonNull(CURSOR_KEY) ? requiredInt(injection, CURSOR_KEY) : 0;
                try {
                    injections.add(Injection.of(path, cursor));
                } catch (IllegalArgumentException e) {
                    throw new ConfigException("Invalid injection: " + e.getMessage(), e);
                }
            }
            rounds.add(injections);
        }
        return rounds;
    }

    public static ObjectNode toJson(Adversary adversary) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put(ADVERSARY_NAME_KEY, adversary.type().configName());
        if (adversary instanceof PathRandomAdversary random) {
            node.put(SEED_KEY, random.seed());
        } else if (adversary instanceof PresetAdversary preset) {
            ArrayNode rounds = node.putArray(INJECTIONS_KEY);
            for (List<Injection> round : preset.rounds()) {
                ArrayNode roundNode = rounds.addArray();
                for (Injection injection : round) {
                    ObjectNode injectionNode = roundNode.addObject();
                    ArrayNode path = injectionNode.putArray(PATH_KEY);
                    injection.path().forEach(path::add);
                    injectionNode.put(CURSOR_KEY, injection.cursor());
                }
            }
        }
        return node;
    }

    // === Threshold ===

    public static Threshold readThreshold(JsonNode node) {
        String name = requiredText(node, THRESHOLD_NAME_KEY, "No threshold name found");
        ThresholdType type = ThresholdType.fromConfigName(name)
                .orElseThrow(() -> new ConfigException("Unknown threshold: " + name));
        try {
            return switch (type) {
                case TIMED -> new TimedThreshold(requiredLong(node, MAX_ROUNDS_KEY));
                case TOTAL_LOAD -> new TotalLoadThreshold(requiredInt(node, MAX_LOAD_KEY));
            };
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid threshold config: " + e.getMessage(), e);
        }
    }

    public static ObjectNode toJson(Threshold threshold) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put(THRESHOLD_NAME_KEY, threshold.type().configName());
        if (threshold instanceof TimedThreshold timed) {
            node.put(MAX_ROUNDS_KEY, timed.maxRounds());
        } else if (threshold instanceof TotalLoadThreshold totalLoad) {
            node.put(MAX_LOAD_KEY, totalLoad.maxLoad());
        }
        return node;
    }

    // === Recorder ===

    public static Recorder readRecorder(JsonNode node) {
        String name = requiredText(node, RECORDER_NAME_KEY, "No recorder name found");
        RecorderType type = RecorderType.fromConfigName(name)
                .orElseThrow(() -> new ConfigException("Unknown recorder: " + name));
        return Recorder.create(type);
    }

    public static ObjectNode toJson(Recorder recorder) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put(RECORDER_NAME_KEY, recorder.type().configName());
        return node;
    }

    // === Helpers ===

    private static JsonNode required(JsonNode node, String key, String message) {
        if (node == null || !node.isObject()) {
            throw new ConfigException(message + ": expected a JSON object");
        }
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            throw new ConfigException(message);
        }
        return value;
    }

    private static String requiredText(JsonNode node, String key, String message) {
        JsonNode value = required(node, key, message);
        if (!value.isTextual()) {
            throw new ConfigException("\"" + key + "\" must be a string");
        }
        return value.asText();
    }

    private static int requiredInt(JsonNode node, String key) {
        JsonNode value = required(node, key, "No \"" + key + "\" found");
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new ConfigException("\"" + key + "\" must be an integer");
        }
        return value.intValue();
    }

    private static long requiredLong(JsonNode node, String key) {
        JsonNode value = required(node, key, "No \"" + key + "\" found");
        if (!value.canConvertToLong() || !value.isIntegralNumber()) {
            throw new ConfigException("\"" + key + "\" must be an integer");
        }
        return value.longValue();
    }

    private static List<Integer> readIntList(JsonNode node, String key) {
        if (!node.isArray()) {
            throw new ConfigException("\"" + key + "\" entries must be arrays of node indices");
        }
        List<Integer> result = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            if (!element.isIntegralNumber() || !element.canConvertToInt()) {
                throw new ConfigException("\"" + key + "\" entries must be integers, got: " + element);
            }
            result.add(element.intValue());
        }
        return result;
    }
}
