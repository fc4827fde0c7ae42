package aqtsim.cmd;

import aqtsim.config.BatchConfig;
import aqtsim.config.JsonConfigCodec;
import aqtsim.simulation.Simulation;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Command-line entry point: loads a configuration file and runs every simulation it describes.
 *
 * Usage: {@code --config=<file> [--parallel=true|false]}. The optional {@code --parallel} flag
 * overrides the file's own setting.
 */
public class SimulatorApplication {

    private final Path configPath;
    private final Optional<Boolean> parallelOverride;

    public SimulatorApplication(Path configPath, Optional<Boolean> parallelOverride) {
        this.configPath = configPath;
        this.parallelOverride = parallelOverride;
    }

    /**
     * Main method for command-line execution.
     * @param args Command-line arguments
     */
    public static void main(String[] args) {
        System.out.println("Arguments: " + String.join(" ", args));

        SimulatorApplication application;
        try {
            application = SimulatorApplication.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("Usage: --config=<file> [--parallel=true|false]");
            System.exit(2);
            return;
        }

        try {
            application.run();
        } catch (RuntimeException e) {
            System.err.println("Simulation failed: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    public static SimulatorApplication fromArgs(String[] args) {
        Path configPath = null;
        Optional<Boolean> parallel = Optional.empty();
        for (String arg : args) {
            if (arg.startsWith("--config=")) configPath = Path.of(arg.substring(9));
            else if (arg.startsWith("--parallel=")) parallel = Optional.of(parseBoolean(arg.substring(11)));
            else throw new IllegalArgumentException("Unknown argument: " + arg);
        }
        if (configPath == null) {
            throw new IllegalArgumentException("Missing --config=<file>");
        }
        return new SimulatorApplication(configPath, parallel);
    }

    private static boolean parseBoolean(String value) {
        if (value.equalsIgnoreCase("true")) return true;
        if (value.equalsIgnoreCase("false")) return false;
        throw new IllegalArgumentException("Expected true or false, got: " + value);
    }

    /**
     * Loads the configuration and runs the batch.
     *
     * @return the stopping round of every simulation, in configuration order
     */
    public List<Long> run() {
        System.out.println("Loading configuration from " + configPath + "...");
        BatchConfig config = JsonConfigCodec.readBatch(configPath);
        if (parallelOverride.isPresent()) {
            config = config.withParallel(parallelOverride.get());
        }

        System.out.println("Running " + config.simulations().size() + " simulation(s)"
                + (config.parallel() ? " in parallel" : " sequentially") + "...");
        List<Long> rounds = config.toBatch().run();

        for (int i = 0; i < rounds.size(); i++) {
            Simulation simulation = config.simulations().get(i);
            System.out.println("Simulation " + simulation.name() + " stopped in round " + rounds.get(i)
                    + " with total load " + simulation.network().totalLoad());
        }
        return rounds;
    }

    public Path getConfigPath() { return configPath; }
    public Optional<Boolean> getParallelOverride() { return parallelOverride; }
}
