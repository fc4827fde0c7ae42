package aqtsim.simulation;

import aqtsim.adversary.Adversary;
import aqtsim.config.JsonConfigCodec;
import aqtsim.network.BufferNetwork;
import aqtsim.network.topology.Topology;
import aqtsim.packet.Packet;
import aqtsim.protocol.Protocol;
import aqtsim.util.DebugConfig;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One simulation run: a network, the protocol forwarding on it, the adversary injecting into it,
 * the threshold ending it and the recorders observing it.
 *
 * Each round, starting at 1, runs in strict order:
 * 1. the adversary's packets are added through the protocol
 * 2. recorders observe the post-injection state; the threshold is checked
 * 3. the protocol forwards packets
 * 4. recorders observe the post-forwarding state and absorbed packets; the threshold is checked
 *
 * A simulation owns all of its components, so independent simulations can run on different threads.
 */
public class Simulation {

    public static final String CONFIG_FILE_NAME = "sim_config.json";

    private final BufferNetwork network;
    private final Protocol protocol;
    private final Adversary adversary;
    private final Threshold threshold;
    private final List<Recorder> recorders;
    private final Path outputDirectory;
    private final String name;

    private long currentRound = 0;
    private boolean started = false;

    private Simulation(Builder builder) {
        this.network = Objects.requireNonNull(builder.network, "Network cannot be null");
        this.protocol = Objects.requireNonNull(builder.protocol, "Protocol cannot be null");
        this.adversary = Objects.requireNonNull(builder.adversary, "Adversary cannot be null");
        this.threshold = Objects.requireNonNull(builder.threshold, "Threshold cannot be null");
        this.recorders = List.copyOf(builder.recorders);
        this.outputDirectory = builder.outputDirectory;
        this.name = builder.name;

        for (Recorder recorder : recorders) {
            if (recorder.writesFiles()) {
                if (outputDirectory == null) {
                    throw new IllegalArgumentException(recorder.type().configName() + " recorder needs an output path");
                }
                recorder.setOutputDirectory(outputDirectory);
            }
        }
    }

    /**
     * Runs rounds until the threshold says stop or the running thread is interrupted. Recorders are
     * closed exactly once, also when writing the configuration or a round fails.
     *
     * @return the round in which the simulation stopped
     * @throws IllegalStateException if the simulation has already been run
     */
    public long run() {
        if (started) {
            throw new IllegalStateException("Simulation " + name + " has already been run");
        }
        started = true;

        RuntimeException failure = null;
        try {
            if (outputDirectory != null) {
                JsonConfigCodec.writeSimulationConfig(this, outputDirectory.resolve(CONFIG_FILE_NAME));
            }
            runRounds();
        } catch (RuntimeException e) {
            failure = e;
            throw e;
        } finally {
            closeRecorders(failure);
        }

        if (DebugConfig.ENABLED) {
            System.out.println("Simulation " + name + " stopped in round " + currentRound
                    + " with total load " + network.totalLoad());
        }
        return currentRound;
    }

    private void runRounds() {
        long round = 1;
        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                throw new IllegalStateException("Simulation " + name + " interrupted before round " + round);
            }
            currentRound = round;

            for (Packet packet : adversary.nextPackets(network, round)) {
                protocol.addPacket(packet, network);
            }
            for (Recorder recorder : recorders) {
                recorder.record(round, false, network, null);
            }
            if (threshold.shouldStop(round, network)) {
                break;
            }

            List<Packet> absorbed = protocol.forwardPackets(network);
            for (Recorder recorder : recorders) {
                recorder.record(round, true, network, absorbed);
            }
            if (DebugConfig.ENABLED) {
                System.out.println("Simulation " + name + " round " + round + ": load=" + network.totalLoad()
                        + ", absorbed=" + absorbed.size());
            }
            if (threshold.shouldStop(round, network)) {
                break;
            }
            round++;
        }
    }

    private void closeRecorders(RuntimeException failure) {
        for (Recorder recorder : recorders) {
            try {
                recorder.close();
            } catch (RuntimeException e) {
                if (failure == null) {
                    throw e;
                }
                failure.addSuppressed(e);
            }
        }
    }

    public BufferNetwork network() {
        return network;
    }

    public Protocol protocol() {
        return protocol;
    }

    public Adversary adversary() {
        return adversary;
    }

    public Threshold threshold() {
        return threshold;
    }

    public List<Recorder> recorders() {
        return recorders;
    }

    public Optional<Path> outputDirectory() {
        return Optional.ofNullable(outputDirectory);
    }

    public String name() {
        return name;
    }

    public long currentRound() {
        return currentRound;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "Simulation{name=" + name + ", protocol=" + protocol + ", adversary=" + adversary.type()
                + ", threshold=" + threshold + "}";
    }

    /**
     * Builder for Simulation with fluent API.
     */
    public static final class Builder {
        private BufferNetwork network;
        private Protocol protocol;
        private Adversary adversary;
        private Threshold threshold;
        private final List<Recorder> recorders = new ArrayList<>();
        private Path outputDirectory;
        private String name = "simulation";

        public Builder network(BufferNetwork network) {
            this.network = network;
            return this;
        }

        public Builder topology(Topology topology) {
            this.network = topology.toNetwork();
            return this;
        }

        public Builder protocol(Protocol protocol) {
            this.protocol = protocol;
            return this;
        }

        public Builder adversary(Adversary adversary) {
            this.adversary = adversary;
            return this;
        }

        public Builder threshold(Threshold threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder recorder(Recorder recorder) {
            this.recorders.add(Objects.requireNonNull(recorder, "Recorder cannot be null"));
            return this;
        }

        public Builder recorders(List<Recorder> recorders) {
            recorders.forEach(this::recorder);
            return this;
        }

        public Builder outputDirectory(Path outputDirectory) {
            this.outputDirectory = outputDirectory;
            return this;
        }

        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "Name cannot be null");
            return this;
        }

        public Simulation build() {
            return new Simulation(this);
        }
    }
}
