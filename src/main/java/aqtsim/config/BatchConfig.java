package aqtsim.config;

import aqtsim.simulation.Simulation;
import aqtsim.simulation.SimulationBatch;

import java.util.List;
import java.util.Objects;

/**
 * A parsed configuration file: the simulations to run and whether to run them in parallel.
 */
public record BatchConfig(boolean parallel, List<Simulation> simulations) {

    public BatchConfig {
        Objects.requireNonNull(simulations, "Simulations cannot be null");
        simulations = List.copyOf(simulations);
    }

    public SimulationBatch toBatch() {
        return new SimulationBatch(simulations, parallel);
    }

    public BatchConfig withParallel(boolean parallel) {
        return new BatchConfig(parallel, simulations);
    }
}
