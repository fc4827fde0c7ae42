package aqtsim.simulation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs a set of independent simulations, one after the other or on a fixed thread pool.
 * Simulations share no state, so no coordination is needed beyond waiting for them.
 * The first failure aborts the batch: it is rethrown as soon as it happens and the remaining
 * simulations are interrupted.
 */
public class SimulationBatch {

    private final List<Simulation> simulations;
    private final boolean parallel;

    public SimulationBatch(List<Simulation> simulations, boolean parallel) {
        this.simulations = List.copyOf(Objects.requireNonNull(simulations, "Simulations cannot be null"));
        this.parallel = parallel;
    }

    /**
     * @return the stopping round of every simulation, in batch order
     */
    public List<Long> run() {
        if (!parallel || simulations.size() < 2) {
            List<Long> rounds = new ArrayList<>(simulations.size());
            for (Simulation simulation : simulations) {
                rounds.add(simulation.run());
            }
            return rounds;
        }
        return runParallel();
    }

    private List<Long> runParallel() {
        int threads = Math.min(simulations.size(), Runtime.getRuntime().availableProcessors());
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CompletionService<Long> completion = new ExecutorCompletionService<>(executor);
        try {
            Map<Future<Long>, Integer> indices = new HashMap<>();
            for (int i = 0; i < simulations.size(); i++) {
                Simulation simulation = simulations.get(i);
                indices.put(completion.submit(simulation::run), i);
            }
            // Taken in completion order, not batch order.
            Long[] rounds = new Long[simulations.size()];
            for (int done = 0; done < simulations.size(); done++) {
                Future<Long> future = completion.take();
                int index = indices.get(future);
                try {
                    rounds[index] = future.get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof RuntimeException runtime) {
                        throw runtime;
                    }
                    if (cause instanceof Error error) {
                        throw error;
                    }
                    throw new IllegalStateException("Simulation " + simulations.get(index).name() + " failed", cause);
                }
            }
            return Arrays.asList(rounds);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for simulations", e);
        } finally {
            // Interrupts simulations still running; they stop at their next round.
            executor.shutdownNow();
        }
    }

    public List<Simulation> simulations() {
        return simulations;
    }

    public boolean isParallel() {
        return parallel;
    }
}
