package aqtsim.simulation;

import aqtsim.adversary.Injection;
import aqtsim.adversary.PathRandomAdversary;
import aqtsim.adversary.PresetAdversary;
import aqtsim.network.topology.Topology;
import aqtsim.protocol.GreedyLis;
import aqtsim.protocol.OedWithSwap;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.io.PrintStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SimulationBatchTest {

    private static List<Simulation> seededSimulations() {
        List<Simulation> simulations = new ArrayList<>();
        for (long seed = 1; seed <= 4; seed++) {
            simulations.add(Simulation.builder()
                    .name("seed-" + seed)
                    .topology(Topology.path(5))
                    .protocol(seed % 2 == 0 ? new GreedyLis(1) : new OedWithSwap())
                    .adversary(PathRandomAdversary.seeded(seed))
                    .threshold(new TimedThreshold(30 + seed))
                    .build());
        }
        return simulations;
    }

    private static List<String> finalStates(List<Simulation> simulations) {
        List<String> states = new ArrayList<>();
        for (Simulation simulation : simulations) {
            states.add(simulation.network().toString());
        }
        return states;
    }

    @Test
    void shouldRunSequentiallyInOrder() {
        SimulationBatch batch = new SimulationBatch(seededSimulations(), false);

        assertEquals(List.of(31L, 32L, 33L, 34L), batch.run());
        assertFalse(batch.isParallel());
    }

    @Test
    void shouldMatchSequentialRunWhenRunInParallel() {
        // Given
        List<Simulation> sequential = seededSimulations();
        List<Simulation> parallel = seededSimulations();

        // When
        List<Long> sequentialRounds = new SimulationBatch(sequential, false).run();
        List<Long> parallelRounds = new SimulationBatch(parallel, true).run();

        // Then
        assertEquals(sequentialRounds, parallelRounds);
        assertEquals(finalStates(sequential), finalStates(parallel));
    }

    private static Simulation brokenSimulation() {
        // OED with swap cannot run on a network that is not a path
        return Simulation.builder()
                .name("broken")
                .topology(Topology.of(List.of(List.of(2), List.of(), List.of())))
                .protocol(new OedWithSwap())
                .adversary(new PresetAdversary(List.of(List.of(Injection.of(List.of(0, 2), 0)))))
                .threshold(new TimedThreshold(5))
                .build();
    }

    @Test
    void shouldPropagateFailureFromParallelRun() {
        // Given
        List<Simulation> simulations = new ArrayList<>(seededSimulations());
        simulations.add(brokenSimulation());

        // When / Then
        assertThrows(IllegalStateException.class, () -> new SimulationBatch(simulations, true).run());
    }

    @Test
    void shouldFailFastAndInterruptRunningSimulations() throws InterruptedException {
        // Given - a simulation that never reaches its threshold, next to one that fails at once
        CountDownLatch slowClosed = new CountDownLatch(1);
        PrintStream slowOutput = new PrintStream(OutputStream.nullOutputStream()) {
            @Override
            public void println(String line) {
                if ("Simulation finished.".equals(line)) {
                    slowClosed.countDown();
                }
            }
        };
        Simulation slow = Simulation.builder()
                .name("endless")
                .topology(Topology.path(30))
                .protocol(new OedWithSwap())
                .adversary(PathRandomAdversary.seeded(3L))
                .threshold(new TimedThreshold(Long.MAX_VALUE))
                .recorder(new DebugPrintRecorder(slowOutput))
                .build();
        SimulationBatch batch = new SimulationBatch(List.of(brokenSimulation(), slow), true);

        // When / Then - the failure is reported without waiting for the endless run
        assertTimeoutPreemptively(Duration.ofSeconds(10),
                () -> assertThrows(IllegalStateException.class, batch::run));

        // the endless run either never started (single core) or was stopped and closed its recorders
        assertTrue(slow.currentRound() == 0 || slowClosed.await(10, TimeUnit.SECONDS));
    }

    @Test
    void shouldReturnNoRoundsForEmptyBatch() {
        assertTrue(new SimulationBatch(List.of(), true).run().isEmpty());
    }
}
