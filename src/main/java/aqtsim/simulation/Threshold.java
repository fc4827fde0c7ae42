package aqtsim.simulation;

import aqtsim.network.BufferNetwork;

/**
 * Decides when a simulation ends. Polled twice per round: after injection and after forwarding.
 */
public sealed interface Threshold permits TimedThreshold, TotalLoadThreshold {

    boolean shouldStop(long round, BufferNetwork network);

    ThresholdType type();
}
