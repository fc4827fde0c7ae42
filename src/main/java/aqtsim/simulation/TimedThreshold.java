package aqtsim.simulation;

import aqtsim.network.BufferNetwork;

/**
 * Stops the simulation once the round number reaches {@code maxRounds}.
 */
public record TimedThreshold(long maxRounds) implements Threshold {

    public TimedThreshold {
        if (maxRounds < 1) {
            throw new IllegalArgumentException("Max rounds must be positive, got: " + maxRounds);
        }
    }

    @Override
    public boolean shouldStop(long round, BufferNetwork network) {
        return round >= maxRounds;
    }

    @Override
    public ThresholdType type() {
        return ThresholdType.TIMED;
    }
}
