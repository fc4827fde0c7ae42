package aqtsim.simulation;

import aqtsim.network.BufferNetwork;

/**
 * Stops the simulation once the packets held across all buffers reach {@code maxLoad}.
 */
public record TotalLoadThreshold(int maxLoad) implements Threshold {

    public TotalLoadThreshold {
        if (maxLoad < 1) {
            throw new IllegalArgumentException("Max load must be positive, got: " + maxLoad);
        }
    }

    @Override
    public boolean shouldStop(long round, BufferNetwork network) {
        return network.totalLoad() >= maxLoad;
    }

    @Override
    public ThresholdType type() {
        return ThresholdType.TOTAL_LOAD;
    }
}
