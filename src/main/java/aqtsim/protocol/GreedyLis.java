package aqtsim.protocol;

import aqtsim.packet.Packet;

import java.util.List;

/**
 * Greedy longest-in-system: every buffer forwards up to {@code capacity} packets, each time the one
 * with the smallest injection round. Only age is compared; equal rounds go to the first in the
 * buffer.
 */
public final class GreedyLis extends GreedyProtocol {

    public GreedyLis(int capacity) {
        super(capacity);
    }

    @Override
    protected int selectNext(List<Packet> buffer) {
        int oldest = 0;
        for (int i = 1; i < buffer.size(); i++) {
            if (buffer.get(i).injectionRound() < buffer.get(oldest).injectionRound()) {
                oldest = i;
            }
        }
        return oldest;
    }

    @Override
    public ProtocolType type() {
        return ProtocolType.GREEDY_LIS;
    }
}
