package aqtsim.protocol;

import aqtsim.packet.Packet;

import java.util.List;

/**
 * Greedy FIFO: every buffer forwards up to {@code capacity} packets from its front.
 */
public final class GreedyFifo extends GreedyProtocol {

    public GreedyFifo(int capacity) {
        super(capacity);
    }

    @Override
    protected int selectNext(List<Packet> buffer) {
        return 0;
    }

    @Override
    public ProtocolType type() {
        return ProtocolType.GREEDY_FIFO;
    }
}
