package aqtsim.protocol;

import aqtsim.network.BufferNetwork;
import aqtsim.network.EdgeId;
import aqtsim.packet.Packet;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy protocols forward as many packets from every buffer as the capacity allows. Subclasses
 * only choose which packet of a buffer goes next.
 */
public abstract sealed class GreedyProtocol implements Protocol permits GreedyFifo, GreedyLis {

    private final int capacity;

    protected GreedyProtocol(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1, got: " + capacity);
        }
        this.capacity = capacity;
    }

    @Override
    public List<Packet> forwardPackets(BufferNetwork network) {
        List<Packet> moved = new ArrayList<>();
        for (EdgeId edge : network.edges()) {
            List<Packet> buffer = network.peekMut(edge.from(), edge.to()).orElseThrow();
            int count = Math.min(capacity, buffer.size());
            for (int i = 0; i < count; i++) {
                Packet packet = buffer.remove(selectNext(buffer));
                packet.advance();
                moved.add(packet);
            }
        }
        return Moves.replay(this, moved, network);
    }

    /**
     * @param buffer a non-empty buffer
     * @return the index of the packet to forward next
     */
    protected abstract int selectNext(List<Packet> buffer);

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{capacity=" + capacity + "}";
    }
}
