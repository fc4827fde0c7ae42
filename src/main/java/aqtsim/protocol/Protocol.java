package aqtsim.protocol;

import aqtsim.network.BufferNetwork;
import aqtsim.packet.Packet;

import java.util.List;

/**
 * A forwarding protocol decides, once per round, which packets move and in which direction.
 *
 * The set of protocols is closed; adding one means adding a {@link ProtocolType} constant and a
 * permitted implementation.
 *
 * Contract for {@link #forwardPackets(BufferNetwork)}:
 * - every decision is taken from the network as it stood at the start of the call
 * - moved packets are reinserted only after all decisions have been applied
 * - packets that reach the end of their path are removed and returned
 */
public sealed interface Protocol permits GreedyProtocol, OedWithSwap {

    /**
     * Creates a protocol of the given type.
     *
     * @param capacity packets each buffer may forward per round; ignored by OED with swap
     * @throws IllegalArgumentException if the capacity is not positive for a greedy protocol
     */
    static Protocol create(ProtocolType type, int capacity) {
        return switch (type) {
            case GREEDY_FIFO -> new GreedyFifo(capacity);
            case GREEDY_LIS -> new GreedyLis(capacity);
            case OED_WITH_SWAP -> new OedWithSwap();
        };
    }

    /**
     * Adds a packet to the back of the buffer between its current and next node.
     *
     * @throws IllegalStateException if the packet has no next node to travel to
     * @throws IllegalArgumentException if the network has no buffer for that hop
     */
    default void addPacket(Packet packet, BufferNetwork network) {
        if (packet.isAbsorbed() || packet.nextNode().isEmpty()) {
            throw new IllegalStateException("Cannot add " + packet + " to the network: it has no next hop");
        }
        // Protocols rely on new arrivals going to the back.
        network.push(packet, packet.currentNode().getAsInt(), packet.nextNode().getAsInt());
    }

    /**
     * Forwards packets for one round.
     *
     * @return the packets absorbed during this round, in move order
     */
    List<Packet> forwardPackets(BufferNetwork network);

    /**
     * @return the number of packets a buffer may forward per round
     */
    int capacity();

    ProtocolType type();
}
