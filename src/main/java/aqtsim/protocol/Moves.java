package aqtsim.protocol;

import aqtsim.network.BufferNetwork;
import aqtsim.packet.Packet;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Buffer surgery shared by the forwarding protocols. Packets are taken out of their buffers while
 * decisions are applied and only placed into their new buffers once every buffer has been handled.
 */
final class Moves {

    private Moves() {}

    /**
     * Removes the given packet instance from a buffer.
     *
     * @throws IllegalStateException if the packet is not in the buffer
     */
    static void take(List<Packet> buffer, Packet packet) {
        for (Iterator<Packet> it = buffer.iterator(); it.hasNext(); ) {
            if (it.next() == packet) {
                it.remove();
                return;
            }
        }
        throw new IllegalStateException(packet + " is not in the buffer it was selected from");
    }

    /**
     * A packet that has arrived on the final node of its path is absorbed: its cursor is moved past
     * the path end and it is returned instead of being reinserted.
     *
     * @return the absorbed packets in move order
     */
    static List<Packet> replay(Protocol protocol, List<Packet> moved, BufferNetwork network) {
        List<Packet> absorbed = new ArrayList<>();
        for (Packet packet : moved) {
            if (packet.willAbsorbNext()) {
                packet.advance();
                absorbed.add(packet);
            } else {
                protocol.addPacket(packet, network);
            }
        }
        return absorbed;
    }
}
