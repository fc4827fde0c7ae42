package aqtsim.adversary;

import aqtsim.network.BufferNetwork;
import aqtsim.packet.Packet;

import java.util.List;

/**
 * Decides which packets enter the network each round. Every adversary owns the
 * {@link aqtsim.packet.PacketFactory} that mints its packets.
 */
public sealed interface Adversary permits PathRandomAdversary, PresetAdversary {

    /**
     * Called once per round, before forwarding.
     *
     * @param network the network as it stands after the previous round
     * @param round the current round; it becomes the injection round of every returned packet
     * @return the packets to inject, possibly none
     */
    List<Packet> nextPackets(BufferNetwork network, long round);

    AdversaryType type();
}
