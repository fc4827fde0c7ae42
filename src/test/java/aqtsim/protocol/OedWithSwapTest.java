package aqtsim.protocol;

import aqtsim.network.BufferNetwork;
import aqtsim.network.topology.Topology;
import aqtsim.packet.Packet;
import aqtsim.packet.PacketFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OedWithSwapTest {

    private BufferNetwork network;
    private PacketFactory factory;
    private OedWithSwap protocol;

    @BeforeEach
    void setUp() {
        network = Topology.path(10).toNetwork();
        factory = new PacketFactory();
        protocol = new OedWithSwap();
    }

    private static List<Integer> nodes(int fromInclusive, int toInclusive) {
        List<Integer> path = new ArrayList<>();
        for (int node = fromInclusive; node <= toInclusive; node++) {
            path.add(node);
        }
        return path;
    }

    private Packet inject(List<Integer> path, long round, int cursor) {
        Packet packet = factory.create(path, round, cursor);
        protocol.addPacket(packet, network);
        return packet;
    }

    private Packet injectOnFullPath(long round, int cursor) {
        return inject(nodes(0, 10), round, cursor);
    }

    @Test
    void shouldAbsorbPacketLeavingTheLastBufferOfItsPath() {
        // Given - a packet whose path ends at node 9, sitting in buffer (8, 9)
        Packet packet = inject(nodes(0, 9), 0, 8);

        // When
        List<Packet> absorbed = protocol.forwardPackets(network);

        // Then
        assertEquals(List.of(), network.peek(8, 9).orElseThrow());
        assertEquals(List.of(packet), absorbed);
        assertTrue(packet.isAbsorbed());
        assertEquals(0, network.totalLoad());
    }

    @Test
    void shouldForwardOldestPacketFirst() {
        // Given
        Packet older = injectOnFullPath(0, 0);
        Packet younger = injectOnFullPath(1, 0);

        // When
        List<Packet> absorbed = protocol.forwardPackets(network);

        // Then
        assertTrue(absorbed.isEmpty());
        assertEquals(List.of(older), network.peek(1, 2).orElseThrow());
        assertEquals(List.of(younger), network.peek(0, 1).orElseThrow());
    }

    @Test
    void shouldSwapYoungestBackwardOnEvenTie() {
        // Given - loads 2 and 2 on (0, 1) and (1, 2): the OED criterion fails for (0, 1)
        Packet r0 = injectOnFullPath(0, 0);
        Packet r1Upstream = injectOnFullPath(1, 0);
        Packet r1Downstream = injectOnFullPath(1, 1);
        Packet r2 = injectOnFullPath(2, 1);

        // When
        protocol.forwardPackets(network);

        // Then - the oldest of (0, 1) advances and the youngest of (1, 2) moves back
        assertEquals(1, r0.cursor());
        assertEquals(0, r2.cursor());
        assertEquals(List.of(r1Upstream, r2), network.peek(0, 1).orElseThrow());
        assertEquals(List.of(r0), network.peek(1, 2).orElseThrow());
        // (1, 2) holds more than the empty (2, 3), so it also forwards its oldest
        assertEquals(List.of(r1Downstream), network.peek(2, 3).orElseThrow());
        assertEquals(4, network.totalLoad());
    }

    @Test
    void shouldAbsorbOnlyWhenCursorReachesPathEnd() {
        Packet packet = inject(nodes(0, 4), 0, 0);

        for (int round = 1; round <= 3; round++) {
            assertTrue(protocol.forwardPackets(network).isEmpty());
            assertEquals(round, packet.cursor());
        }

        assertEquals(List.of(packet), protocol.forwardPackets(network));
    }

    @Test
    void shouldForwardOnOddTie() {
        // Given - loads 1 and 1: the OED criterion holds because the load is odd
        Packet young = injectOnFullPath(5, 0);
        Packet old = injectOnFullPath(0, 1);

        // When
        protocol.forwardPackets(network);

        // Then
        assertEquals(List.of(young), network.peek(1, 2).orElseThrow());
        assertEquals(List.of(old), network.peek(2, 3).orElseThrow());
        assertEquals(0, network.load(0, 1));
    }

    @Test
    void shouldHoldBackWhenDownstreamPacketsAreOlder() {
        // Given - even tie, and everything downstream is older than everything upstream
        Packet r3 = injectOnFullPath(3, 0);
        Packet r4 = injectOnFullPath(4, 0);
        Packet r0 = injectOnFullPath(0, 1);
        Packet r1 = injectOnFullPath(1, 1);

        // When
        protocol.forwardPackets(network);

        // Then - (0, 1) keeps both packets and nothing is swapped backward
        assertEquals(List.of(r3, r4), network.peek(0, 1).orElseThrow());
        assertEquals(List.of(r1), network.peek(1, 2).orElseThrow());
        assertEquals(List.of(r0), network.peek(2, 3).orElseThrow());
    }

    @Test
    void shouldNotSwapWhenUpstreamPairSatisfiesCriterion() {
        // Given - (0, 1) has more packets than (1, 2)
        injectOnFullPath(0, 0);
        injectOnFullPath(1, 0);
        injectOnFullPath(2, 0);
        Packet youngDownstream = injectOnFullPath(9, 1);
        Packet oldDownstream = injectOnFullPath(8, 1);

        // When
        protocol.forwardPackets(network);

        // Then - no packet went back; (1, 2) forwarded its oldest and received one from (0, 1)
        assertEquals(2, network.load(0, 1));
        assertEquals(List.of(oldDownstream), network.peek(2, 3).orElseThrow());
        assertEquals(1, youngDownstream.cursor());
        assertEquals(2, network.load(1, 2));
    }

    @Test
    void shouldNotSendPacketBackBeyondTheStartOfItsPath() {
        // Given - the youngest packet of (1, 2) starts its path at node 1
        Packet r0 = injectOnFullPath(0, 0);
        Packet r1Upstream = injectOnFullPath(1, 0);
        Packet r1Downstream = injectOnFullPath(1, 1);
        Packet startsAtOne = inject(nodes(1, 10), 2, 0);

        // When
        protocol.forwardPackets(network);

        // Then
        assertEquals(0, startsAtOne.cursor());
        assertEquals(List.of(r1Upstream), network.peek(0, 1).orElseThrow());
        assertEquals(List.of(startsAtOne, r0), network.peek(1, 2).orElseThrow());
        assertEquals(List.of(r1Downstream), network.peek(2, 3).orElseThrow());
    }

    @Test
    void shouldAlwaysDrainTheLastBuffer() {
        // Given - three packets in the last buffer, destined for its head node
        BufferNetwork shortPath = Topology.path(2).toNetwork();
        List<Packet> packets = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            Packet packet = factory.create(List.of(0, 1, 2), i, 1);
            protocol.addPacket(packet, shortPath);
            packets.add(packet);
        }

        // When / Then - one packet per round, oldest first
        assertEquals(List.of(packets.get(0)), protocol.forwardPackets(shortPath));
        assertEquals(List.of(packets.get(1)), protocol.forwardPackets(shortPath));
        assertEquals(List.of(packets.get(2)), protocol.forwardPackets(shortPath));
        assertTrue(protocol.forwardPackets(shortPath).isEmpty());
    }

    @Test
    void shouldMoveAtMostOnePacketForwardPerBuffer() {
        for (int i = 0; i < 6; i++) {
            injectOnFullPath(i, 0);
        }

        protocol.forwardPackets(network);

        assertEquals(5, network.load(0, 1));
        assertEquals(1, network.load(1, 2));
    }

    @Test
    void shouldDecideFromStateAtStartOfRound() {
        // Given - (1, 2) is empty at the start of the round, so it cannot forward the packet
        // that (0, 1) hands to it in the same round
        Packet packet = injectOnFullPath(0, 0);

        // When
        protocol.forwardPackets(network);

        // Then
        assertEquals(1, packet.cursor());
        assertEquals(List.of(packet), network.peek(1, 2).orElseThrow());
    }

    @Test
    void shouldRejectNetworkThatIsNotAPath() {
        BufferNetwork notAPath = Topology.of(List.of(List.of(2), List.of(), List.of())).toNetwork();

        assertThrows(IllegalStateException.class, () -> protocol.forwardPackets(notAPath));
    }

    @Test
    void shouldDoNothingOnEmptyNetwork() {
        assertTrue(protocol.forwardPackets(network).isEmpty());
        assertTrue(protocol.forwardPackets(new BufferNetwork()).isEmpty());
        assertEquals(0, network.totalLoad());
    }
}
