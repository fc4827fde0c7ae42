package aqtsim.packet;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class PacketTest {

    private PacketFactory factory;

    @BeforeEach
    void setUp() {
        factory = new PacketFactory();
    }

    @Test
    void shouldWalkThroughPathUntilAbsorbed() {
        // Given
        Packet packet = factory.create(List.of(1, 4, 9, 16), 0, 0);
        assertEquals(0, packet.cursor());
        assertEquals(OptionalInt.of(1), packet.currentNode());
        assertEquals(OptionalInt.of(4), packet.nextNode());
        assertEquals(3, packet.hopsToGo());

        // When
        packet.advance();

        // Then
        assertEquals(1, packet.cursor());
        assertEquals(OptionalInt.of(4), packet.currentNode());
        assertEquals(OptionalInt.of(9), packet.nextNode());
        assertEquals(2, packet.hopsToGo());

        packet.advance();
        packet.advance();
        assertTrue(packet.willAbsorbNext());
        assertEquals(OptionalInt.of(16), packet.currentNode());
        assertEquals(OptionalInt.empty(), packet.nextNode());
        assertEquals(0, packet.hopsToGo());

        packet.advance();
        assertTrue(packet.isAbsorbed());
        assertFalse(packet.willAbsorbNext());
        assertEquals(OptionalInt.empty(), packet.currentNode());
        assertEquals(OptionalInt.empty(), packet.nextNode());
    }

    @Test
    void shouldRejectAdvancingAbsorbedPacket() {
        Packet packet = factory.create(List.of(0, 1), 0, 2);
        assertTrue(packet.isAbsorbed());

        assertThrows(IllegalStateException.class, packet::advance);
        assertEquals(2, packet.cursor());
    }

    @Test
    void shouldRejectRetreatingAtPathStart() {
        Packet packet = factory.create(List.of(0, 1, 2), 0, 0);

        assertThrows(IllegalStateException.class, packet::retreat);
        assertEquals(0, packet.cursor());
    }

    @Test
    void shouldRetreatOneNode() {
        Packet packet = factory.create(List.of(0, 1, 2, 3), 5, 2);

        packet.retreat();

        assertEquals(1, packet.cursor());
        assertEquals(OptionalInt.of(1), packet.currentNode());
        assertEquals(OptionalInt.of(2), packet.nextNode());
    }

    @Test
    void shouldCompareByIdOnly() {
        // Given - two factories hand out the same ids
        Packet first = factory.create(List.of(0, 1), 0, 0);
        Packet sameId = new PacketFactory().create(List.of(5, 6, 7), 9, 1);
        Packet other = factory.create(List.of(0, 1), 0, 0);

        // Then
        assertEquals(first, sameId);
        assertEquals(first.hashCode(), sameId.hashCode());
        assertNotEquals(first, other);
    }

    @Test
    void shouldExposeImmutablePath() {
        Packet packet = factory.create(List.of(0, 1, 2), 0, 0);

        assertThrows(UnsupportedOperationException.class, () -> packet.path().add(3));
    }
}
