package aqtsim.packet;

import java.util.List;
import java.util.OptionalInt;

/**
 * A packet travelling through a buffer network along a fixed path of node indices.
 *
 * The id and the path never change. The cursor marks the node the packet currently occupies and is
 * moved only by forwarding protocols. A packet whose cursor equals the path length is absorbed.
 *
 * Packets can only be created through a {@link PacketFactory}, which guarantees unique ids.
 * Equality is based on the id alone.
 */
public final class Packet {

    private final long id;
    private final List<Integer> path;
    private final long injectionRound;
    private int cursor;

    Packet(long id, List<Integer> path, long injectionRound, int cursor) {
        this.id = id;
        this.path = path;
        this.injectionRound = injectionRound;
        this.cursor = cursor;
    }

    public long id() {
        return id;
    }

    /**
     * @return the immutable list of node indices this packet must traverse
     */
    public List<Integer> path() {
        return path;
    }

    public long injectionRound() {
        return injectionRound;
    }

    public int cursor() {
        return cursor;
    }

    /**
     * Moves the packet one node forward along its path.
     *
     * @throws IllegalStateException if the packet has already been absorbed
     */
    public void advance() {
        if (isAbsorbed()) {
            throw new IllegalStateException("Packet " + id + " has already been absorbed");
        }
        cursor++;
    }

    /**
     * Moves the packet one node backward along its path.
     *
     * @throws IllegalStateException if the packet is at the start of its path
     */
    public void retreat() {
        if (cursor == 0) {
            throw new IllegalStateException("Packet " + id + " is already at the beginning of its path");
        }
        cursor--;
    }

    public boolean isAbsorbed() {
        return cursor == path.size();
    }

    /**
     * @return true if the packet sits on the last node of its path, so the next advance absorbs it
     */
    public boolean willAbsorbNext() {
        return cursor == path.size() - 1;
    }

    /**
     * @return the node the packet currently occupies, empty if absorbed
     */
    public OptionalInt currentNode() {
        return nodeAt(cursor);
    }

    /**
     * @return the node the packet moves to on its next advance, empty if absorbed or about to be
     */
    public OptionalInt nextNode() {
        return nodeAt(cursor + 1);
    }

    /**
     * Number of forward moves left before the packet reaches the end of its path.
     */
    public int hopsToGo() {
        return Math.max(0, path.size() - 1 - cursor);
    }

    private OptionalInt nodeAt(int index) {
        if (index < 0 || index >= path.size()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(path.get(index));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Packet other)) return false;
        return id == other.id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "Packet{id=" + id + ", node=" + (currentNode().isPresent() ? currentNode().getAsInt() : "absorbed")
                + ", injectionRound=" + injectionRound + "}";
    }
}
