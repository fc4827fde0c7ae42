package aqtsim.packet;

import java.util.List;
import java.util.Objects;

/**
 * The only way to create {@link Packet}s. Ids are handed out from a counter owned by this
 * factory, so they are unique within the factory's lifetime but not across factories.
 *
 * Each packet source (adversary, test fixture) owns its own factory.
 */
public final class PacketFactory {

    private long nextId = 0;

    /**
     * Creates a packet with the next id.
     *
     * @param path the node indices the packet traverses (copied)
     * @param injectionRound the round the packet enters the network
     * @param cursor the initial position in the path
     * @return the new packet
     * @throws IllegalArgumentException if the cursor lies outside {@code [0, path.size()]}
     */
    public Packet create(List<Integer> path, long injectionRound, int cursor) {
        Objects.requireNonNull(path, "Path cannot be null");
        if (cursor < 0 || cursor > path.size()) {
            throw new IllegalArgumentException("Cursor " + cursor + " outside path of length " + path.size());
        }
        return new Packet(nextId++, List.copyOf(path), injectionRound, cursor);
    }

    /**
     * @return the id the next created packet will receive
     */
    public long peekNextId() {
        return nextId;
    }
}
