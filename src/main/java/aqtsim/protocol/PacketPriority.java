package aqtsim.protocol;

import aqtsim.packet.Packet;

import java.util.Comparator;
import java.util.List;

/**
 * Longest-in-system priority: the packet injected earlier wins, ties go to the smaller id.
 * "Oldest" means highest priority and "youngest" lowest priority.
 */
public final class PacketPriority {

    private PacketPriority() {}

    /** Orders packets from highest to lowest priority. */
    public static final Comparator<Packet> HIGHEST_FIRST =
            Comparator.comparingLong(Packet::injectionRound).thenComparingLong(Packet::id);

    /**
     * @return true if {@code p} has strictly higher priority than {@code q}
     */
    public static boolean higherPriority(Packet p, Packet q) {
        return HIGHEST_FIRST.compare(p, q) < 0;
    }

    /**
     * @return index of the highest-priority packet, or -1 for an empty buffer
     */
    public static int oldestIndex(List<Packet> buffer) {
        int best = -1;
        for (int i = 0; i < buffer.size(); i++) {
            if (best < 0 || higherPriority(buffer.get(i), buffer.get(best))) {
                best = i;
            }
        }
        return best;
    }

    /**
     * @return index of the lowest-priority packet, or -1 for an empty buffer
     */
    public static int youngestIndex(List<Packet> buffer) {
        int worst = -1;
        for (int i = 0; i < buffer.size(); i++) {
            if (worst < 0 || higherPriority(buffer.get(worst), buffer.get(i))) {
                worst = i;
            }
        }
        return worst;
    }
}
