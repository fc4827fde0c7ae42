package aqtsim.protocol;

import aqtsim.network.BufferNetwork;
import aqtsim.packet.Packet;

import java.util.ArrayList;
import java.util.List;

/**
 * OED with swap on a path network whose buffers are the edges {@code (i, i + 1)}. Each buffer
 * forwards at most one packet and may additionally send one packet backward.
 *
 * Buffer x forwards its oldest packet if x and x+1 satisfy the OED criterion, or if the oldest
 * packet in x is older than the youngest in x+1. The last buffer always forwards when non-empty.
 *
 * Buffer x sends its youngest packet backward if x-1 is non-empty, x-1 and x fail the OED
 * criterion, and the oldest packet in x-1 is older than the youngest in x.
 *
 * The OED criterion for x and x+1 holds when L(x) > L(x+1), or L(x) == L(x+1) and L(x) is odd.
 *
 * All loads and extreme packets are read before any buffer is modified.
 */
public final class OedWithSwap implements Protocol {

    @Override
    public List<Packet> forwardPackets(BufferNetwork network) {
        Snapshot snapshot = Snapshot.of(network);
        int buffers = snapshot.size();
        boolean[] oed = oedCriterion(snapshot);

        boolean[] forward = new boolean[buffers];
        boolean[] backward = new boolean[buffers];
        for (int i = 0; i < buffers; i++) {
            if (snapshot.load(i) == 0) continue;
            forward[i] = shouldForward(snapshot, oed, i);
            backward[i] = shouldSendBackward(snapshot, oed, i);
        }

        List<Packet> moved = new ArrayList<>();
        for (int i = 0; i < buffers; i++) {
            List<Packet> buffer = network.peekMut(i, i + 1).orElseThrow();
            Packet oldest = snapshot.oldest(i);
            Packet youngest = snapshot.youngest(i);
            if (forward[i]) {
                Moves.take(buffer, oldest);
                oldest.advance();
                moved.add(oldest);
            }
            // A lone packet cannot move both ways; forwarding wins.
            if (backward[i] && !(forward[i] && youngest == oldest)) {
                Moves.take(buffer, youngest);
                youngest.retreat();
                moved.add(youngest);
            }
        }
        return Moves.replay(this, moved, network);
    }

    private static boolean[] oedCriterion(Snapshot snapshot) {
        int buffers = snapshot.size();
        boolean[] oed = new boolean[buffers];
        for (int i = 0; i < buffers - 1; i++) {
            int load = snapshot.load(i);
            int next = snapshot.load(i + 1);
            oed[i] = load > next || (load == next && load % 2 == 1);
        }
        if (buffers > 0) {
            oed[buffers - 1] = snapshot.load(buffers - 1) != 0;
        }
        return oed;
    }

    private static boolean shouldForward(Snapshot snapshot, boolean[] oed, int i) {
        if (i == snapshot.size() - 1 || oed[i]) {
            return true;
        }
        return snapshot.load(i + 1) > 0
                && PacketPriority.higherPriority(snapshot.oldest(i), snapshot.youngest(i + 1));
    }

    private static boolean shouldSendBackward(Snapshot snapshot, boolean[] oed, int i) {
        if (i == 0 || snapshot.load(i - 1) == 0 || oed[i - 1]) {
            return false;
        }
        Packet youngest = snapshot.youngest(i);
        return youngest.cursor() > 0 && PacketPriority.higherPriority(snapshot.oldest(i - 1), youngest);
    }

    @Override
    public int capacity() {
        return 1;
    }

    @Override
    public ProtocolType type() {
        return ProtocolType.OED_WITH_SWAP;
    }

    @Override
    public String toString() {
        return "OedWithSwap";
    }

    /**
     * Loads and extreme packets of every path buffer, taken before the round's moves.
     */
    private record Snapshot(int[] loads, Packet[] oldest, Packet[] youngest) {

        static Snapshot of(BufferNetwork network) {
            int buffers = Math.max(0, network.nodeCount() - 1);
            int[] loads = new int[buffers];
            Packet[] oldest = new Packet[buffers];
            Packet[] youngest = new Packet[buffers];
            for (int i = 0; i < buffers; i++) {
                final int from = i;
                List<Packet> buffer = network.peek(i, i + 1)
                        .orElseThrow(() -> new IllegalStateException(
                                "OED with swap requires a path network, missing edge " + from + " -> " + (from + 1)));
                loads[i] = buffer.size();
                if (!buffer.isEmpty()) {
                    oldest[i] = buffer.get(PacketPriority.oldestIndex(buffer));
                    youngest[i] = buffer.get(PacketPriority.youngestIndex(buffer));
                }
            }
            return new Snapshot(loads, oldest, youngest);
        }

        int size() {
            return loads.length;
        }

        int load(int i) {
            return loads[i];
        }

        Packet oldest(int i) {
            return oldest[i];
        }

        Packet youngest(int i) {
            return youngest[i];
        }
    }
}
