package aqtsim.adversary;

import aqtsim.network.BufferNetwork;
import aqtsim.packet.Packet;
import aqtsim.packet.PacketFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Single-destination random adversary for path networks. Every round it injects one packet whose
 * destination is the last node and whose starting buffer is chosen uniformly at random.
 *
 * Every instance has a seed, drawn at random when none is given, so any run can be repeated.
 */
public final class PathRandomAdversary implements Adversary {

    private final long seed;
    private final Random random;
    private final PacketFactory factory = new PacketFactory();

    private PathRandomAdversary(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    public static PathRandomAdversary seeded(long seed) {
        return new PathRandomAdversary(seed);
    }

    /**
     * Creates an adversary with a freshly drawn seed. The seed is available from {@link #seed()}.
     */
    public static PathRandomAdversary withRandomSeed() {
        return new PathRandomAdversary(new Random().nextLong());
    }

    @Override
    public List<Packet> nextPackets(BufferNetwork network, long round) {
        int destination = network.nodeCount() - 1;
        if (destination < 1) {
            throw new IllegalStateException("Path random adversary needs a network with at least one buffer");
        }
        List<Integer> path = new ArrayList<>(destination + 1);
        for (int node = 0; node <= destination; node++) {
            path.add(node);
        }
        int source = random.nextInt(destination);
        return List.of(factory.create(path, round, source));
    }

    public long seed() {
        return seed;
    }

    @Override
    public AdversaryType type() {
        return AdversaryType.PATH_RANDOM;
    }
}
