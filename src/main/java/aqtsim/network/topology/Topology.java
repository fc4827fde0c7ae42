package aqtsim.network.topology;

import aqtsim.network.BufferNetwork;

import java.util.*;

/**
 * Immutable adjacency description of a buffer network: entry {@code i} lists the successors of
 * node {@code i} in edge-addition order. This is the shape networks take in configuration files.
 */
public class Topology {

    private final List<List<Integer>> adjacency;

    /**
     * Creates a topology from an adjacency list.
     *
     * @param adjacency successor lists indexed by node (must not be null)
     * @throws NullPointerException if adjacency or any entry is null
     */
    public Topology(List<List<Integer>> adjacency) {
        Objects.requireNonNull(adjacency, "Adjacency cannot be null");
        List<List<Integer>> copy = new ArrayList<>(adjacency.size());
        for (List<Integer> successors : adjacency) {
            copy.add(List.copyOf(Objects.requireNonNull(successors, "Successor list cannot be null")));
        }
        this.adjacency = List.copyOf(copy);
    }

    public static Topology of(List<List<Integer>> adjacency) {
        return new Topology(adjacency);
    }

    /**
     * Path network with nodes {@code 0..numBuffers} and edges {@code (i, i + 1)}.
     *
     * @throws IllegalArgumentException if numBuffers is negative
     */
    public static Topology path(int numBuffers) {
        if (numBuffers < 0) {
            throw new IllegalArgumentException("Number of buffers cannot be negative: " + numBuffers);
        }
        List<List<Integer>> adjacency = new ArrayList<>();
        for (int i = 0; i < numBuffers; i++) {
            adjacency.add(List.of(i + 1));
        }
        adjacency.add(List.of());
        return new Topology(adjacency);
    }

    /**
     * Captures the shape of an existing network.
     */
    public static Topology fromNetwork(BufferNetwork network) {
        List<List<Integer>> adjacency = new ArrayList<>();
        for (int node : network.nodes()) {
            adjacency.add(new ArrayList<>(network.neighbors(node)));
        }
        return new Topology(adjacency);
    }

    /**
     * Builds an empty network with this shape.
     *
     * @throws IndexOutOfBoundsException if a successor is not a node of this topology
     * @throws IllegalArgumentException if a successor is listed twice for the same node
     */
    public BufferNetwork toNetwork() {
        BufferNetwork network = new BufferNetwork();
        for (int i = 0; i < adjacency.size(); i++) {
            network.addNode();
        }
        for (int from = 0; from < adjacency.size(); from++) {
            for (int to : adjacency.get(from)) {
                network.addEdge(from, to);
            }
        }
        return network;
    }

    public List<List<Integer>> adjacency() {
        return adjacency;
    }

    public int nodeCount() {
        return adjacency.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Topology other)) return false;
        return adjacency.equals(other.adjacency);
    }

    @Override
    public int hashCode() {
        return adjacency.hashCode();
    }

    @Override
    public String toString() {
        return "Topology" + adjacency;
    }
}
