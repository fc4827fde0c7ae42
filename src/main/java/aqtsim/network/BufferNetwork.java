package aqtsim.network;

import aqtsim.packet.Packet;

import java.util.*;

/**
 * Directed graph of nodes where every edge owns an ordered queue ("buffer") of packets.
 *
 * Nodes are referenced by dense integer index, assigned from 0 in creation order. Buffers are
 * referenced by their (from, to) pair. There are no references between nodes; the node list owns
 * every buffer.
 *
 * Topology is fixed before a simulation starts:
 * - addNode() appends a node and returns its index
 * - addEdge(from, to) creates an empty buffer; unknown ids or duplicate pairs are fatal
 *
 * Buffer access:
 * - push() appends to the back of a buffer
 * - peek() / peekMut() return a read-only or live view, empty if the edge does not exist
 * - drain() removes and returns everything in a buffer
 *
 * The network does not enforce any capacity; forwarding protocols own that concern.
 */
public class BufferNetwork {

    private final List<Node> nodes = new ArrayList<>();

    /**
     * Adds a new node.
     *
     * @return the index of the new node
     */
    public int addNode() {
        nodes.add(new Node());
        return nodes.size() - 1;
    }

    /**
     * Adds an empty buffer from one node to another.
     *
     * @throws IndexOutOfBoundsException if either node does not exist
     * @throws IllegalArgumentException if there is already a buffer between these nodes
     */
    public void addEdge(int from, int to) {
        checkNode(from);
        checkNode(to);
        Map<Integer, List<Packet>> buffers = nodes.get(from).buffers;
        if (buffers.containsKey(to)) {
            throw new IllegalArgumentException("There is already an edge buffer between nodes " + from + " and " + to);
        }
        buffers.put(to, new ArrayList<>());
    }

    /**
     * @return the nodes reachable over one outgoing edge, in edge-addition order
     */
    public Set<Integer> neighbors(int node) {
        checkNode(node);
        return Collections.unmodifiableSet(new LinkedHashSet<>(nodes.get(node).buffers.keySet()));
    }

    public int nodeCount() {
        return nodes.size();
    }

    /**
     * @return all node indices in ascending order
     */
    public List<Integer> nodes() {
        List<Integer> result = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            result.add(i);
        }
        return result;
    }

    /**
     * Returns every edge, grouped by ascending from-node, then in the order the edges of that node
     * were added. Protocols iterate in this order, so it must stay stable.
     */
    public List<EdgeId> edges() {
        List<EdgeId> result = new ArrayList<>();
        for (int from = 0; from < nodes.size(); from++) {
            for (Integer to : nodes.get(from).buffers.keySet()) {
                result.add(new EdgeId(from, to));
            }
        }
        return result;
    }

    public boolean hasEdge(int from, int to) {
        checkNode(from);
        checkNode(to);
        return nodes.get(from).buffers.containsKey(to);
    }

    /**
     * Appends a packet to the back of the named buffer.
     *
     * @throws IllegalArgumentException if there is no such edge
     */
    public void push(Packet packet, int from, int to) {
        Objects.requireNonNull(packet, "Packet cannot be null");
        List<Packet> buffer = peekMut(from, to)
                .orElseThrow(() -> new IllegalArgumentException("No edge buffer between nodes " + from + " and " + to));
        buffer.add(packet);
    }

    /**
     * @return a read-only view of the buffer, or empty if there is no such edge
     */
    public Optional<List<Packet>> peek(int from, int to) {
        return peekMut(from, to).map(Collections::unmodifiableList);
    }

    /**
     * @return the live buffer, or empty if there is no such edge
     */
    public Optional<List<Packet>> peekMut(int from, int to) {
        checkNode(from);
        checkNode(to);
        return Optional.ofNullable(nodes.get(from).buffers.get(to));
    }

    /**
     * Removes and returns every packet in the buffer, leaving it empty.
     *
     * @return the former contents in buffer order, or empty if there is no such edge
     */
    public Optional<List<Packet>> drain(int from, int to) {
        checkNode(from);
        checkNode(to);
        Map<Integer, List<Packet>> buffers = nodes.get(from).buffers;
        if (!buffers.containsKey(to)) {
            return Optional.empty();
        }
        return Optional.of(buffers.put(to, new ArrayList<>()));
    }

    /**
     * @return the number of packets in the buffer, 0 if there is no such edge
     */
    public int load(int from, int to) {
        return peekMut(from, to).map(List::size).orElse(0);
    }

    public int totalLoad() {
        int total = 0;
        for (Node node : nodes) {
            for (List<Packet> buffer : node.buffers.values()) {
                total += buffer.size();
            }
        }
        return total;
    }

    private void checkNode(int node) {
        if (node < 0 || node >= nodes.size()) {
            throw new IndexOutOfBoundsException("No node with index " + node + " in this network, size: " + nodes.size());
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (EdgeId edge : edges()) {
            sb.append(edge).append(": ").append(nodes.get(edge.from()).buffers.get(edge.to())).append('\n');
        }
        return sb.toString();
    }

    private static final class Node {
        // Insertion order of this map defines the per-node edge order.
        private final Map<Integer, List<Packet>> buffers = new LinkedHashMap<>();
    }
}
