package aqtsim.network;

/**
 * Identifies an edge buffer by its ordered pair of node indices.
 */
public record EdgeId(int from, int to) {

    public static EdgeId of(int from, int to) {
        return new EdgeId(from, to);
    }

    @Override
    public String toString() {
        return from + ", " + to;
    }
}
