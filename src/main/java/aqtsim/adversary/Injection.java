package aqtsim.adversary;

import java.util.List;
import java.util.Objects;

/**
 * A packet to be created by a {@link PresetAdversary}: its path and the position it starts at.
 */
public record Injection(List<Integer> path, int cursor) {

    public Injection {
        Objects.requireNonNull(path, "Path cannot be null");
        path = List.copyOf(path);
        if (cursor < 0 || cursor >= path.size() - 1) {
            throw new IllegalArgumentException("Injection cursor " + cursor + " must leave at least one hop on a path of length " + path.size());
        }
    }

    public static Injection of(List<Integer> path, int cursor) {
        return new Injection(path, cursor);
    }
}
