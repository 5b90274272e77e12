package org.pathviz.routing.graph;

import java.util.Objects;

/**
 * Directed weighted edge in caller node-name space.
 *
 * @param from origin node name.
 * @param to destination node name.
 * @param weight signed edge weight.
 */
public record Edge(String from, String to, double weight) {
    public Edge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    /**
     * Convenience factory mirroring builder argument order.
     */
    public static Edge of(String from, String to, double weight) {
        return new Edge(from, to, weight);
    }
}
