package org.pathviz.routing.graph;

/**
 * One outgoing adjacency entry.
 *
 * @param nodeId destination node name.
 * @param weight edge weight.
 */
public record Neighbor(String nodeId, double weight) {
}
