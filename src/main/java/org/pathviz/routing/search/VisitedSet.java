package org.pathviz.routing.search;

import java.util.BitSet;

/**
 * Bit-per-node membership set used for settled and first-improved tracking.
 * <p>
 * Not thread-safe; one instance belongs to one query.
 */
public class VisitedSet {

    private final BitSet visited;

    /**
     * @param initialCapacity expected node count.
     */
    public VisitedSet(int initialCapacity) {
        this.visited = new BitSet(initialCapacity);
    }

    /**
     * Marks a node.
     *
     * @return {@code true} if the node was not marked before.
     */
    public boolean markVisited(int nodeId) {
        if (visited.get(nodeId)) {
            return false;
        }
        visited.set(nodeId);
        return true;
    }

    public boolean isVisited(int nodeId) {
        return visited.get(nodeId);
    }

    public int size() {
        return visited.cardinality();
    }
}
